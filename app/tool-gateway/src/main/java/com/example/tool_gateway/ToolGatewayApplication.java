/*
 * どこで: Tool Gateway アプリのエントリポイント
 * 何を: Spring Boot の起動とスケジューラ有効化を行う
 * なぜ: ツール API + キャッシュ更新ワーカーを単一アプリとして起動するため
 */
package com.example.tool_gateway;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@Import(TimeConfig.class)
public class ToolGatewayApplication {

  public static void main(String[] args) {
    SpringApplication.run(ToolGatewayApplication.class, args);
  }
}
