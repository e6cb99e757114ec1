/*
 * どこで: Common 共通設定
 * 何を: UTC の Clock を DI 可能にする
 * なぜ: キャッシュ鮮度判定と更新時刻で同一の時刻源を使い、テストで差し替えられるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
