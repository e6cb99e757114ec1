/*
 * どこで: Tool Gateway キャッシュ初期化
 * 何を: 起動時にエンティティキャッシュを先行ロードする
 * なぜ: 下流が設定済みなのに取得できない場合は起動自体を失敗させるため
 */
package com.example.tool_gateway.cache;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EntityCacheBootstrap {

  private final CacheRefresher cacheRefresher;

  @PostConstruct
  public void start() {
    try {
      cacheRefresher.initialLoad();
    } catch (UpstreamFetchException ex) {
      throw new IllegalStateException(
          "initial entity cache load failed reason=" + ex.reason(), ex);
    }
  }
}
