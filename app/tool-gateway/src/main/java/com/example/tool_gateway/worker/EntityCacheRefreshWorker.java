/*
 * どこで: Tool Gateway キャッシュ更新ワーカー
 * 何を: TTL 間隔でエンティティキャッシュの再取得を起動する
 * なぜ: リクエスト処理とは独立して、古くなったスナップショットを差し替えるため
 */
package com.example.tool_gateway.worker;

import com.example.tool_gateway.cache.CacheRefresher;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "tool-gateway.cache.refresh-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class EntityCacheRefreshWorker {

  private final CacheRefresher cacheRefresher;

  @Scheduled(
      fixedDelayString = "${tool-gateway.cache.ttl-seconds:300}",
      initialDelayString = "${tool-gateway.cache.ttl-seconds:300}",
      timeUnit = TimeUnit.SECONDS)
  public void run() {
    cacheRefresher.scheduledCycle();
  }
}
