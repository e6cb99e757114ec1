/*
 * どこで: Tool Gateway サービス層
 * 何を: キャッシュの概要と健全性を読み取り専用で返す
 * なぜ: 件数/カテゴリ/最終更新/TTL/stale を運用側から確認できるようにするため
 */
package com.example.tool_gateway.service;

import com.example.tool_gateway.cache.CacheRefresher;
import com.example.tool_gateway.model.CacheSnapshot;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CacheStatusService {

  private final CacheRefresher cacheRefresher;
  private final Clock clock;

  public String summary() {
    final CacheSnapshot snapshot = cacheRefresher.current();
    final List<String> categories = snapshot.categories();
    return "Total entities: "
        + snapshot.size()
        + "\nCategories: "
        + (categories.isEmpty() ? "(none)" : String.join(", ", categories))
        + "\nLast refreshed: "
        + snapshot.lastRefreshedAt()
        + "\nTTL: "
        + snapshot.ttlSeconds()
        + "s\nStale: "
        + snapshot.isStale(clock.instant());
  }

  public String health() {
    final CacheSnapshot snapshot = cacheRefresher.current();
    final String status = snapshot.isStale(clock.instant()) ? "stale" : "healthy";
    return "status: " + status + "\nlast_refresh: " + snapshot.lastRefreshedAt();
  }
}
