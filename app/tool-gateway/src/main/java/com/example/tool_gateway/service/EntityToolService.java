/*
 * どこで: Tool Gateway サービス層
 * 何を: list_entities/get_entity/refresh_cache の業務ロジックを提供する
 * なぜ: Layer 4 のカテゴリ絞り込みと stale 注記をツール応答へ一貫して適用するため
 */
package com.example.tool_gateway.service;

import com.example.tool_gateway.auth.CategoryFilter;
import com.example.tool_gateway.cache.CacheRefresher;
import com.example.tool_gateway.model.CacheSnapshot;
import com.example.tool_gateway.model.EntityRecord;
import com.example.tool_gateway.model.UserProfile;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EntityToolService {

  @VisibleForTesting static final String STALE_WARNING = "[Warning: cached data may be stale]";
  @VisibleForTesting
  static final String NO_MATCH = "No entities found matching your entitlements and filter.";
  @VisibleForTesting
  static final String REFRESH_UNAVAILABLE =
      "No downstream API configured; cache refresh unavailable.";

  private final CacheRefresher cacheRefresher;
  private final Clock clock;

  public String listEntities(UserProfile profile, String category) {
    // リクエスト開始時点の参照を最後まで使い、途中の差し替えを混ぜない
    final CacheSnapshot snapshot = cacheRefresher.current();
    final List<String> lines = new ArrayList<>();
    for (EntityRecord entity : CategoryFilter.filter(profile, snapshot.entities().values())) {
      // 省略時のみ絞り込まない。空文字は空文字カテゴリとして比較する
      if (category != null && !category.equals(entity.category())) {
        continue;
      }
      lines.add(
          "- " + entity.name() + " (id=" + entity.id() + ", category=" + entity.category() + ")");
    }
    if (lines.isEmpty()) {
      return NO_MATCH;
    }
    return annotateIfStale(snapshot, String.join("\n", lines));
  }

  public String getEntity(UserProfile profile, String entityId) {
    final CacheSnapshot snapshot = cacheRefresher.current();
    final Optional<EntityRecord> found = snapshot.find(entityId);
    if (found.isEmpty()) {
      return "Entity '" + entityId + "' not found.";
    }
    final EntityRecord entity = found.get();
    if (!CategoryFilter.permits(profile, entity)) {
      return "Access denied: you do not have entitlements for category '"
          + entity.category()
          + "'.";
    }
    final String body =
        "Name: "
            + entity.name()
            + "\nID: "
            + entity.id()
            + "\nCategory: "
            + entity.category()
            + "\nMetadata: "
            + entity.metadata();
    return annotateIfStale(snapshot, body);
  }

  public String refreshCache() {
    if (!cacheRefresher.isDownstreamConfigured()) {
      return REFRESH_UNAVAILABLE;
    }
    final int count = cacheRefresher.forceRefresh();
    return "Cache refreshed. " + count + " entities loaded.";
  }

  private String annotateIfStale(CacheSnapshot snapshot, String body) {
    if (snapshot.isStale(clock.instant())) {
      return body + "\n\n" + STALE_WARNING;
    }
    return body;
  }
}
