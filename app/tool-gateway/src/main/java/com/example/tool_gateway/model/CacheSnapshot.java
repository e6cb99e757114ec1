/*
 * どこで: Tool Gateway モデル
 * 何を: ある時点の全エンティティと更新時刻/TTL をまとめた不変スナップショット
 * なぜ: 参照の差し替えだけで更新を原子的に見せるため
 */
package com.example.tool_gateway.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

public final class CacheSnapshot {

  private final Map<String, EntityRecord> entities;
  private final Instant lastRefreshedAt;
  private final Duration ttl;

  public CacheSnapshot(Map<String, EntityRecord> entities, Instant lastRefreshedAt, Duration ttl) {
    Objects.requireNonNull(entities, "entities");
    this.lastRefreshedAt = Objects.requireNonNull(lastRefreshedAt, "lastRefreshedAt");
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    // 上流の並び順を保ったまま読み取り専用にする
    this.entities = Collections.unmodifiableMap(new LinkedHashMap<>(entities));
  }

  public static CacheSnapshot empty(Instant now, Duration ttl) {
    return new CacheSnapshot(Map.of(), now, ttl);
  }

  public Map<String, EntityRecord> entities() {
    return entities;
  }

  public Instant lastRefreshedAt() {
    return lastRefreshedAt;
  }

  public Duration ttl() {
    return ttl;
  }

  public long ttlSeconds() {
    return ttl.toSeconds();
  }

  public int size() {
    return entities.size();
  }

  public Optional<EntityRecord> find(String entityId) {
    return Optional.ofNullable(entities.get(entityId));
  }

  public List<String> categories() {
    final TreeSet<String> categories = new TreeSet<>();
    for (EntityRecord entity : entities.values()) {
      categories.add(entity.category());
    }
    return List.copyOf(categories);
  }

  public boolean isStale(Instant now) {
    return Duration.between(lastRefreshedAt, now).compareTo(ttl) > 0;
  }
}
