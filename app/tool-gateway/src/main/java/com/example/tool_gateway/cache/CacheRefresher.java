/*
 * どこで: Tool Gateway キャッシュ層
 * 何を: スナップショットの初回ロード/定期更新/手動更新を担う唯一の書き手
 * なぜ: 上流障害時は直前のスナップショットを配信し続け、手動更新では失敗を返すため
 */
package com.example.tool_gateway.cache;

import com.example.tool_gateway.model.CacheSnapshot;
import com.example.tool_gateway.model.EntityRecord;
import com.example.tool_gateway.service.ToolGatewayMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

public class CacheRefresher {

  private static final Logger logger = LoggerFactory.getLogger(CacheRefresher.class);

  static final String TRIGGER_INITIAL = "initial";
  static final String TRIGGER_SCHEDULED = "scheduled";
  static final String TRIGGER_MANUAL = "manual";

  private final SnapshotHolder holder;
  @Nullable private final DownstreamFetcher fetcher;
  private final Duration ttl;
  private final Clock clock;
  private final ToolGatewayMetrics metrics;
  private final ReentrantLock writeLock = new ReentrantLock();

  public CacheRefresher(
      SnapshotHolder holder,
      @Nullable DownstreamFetcher fetcher,
      Duration ttl,
      Clock clock,
      ToolGatewayMetrics metrics) {
    this.holder = holder;
    this.fetcher = fetcher;
    this.ttl = ttl;
    this.clock = clock;
    this.metrics = metrics;
  }

  public boolean isDownstreamConfigured() {
    return fetcher != null;
  }

  public CacheSnapshot current() {
    return holder.current();
  }

  public CacheSnapshot build() {
    if (fetcher == null) {
      throw new DownstreamUnavailableException("no downstream API configured");
    }
    final Map<String, EntityRecord> entities = fetcher.fetchAll();
    return new CacheSnapshot(entities, clock.instant(), ttl);
  }

  public void initialLoad() {
    if (fetcher == null) {
      logger.warn("no downstream API configured; starting with an empty entity cache");
      swap(CacheSnapshot.empty(clock.instant(), ttl));
      return;
    }
    // 起動時の失敗はそのまま投げ、壊れた上流のまま配信を始めない
    final CacheSnapshot snapshot = refreshUnderLock(TRIGGER_INITIAL);
    logger.info(
        "entity cache loaded entities={} ttlSeconds={}", snapshot.size(), snapshot.ttlSeconds());
  }

  public void scheduledCycle() {
    if (fetcher == null) {
      return;
    }
    try {
      final CacheSnapshot snapshot = refreshUnderLock(TRIGGER_SCHEDULED);
      logger.info(
          "entity cache refreshed entities={} refreshedAt={}",
          snapshot.size(),
          snapshot.lastRefreshedAt());
    } catch (RuntimeException ex) {
      logger.warn(
          "entity cache refresh failed; serving stale data lastRefreshedAt={}",
          holder.current().lastRefreshedAt(),
          ex);
    }
  }

  public int forceRefresh() {
    if (fetcher == null) {
      throw new DownstreamUnavailableException("no downstream API configured");
    }
    final CacheSnapshot snapshot = refreshUnderLock(TRIGGER_MANUAL);
    logger.info("entity cache refreshed manually entities={}", snapshot.size());
    return snapshot.size();
  }

  private CacheSnapshot refreshUnderLock(String trigger) {
    writeLock.lock();
    // ロック待ちは計測に含めない
    final Instant startedAt = clock.instant();
    try {
      final CacheSnapshot snapshot = build();
      swap(snapshot);
      metrics.recordRefreshResult(trigger, "success", elapsedSince(startedAt));
      return snapshot;
    } catch (RuntimeException ex) {
      metrics.recordRefreshResult(trigger, "error", elapsedSince(startedAt));
      throw ex;
    } finally {
      writeLock.unlock();
    }
  }

  private void swap(CacheSnapshot snapshot) {
    holder.replace(snapshot);
    metrics.updateCachedEntities(snapshot.size());
  }

  private Duration elapsedSince(Instant startedAt) {
    final Duration elapsed = Duration.between(startedAt, clock.instant());
    return elapsed.isNegative() ? Duration.ZERO : elapsed;
  }
}
