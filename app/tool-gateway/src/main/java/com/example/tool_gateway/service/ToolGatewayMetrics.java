/*
 * どこで: Tool Gateway サービス層
 * 何を: キャッシュ更新/権限解決/認可判定のアプリ固有メトリクスを記録する
 * なぜ: 上流障害時の stale 配信や認可拒否の増加を Prometheus から直接観測できるようにするため
 */
package com.example.tool_gateway.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ToolGatewayMetrics {

  private static final String METRIC_CACHE_REFRESH_TOTAL = "tool_gateway.cache.refresh.total";
  private static final String METRIC_CACHE_REFRESH_DURATION = "tool_gateway.cache.refresh.duration";
  private static final String METRIC_CACHE_ENTITIES = "tool_gateway.cache.entities";
  private static final String METRIC_ENTITLEMENT_LOOKUP_TOTAL =
      "tool_gateway.entitlement.lookup.total";
  private static final String METRIC_ENTITLEMENT_CACHE_SIZE = "tool_gateway.entitlement.cache.size";
  private static final String METRIC_AUTHORIZATION_TOTAL = "tool_gateway.authorization.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger cachedEntities = new AtomicInteger(0);
  private final AtomicInteger entitlementCacheSize = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> refreshCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> refreshTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> lookupCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> authorizationCounters = new ConcurrentHashMap<>();

  public ToolGatewayMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_CACHE_ENTITIES, cachedEntities, AtomicInteger::get)
        .description("Number of entities in the current cache snapshot")
        .register(meterRegistry);
    Gauge.builder(METRIC_ENTITLEMENT_CACHE_SIZE, entitlementCacheSize, AtomicInteger::get)
        .description("Number of credentials with cached entitlements")
        .register(meterRegistry);
  }

  public void recordRefreshResult(String trigger, String result, Duration duration) {
    final String key = trigger + "|" + result;
    refreshCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_CACHE_REFRESH_TOTAL)
                    .description("Entity cache refresh outcomes")
                    .tags(Tags.of("trigger", trigger, "result", result))
                    .register(meterRegistry))
        .increment();
    refreshTimers
        .computeIfAbsent(
            trigger,
            ignored ->
                Timer.builder(METRIC_CACHE_REFRESH_DURATION)
                    .description("Entity cache refresh duration including the downstream fetch")
                    .tags(Tags.of("trigger", trigger))
                    .register(meterRegistry))
        .record(duration);
  }

  public void updateCachedEntities(int count) {
    cachedEntities.set(Math.max(count, 0));
  }

  public void recordEntitlementLookup(String result) {
    lookupCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_ENTITLEMENT_LOOKUP_TOTAL)
                    .description("Entitlement resolution outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void updateEntitlementCacheSize(int size) {
    entitlementCacheSize.set(Math.max(size, 0));
  }

  public void recordAuthorization(String tool, String outcome) {
    final String key = tool + "|" + outcome;
    authorizationCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_AUTHORIZATION_TOTAL)
                    .description("Tool call authorization decisions")
                    .tags(Tags.of("tool", tool, "outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }
}
