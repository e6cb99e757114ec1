/*
 * どこで: Tool Gateway 設定
 * 何を: 下流/IdP 用 RestClient とキャッシュ・認可コンポーネントを組み立てる
 * なぜ: 設定値オブジェクトから明示的なコンストラクタ注入で依存を渡すため
 */
package com.example.tool_gateway.config;

import com.example.tool_gateway.auth.AuthorizationGate;
import com.example.tool_gateway.auth.EntitlementResolver;
import com.example.tool_gateway.auth.IdentityVerifier;
import com.example.tool_gateway.auth.UserInfoIdentityVerifier;
import com.example.tool_gateway.cache.CacheRefresher;
import com.example.tool_gateway.cache.DownstreamEntityClient;
import com.example.tool_gateway.cache.SnapshotHolder;
import com.example.tool_gateway.model.CacheSnapshot;
import com.example.tool_gateway.service.ToolGatewayMetrics;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(ToolGatewayProperties.class)
public class ToolGatewayConfig {

  private static final Logger logger = LoggerFactory.getLogger(ToolGatewayConfig.class);

  @Bean
  SnapshotHolder snapshotHolder(ToolGatewayProperties properties, Clock clock) {
    // 初回ロードまでのプレースホルダ。EntityCacheBootstrap が起動時に差し替える
    return new SnapshotHolder(CacheSnapshot.empty(clock.instant(), properties.cache().ttl()));
  }

  @Bean
  CacheRefresher cacheRefresher(
      ToolGatewayProperties properties,
      SnapshotHolder snapshotHolder,
      RestClient.Builder restClientBuilder,
      Clock clock,
      ToolGatewayMetrics metrics) {
    final ToolGatewayProperties.Downstream downstream = properties.downstream();
    DownstreamEntityClient fetcher = null;
    if (downstream.isConfigured()) {
      final RestClient restClient =
          restClientBuilder
              .clone()
              .baseUrl(downstream.baseUrl())
              .requestFactory(
                  requestFactory(downstream.connectTimeout(), downstream.readTimeout()))
              .build();
      fetcher = new DownstreamEntityClient(restClient, downstream.entitiesPath());
      logger.info(
          "downstream configured baseUrl={} entitiesPath={}",
          downstream.baseUrl(),
          downstream.entitiesPath());
    }
    return new CacheRefresher(snapshotHolder, fetcher, properties.cache().ttl(), clock, metrics);
  }

  @Bean
  IdentityVerifier identityVerifier(
      ToolGatewayProperties properties, RestClient.Builder restClientBuilder) {
    final ToolGatewayProperties.Identity identity = properties.identity();
    final RestClient restClient =
        restClientBuilder
            .clone()
            .requestFactory(requestFactory(identity.connectTimeout(), identity.readTimeout()))
            .build();
    return new UserInfoIdentityVerifier(restClient, identity.userinfoUrl());
  }

  @Bean
  EntitlementResolver entitlementResolver(
      IdentityVerifier identityVerifier, ToolGatewayMetrics metrics) {
    return new EntitlementResolver(identityVerifier, metrics);
  }

  @Bean
  AuthorizationGate authorizationGate(EntitlementResolver entitlementResolver) {
    return new AuthorizationGate(entitlementResolver);
  }

  private SimpleClientHttpRequestFactory requestFactory(
      Duration connectTimeout, Duration readTimeout) {
    final SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(connectTimeout);
    factory.setReadTimeout(readTimeout);
    return factory;
  }
}
