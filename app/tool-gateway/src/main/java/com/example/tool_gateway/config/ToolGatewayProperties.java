/*
 * どこで: Tool Gateway 設定
 * 何を: 下流URL/キャッシュTTL/IdP userinfo URL を1つの設定値オブジェクトへまとめる
 * なぜ: 起動時に一度だけ解決し、各コンポーネントへコンストラクタで渡すため
 */
package com.example.tool_gateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "tool-gateway")
@Validated
public record ToolGatewayProperties(
    @Valid @NotNull Downstream downstream,
    @Valid @NotNull Cache cache,
    @Valid @NotNull Identity identity) {

  public ToolGatewayProperties {
    downstream = downstream == null ? new Downstream(null, null, null, null) : downstream;
    cache = cache == null ? new Cache(null, null) : cache;
    identity = identity == null ? new Identity(null, null, null) : identity;
  }

  public record Downstream(
      String baseUrl, String entitiesPath, Duration connectTimeout, Duration readTimeout) {

    public Downstream {
      // 未設定/空文字はどちらも「下流なし」(デモモード)として扱う
      baseUrl = baseUrl == null || baseUrl.isBlank() ? null : stripTrailingSlash(baseUrl.trim());
      entitiesPath = entitiesPath == null || entitiesPath.isBlank() ? "/entities" : entitiesPath;
      connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
      readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
    }

    public boolean isConfigured() {
      return baseUrl != null;
    }

    @AssertTrue(message = "tool-gateway.downstream timeouts must be positive")
    public boolean isTimeoutsPositive() {
      return isPositive(connectTimeout) && isPositive(readTimeout);
    }

    private static String stripTrailingSlash(String value) {
      return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
  }

  public record Cache(@Positive Long ttlSeconds, Boolean refreshEnabled) {

    public Cache {
      ttlSeconds = ttlSeconds == null ? 300L : ttlSeconds;
      refreshEnabled = refreshEnabled == null ? Boolean.TRUE : refreshEnabled;
    }

    public Duration ttl() {
      return Duration.ofSeconds(ttlSeconds);
    }
  }

  public record Identity(
      @NotBlank String userinfoUrl, Duration connectTimeout, Duration readTimeout) {

    public Identity {
      userinfoUrl =
          userinfoUrl == null || userinfoUrl.isBlank() ? "https://oauth.com/userinfo" : userinfoUrl;
      connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
      readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
    }

    @AssertTrue(message = "tool-gateway.identity timeouts must be positive")
    public boolean isTimeoutsPositive() {
      return isPositive(connectTimeout) && isPositive(readTimeout);
    }
  }

  private static boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
