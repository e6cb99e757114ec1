/*
 * どこで: Tool Gateway 認可層
 * 何を: 資格情報ハッシュをキーに UserProfile をプロセス存続中キャッシュする
 * なぜ: 同一セッションからの繰り返し呼び出しで IdP 検証を省くため
 */
package com.example.tool_gateway.auth;

import com.example.common.Digests;
import com.example.tool_gateway.model.UserProfile;
import com.example.tool_gateway.service.ToolGatewayMetrics;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class EntitlementResolver {

  private static final Logger logger = LoggerFactory.getLogger(EntitlementResolver.class);

  private final IdentityVerifier identityVerifier;
  private final ToolGatewayMetrics metrics;
  private final ConcurrentMap<String, UserProfile> profilesByTokenHash = new ConcurrentHashMap<>();

  public EntitlementResolver(IdentityVerifier identityVerifier, ToolGatewayMetrics metrics) {
    this.identityVerifier = identityVerifier;
    this.metrics = metrics;
  }

  public AccessResult<UserProfile> resolve(String token) {
    if (token == null || token.isBlank()) {
      return AccessResult.failure(AccessFailure.authentication("bearer token is required"));
    }
    final String tokenHash = Digests.sha256Hex(token);
    final UserProfile cached = profilesByTokenHash.get(tokenHash);
    if (cached != null) {
      metrics.recordEntitlementLookup("hit");
      return AccessResult.success(cached);
    }
    // 同一トークンの同時ミスは両方が検証してよい (後勝ちで同値が入る)
    final UserProfile verified;
    try {
      verified = identityVerifier.verify(token);
    } catch (IdentityVerificationException ex) {
      metrics.recordEntitlementLookup("error");
      logger.warn("entitlement resolution failed reason={}", ex.reason());
      return AccessResult.failure(
          AccessFailure.authentication("token verification failed: " + ex.getMessage()));
    }
    profilesByTokenHash.put(tokenHash, verified);
    metrics.recordEntitlementLookup("miss");
    metrics.updateEntitlementCacheSize(profilesByTokenHash.size());
    logger.info("entitlements resolved subjectId={}", verified.subjectId());
    return AccessResult.success(verified);
  }

  public int cachedEntries() {
    return profilesByTokenHash.size();
  }
}
