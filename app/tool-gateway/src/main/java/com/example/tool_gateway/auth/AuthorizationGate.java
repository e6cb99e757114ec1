/*
 * どこで: Tool Gateway 認可層
 * 何を: 資格情報の解決と Layer 3 (ツール呼び出しのロール判定) を行う
 * なぜ: 資格情報抽出 → 権限解決 → ロール照合を全ツールで同じ手順に揃えるため
 */
package com.example.tool_gateway.auth;

import com.example.tool_gateway.model.UserProfile;
import java.util.Set;
import java.util.TreeSet;

public class AuthorizationGate {

  private final EntitlementResolver entitlementResolver;

  public AuthorizationGate(EntitlementResolver entitlementResolver) {
    this.entitlementResolver = entitlementResolver;
  }

  public AccessResult<UserProfile> authorize(String authorizationHeader, Set<String> requiredRoles) {
    requireRoles(requiredRoles);
    return authenticate(authorizationHeader)
        .flatMap(profile -> authorizeRoles(profile, requiredRoles));
  }

  public AccessResult<UserProfile> authenticate(String authorizationHeader) {
    return BearerTokenExtractor.extract(authorizationHeader).flatMap(entitlementResolver::resolve);
  }

  /**
   * 役割: 解決済みプロファイルが要求ロールのいずれかを持つか判定する。
   * 動作: 共通部分が空なら要求ロールと保有ロールを昇順で並べた AUTHORIZATION 失敗を返す。
   * 前提: requiredRoles は空でない。
   */
  public AccessResult<UserProfile> authorizeRoles(UserProfile profile, Set<String> requiredRoles) {
    requireRoles(requiredRoles);
    if (profile.hasAnyRole(requiredRoles)) {
      return AccessResult.success(profile);
    }
    return AccessResult.failure(
        AccessFailure.authorization(
            "Insufficient permissions. Required one of: "
                + new TreeSet<>(requiredRoles)
                + ", user has: "
                + new TreeSet<>(profile.roles())));
  }

  private static void requireRoles(Set<String> requiredRoles) {
    if (requiredRoles == null || requiredRoles.isEmpty()) {
      throw new IllegalArgumentException("requiredRoles must not be empty");
    }
  }
}
