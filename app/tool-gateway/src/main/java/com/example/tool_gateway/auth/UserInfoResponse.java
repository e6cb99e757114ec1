/*
 * どこで: Tool Gateway 下流 DTO
 * 何を: IdP userinfo エンドポイントの応答を表現する
 * なぜ: sub/roles/entitlements.categories を UserProfile へ写像するため
 */
package com.example.tool_gateway.auth;

import java.util.List;
import java.util.Map;

public record UserInfoResponse(
    String sub,
    String name,
    String email,
    List<String> roles,
    Map<String, List<String>> entitlements) {

  public UserInfoResponse {
    roles = roles == null ? List.of() : List.copyOf(roles);
    entitlements = entitlements == null ? Map.of() : Map.copyOf(entitlements);
  }

  public List<String> categories() {
    final List<String> categories = entitlements.get("categories");
    return categories == null ? List.of() : categories;
  }
}
