/*
 * どこで: Tool Gateway 認可層
 * 何を: ツールごとの HTTP 経路と要求ロールを一箇所で宣言する
 * なぜ: セキュリティ設定・ログ・メトリクスで同じツール名とロール集合を使うため
 */
package com.example.tool_gateway.auth;

import java.util.Optional;
import java.util.Set;
import org.springframework.http.HttpMethod;

public enum ToolPermission {
  LIST_ENTITIES("list_entities", HttpMethod.GET, "/v1/tools/list-entities", "reader", "admin"),
  GET_ENTITY("get_entity", HttpMethod.GET, "/v1/tools/get-entity", "reader", "admin"),
  REFRESH_CACHE("refresh_cache", HttpMethod.POST, "/v1/tools/refresh-cache", "admin");

  public static final String TOOL_PATH_PREFIX = "/v1/tools/";

  private final String toolName;
  private final HttpMethod method;
  private final String path;
  private final Set<String> requiredRoles;

  ToolPermission(String toolName, HttpMethod method, String path, String... requiredRoles) {
    this.toolName = toolName;
    this.method = method;
    this.path = path;
    this.requiredRoles = Set.of(requiredRoles);
  }

  public String toolName() {
    return toolName;
  }

  public HttpMethod method() {
    return method;
  }

  public String path() {
    return path;
  }

  public Set<String> requiredRoles() {
    return requiredRoles;
  }

  public static Optional<ToolPermission> match(String method, String path) {
    for (ToolPermission permission : values()) {
      if (permission.method.matches(method) && permission.path.equals(path)) {
        return Optional.of(permission);
      }
    }
    return Optional.empty();
  }
}
