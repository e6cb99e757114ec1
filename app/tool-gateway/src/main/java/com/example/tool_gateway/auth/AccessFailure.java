/*
 * どこで: Tool Gateway 認可層
 * 何を: 認証/認可/上流取得の失敗種別とメッセージを表現する
 * なぜ: 例外伝播に頼らず、呼び出し側が種別で分岐できるようにするため
 */
package com.example.tool_gateway.auth;

public record AccessFailure(Kind kind, String message) {

  public enum Kind {
    AUTHENTICATION,
    AUTHORIZATION,
    UPSTREAM_FETCH
  }

  public static AccessFailure authentication(String message) {
    return new AccessFailure(Kind.AUTHENTICATION, message);
  }

  public static AccessFailure authorization(String message) {
    return new AccessFailure(Kind.AUTHORIZATION, message);
  }
}
