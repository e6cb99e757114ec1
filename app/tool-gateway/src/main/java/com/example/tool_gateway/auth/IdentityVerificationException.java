/*
 * どこで: Tool Gateway 認可層
 * 何を: IdP の userinfo 呼び出し失敗を表現する
 * なぜ: 失敗理由をログとメトリクスで区別しつつ、呼び出し側では認証失敗として扱うため
 */
package com.example.tool_gateway.auth;

public class IdentityVerificationException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public IdentityVerificationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public IdentityVerificationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
