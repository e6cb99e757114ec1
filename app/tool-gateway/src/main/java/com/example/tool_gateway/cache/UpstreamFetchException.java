/*
 * どこで: Tool Gateway キャッシュ層
 * 何を: 下流エンティティ取得の失敗を表現する
 * なぜ: 定期更新では握りつぶし、起動時/手動更新では呼び出し元へ返すため
 */
package com.example.tool_gateway.cache;

public class UpstreamFetchException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public UpstreamFetchException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public UpstreamFetchException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
