/*
 * どこで: Common 共通ユーティリティ
 * 何を: 受信したリクエストIDを採用し、無ければ新規に採番する
 * なぜ: ログ相関キーの決め方をアプリ間で揃えるため
 */
package com.example.common;

import java.util.UUID;

public final class RequestIds {

  public static final String HEADER = "X-Request-Id";

  private static final int MAX_LENGTH = 128;

  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  public static String resolve(String incoming) {
    if (incoming == null || incoming.isBlank() || incoming.length() > MAX_LENGTH) {
      return newRequestId();
    }
    return incoming.trim();
  }
}
