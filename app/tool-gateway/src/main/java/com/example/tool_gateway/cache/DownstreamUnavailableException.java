/*
 * どこで: Tool Gateway キャッシュ層
 * 何を: 下流が未設定のまま手動更新が呼ばれたことを表現する
 * なぜ: 取得失敗とは区別して「更新不可」をツール応答にするため
 */
package com.example.tool_gateway.cache;

public class DownstreamUnavailableException extends RuntimeException {

  public DownstreamUnavailableException(String message) {
    super(message);
  }
}
