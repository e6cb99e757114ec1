/*
 * どこで: Tool Gateway キャッシュ層
 * 何を: 下流データソースからの全件取得口を抽象化する
 * なぜ: スナップショット構築を HTTP クライアント実装から切り離してテスト可能にするため
 */
package com.example.tool_gateway.cache;

import com.example.tool_gateway.model.EntityRecord;
import java.util.Map;

public interface DownstreamFetcher {

  /**
   * 役割: 下流の全エンティティを id をキーに取得する。
   * 動作: 到達不能・タイムアウト・不正な応答は UpstreamFetchException を送出する。
   */
  Map<String, EntityRecord> fetchAll();
}
