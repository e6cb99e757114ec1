/*
 * どこで: Tool Gateway モデル
 * 何を: 上流から取得したエンティティ1件を表現する
 * なぜ: キャッシュとツール応答で同じ不変値を共有するため
 */
package com.example.tool_gateway.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record EntityRecord(String id, String name, String category, Map<String, String> metadata) {

  public EntityRecord {
    // 上流が送ったキー順を保持する
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public boolean isComplete() {
    return !isBlank(id) && name != null && category != null;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
