/*
 * どこで: Tool Gateway 認可層
 * 何を: Layer 4 (カテゴリ単位のデータ絞り込み) を行う
 * なぜ: ロール判定を通過した呼び出しでも、許可カテゴリ外のデータを返さないため
 */
package com.example.tool_gateway.auth;

import com.example.tool_gateway.model.EntityRecord;
import com.example.tool_gateway.model.UserProfile;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public final class CategoryFilter {

  private CategoryFilter() {}

  public static boolean permits(UserProfile profile, EntityRecord entity) {
    return profile.permitsCategory(entity.category());
  }

  public static List<EntityRecord> filter(UserProfile profile, Collection<EntityRecord> entities) {
    final List<EntityRecord> permitted = new ArrayList<>();
    for (EntityRecord entity : entities) {
      if (permits(profile, entity)) {
        permitted.add(entity);
      }
    }
    return permitted;
  }
}
