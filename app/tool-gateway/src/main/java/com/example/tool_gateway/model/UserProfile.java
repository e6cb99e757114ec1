/*
 * どこで: Tool Gateway モデル
 * 何を: 資格情報から解決したロールとカテゴリ権限を保持する
 * なぜ: Layer 3 のロール判定と Layer 4 のデータ絞り込みに同じ値を使うため
 */
package com.example.tool_gateway.model;

import java.util.Set;

public record UserProfile(String subjectId, Set<String> roles, Set<String> permittedCategories) {

  public UserProfile {
    roles = roles == null ? Set.of() : Set.copyOf(roles);
    permittedCategories = permittedCategories == null ? Set.of() : Set.copyOf(permittedCategories);
  }

  public boolean hasAnyRole(Set<String> candidates) {
    for (String candidate : candidates) {
      if (roles.contains(candidate)) {
        return true;
      }
    }
    return false;
  }

  public boolean permitsCategory(String category) {
    return category != null && permittedCategories.contains(category);
  }
}
