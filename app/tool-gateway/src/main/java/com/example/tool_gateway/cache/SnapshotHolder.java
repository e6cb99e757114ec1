/*
 * どこで: Tool Gateway キャッシュ層
 * 何を: 現在のスナップショット参照を1つだけ保持する
 * なぜ: 読み手はロック無しで参照を取り、書き手は参照の差し替えだけで更新するため
 */
package com.example.tool_gateway.cache;

import com.example.tool_gateway.model.CacheSnapshot;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

public class SnapshotHolder {

  private final AtomicReference<CacheSnapshot> current;

  public SnapshotHolder(CacheSnapshot initial) {
    this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
  }

  public CacheSnapshot current() {
    return current.get();
  }

  public void replace(CacheSnapshot snapshot) {
    current.set(Objects.requireNonNull(snapshot, "snapshot"));
  }
}
