/*
 * どこで: Tool Gateway 認可層
 * 何を: 権限解決とロール判定の結果を値か失敗のどちらか一方で表現する
 * なぜ: 認証/認可の失敗を例外ではなく戻り値で連鎖させるため
 */
package com.example.tool_gateway.auth;

import java.util.Objects;
import java.util.function.Function;

public final class AccessResult<T> {

  private final T value;
  private final AccessFailure failure;

  private AccessResult(T value, AccessFailure failure) {
    this.value = value;
    this.failure = failure;
  }

  public static <T> AccessResult<T> success(T value) {
    return new AccessResult<>(Objects.requireNonNull(value, "value"), null);
  }

  public static <T> AccessResult<T> failure(AccessFailure failure) {
    return new AccessResult<>(null, Objects.requireNonNull(failure, "failure"));
  }

  public boolean isSuccess() {
    return failure == null;
  }

  public T value() {
    if (failure != null) {
      throw new IllegalStateException("no value on failed result: " + failure.kind());
    }
    return value;
  }

  public AccessFailure failure() {
    if (failure == null) {
      throw new IllegalStateException("no failure on successful result");
    }
    return failure;
  }

  /**
   * 役割: 成功時のみ次の段階へ進める。
   * 動作: 失敗はそのまま次の型へ持ち越し、next は呼ばない。
   */
  public <R> AccessResult<R> flatMap(Function<? super T, AccessResult<R>> next) {
    if (failure != null) {
      return failure(failure);
    }
    return next.apply(value);
  }
}
