/*
 * どこで: Tool Gateway 認可層
 * 何を: bearer 資格情報を IdP で検証する口を抽象化する
 * なぜ: 権限キャッシュを IdP 実装から切り離してテスト可能にするため
 */
package com.example.tool_gateway.auth;

import com.example.tool_gateway.model.UserProfile;

public interface IdentityVerifier {

  /**
   * 役割: bearer 資格情報を呼び出し元の UserProfile へ交換する。
   * 動作: IdP が拒否した場合や到達できない場合は IdentityVerificationException を送出する。
   */
  UserProfile verify(String token);
}
