/*
 * どこで: Common 共通ユーティリティ
 * 何を: 文字列の SHA-256 ダイジェストを16進文字列で返す
 * なぜ: 資格情報などの生値を保持せずにキーとして扱うため
 */
package com.example.common;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Digests {

  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private Digests() {}

  public static String sha256Hex(String value) {
    if (value == null) {
      throw new IllegalArgumentException("value is required");
    }
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return toHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }

  private static String toHex(byte[] bytes) {
    final char[] chars = new char[bytes.length * 2];
    for (int i = 0; i < bytes.length; i++) {
      final int value = bytes[i] & 0xff;
      chars[i * 2] = HEX[value >>> 4];
      chars[i * 2 + 1] = HEX[value & 0x0f];
    }
    return new String(chars);
  }
}
