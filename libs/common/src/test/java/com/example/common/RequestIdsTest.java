package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RequestIdsTest {

  @Test
  void resolveKeepsIncomingValue() {
    assertThat(RequestIds.resolve(" req-1 ")).isEqualTo("req-1");
  }

  @Test
  void resolveGeneratesWhenBlankOrTooLong() {
    assertThat(RequestIds.resolve(null)).isNotBlank();
    assertThat(RequestIds.resolve("  ")).isNotBlank().isNotEqualTo("  ");
    assertThat(RequestIds.resolve("x".repeat(200))).hasSize(36);
  }
}
