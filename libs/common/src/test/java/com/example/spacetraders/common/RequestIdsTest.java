package com.example.spacetraders.common;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RequestIdsTest {

  @Test
  void resolveKeepsProvidedId() {
    assertThat(RequestIds.resolve(" req-1 ")).isEqualTo("req-1");
  }

  @Test
  void resolveGeneratesIdWhenBlank() {
    assertThat(RequestIds.resolve(" ")).hasSize(36);
    assertThat(RequestIds.resolve(null)).isNotEqualTo(RequestIds.resolve(null));
  }
}
