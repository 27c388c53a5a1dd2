package com.example.spacetraders.common;

import java.util.UUID;

public final class RequestIds {
  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  public static String resolve(String candidate) {
    if (candidate == null || candidate.isBlank()) {
      return newRequestId();
    }
    return candidate.trim();
  }
}
