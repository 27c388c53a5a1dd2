package com.example.spacetraders.gateway.model;

/** Status and body exactly as the remote API returned them. */
public record RawResponse(int statusCode, String body) {

  public RawResponse {
    body = body == null ? "" : body;
  }

  public boolean hasBody() {
    return !body.isBlank();
  }
}
