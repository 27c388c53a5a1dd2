package com.example.spacetraders.gateway.model;

import java.util.Map;
import org.springframework.http.HttpMethod;

/** One outbound call. {@code body} is already serialized JSON, or {@code null}. */
public record SpaceTradersRequest(
    HttpMethod method,
    String path,
    CredentialSelection credential,
    String body,
    Map<String, String> extraHeaders) {

  public SpaceTradersRequest {
    if (method == null) {
      throw new IllegalArgumentException("method is required");
    }
    if (path == null || path.isBlank()) {
      throw new IllegalArgumentException("path is required");
    }
    credential = credential == null ? CredentialSelection.none() : credential;
    extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
  }

  public static SpaceTradersRequest get(String path, CredentialSelection credential) {
    return new SpaceTradersRequest(HttpMethod.GET, path, credential, null, Map.of());
  }

  public static SpaceTradersRequest post(
      String path, CredentialSelection credential, String body) {
    return new SpaceTradersRequest(HttpMethod.POST, path, credential, body, Map.of());
  }

  public boolean hasBody() {
    return body != null;
  }
}
