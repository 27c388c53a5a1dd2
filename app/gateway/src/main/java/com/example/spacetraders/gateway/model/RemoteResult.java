package com.example.spacetraders.gateway.model;

import com.fasterxml.jackson.databind.JsonNode;

/** A remote response classified by the SpaceTraders envelope convention. */
public sealed interface RemoteResult
    permits RemoteResult.Success, RemoteResult.NoContent, RemoteResult.Failure {

  int statusCode();

  /** 200/201 with the envelope's {@code data} and {@code meta} members, missing nodes if absent. */
  record Success(int statusCode, JsonNode data, JsonNode meta) implements RemoteResult {}

  /** 204: nothing to report, e.g. a ship without an active cooldown. */
  record NoContent(int statusCode) implements RemoteResult {}

  /** Any other status, with {@code error.message} and {@code error.code} when present. */
  record Failure(int statusCode, Integer code, String message) implements RemoteResult {}
}
