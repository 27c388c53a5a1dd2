package com.example.spacetraders.gateway.model;

import com.fasterxml.jackson.databind.JsonNode;

/** A list endpoint's {@code data} array and its {@code meta} paging object, if any. */
public record RemotePage(JsonNode data, JsonNode meta) {}
