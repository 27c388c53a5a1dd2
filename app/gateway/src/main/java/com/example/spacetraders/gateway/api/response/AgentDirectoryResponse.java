package com.example.spacetraders.gateway.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/** One page of the game's agent list; {@code meta} carries total, page and limit. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentDirectoryResponse(JsonNode agents, JsonNode meta) {}
