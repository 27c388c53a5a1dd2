package com.example.spacetraders.gateway.api.request;

import jakarta.validation.constraints.NotBlank;

public record RegisterAgentRequest(@NotBlank String symbol, String faction) {}
