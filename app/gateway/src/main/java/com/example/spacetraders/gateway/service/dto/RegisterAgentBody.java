package com.example.spacetraders.gateway.service.dto;

public record RegisterAgentBody(String symbol, String faction) {}
