package com.example.spacetraders.gateway.model;

public record RegisteredAgent(String symbol, String startingFaction, String headquarters) {}
