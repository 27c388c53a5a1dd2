package com.example.spacetraders.gateway.model;

public record ShipCooldown(
    String shipSymbol, long totalSeconds, long remainingSeconds, String expiration) {}
