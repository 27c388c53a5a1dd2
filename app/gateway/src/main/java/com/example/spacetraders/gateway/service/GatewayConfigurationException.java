package com.example.spacetraders.gateway.service;

public class GatewayConfigurationException extends IllegalStateException {

  public GatewayConfigurationException(String message) {
    super(message);
  }
}
