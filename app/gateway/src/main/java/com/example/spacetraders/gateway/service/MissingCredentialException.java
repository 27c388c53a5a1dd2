package com.example.spacetraders.gateway.service;

/** Raised before any network call when an account-scoped request has no account token. */
public class MissingCredentialException extends GatewayConfigurationException {

  public MissingCredentialException(String message) {
    super(message);
  }
}
