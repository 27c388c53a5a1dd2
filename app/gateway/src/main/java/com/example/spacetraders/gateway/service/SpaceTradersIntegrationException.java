package com.example.spacetraders.gateway.service;

public class SpaceTradersIntegrationException extends RuntimeException {

  public enum Reason {
    REMOTE_ERROR,
    TIMEOUT,
    CONNECTION_FAILED,
    INTERRUPTED,
    INVALID_RESPONSE
  }

  private final Reason reason;
  private final Integer remoteStatus;
  private final Integer remoteCode;

  public SpaceTradersIntegrationException(Reason reason, String message) {
    this(reason, message, null, null, null);
  }

  public SpaceTradersIntegrationException(Reason reason, String message, Throwable cause) {
    this(reason, message, null, null, cause);
  }

  public SpaceTradersIntegrationException(
      Reason reason, String message, Integer remoteStatus, Integer remoteCode, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.remoteStatus = remoteStatus;
    this.remoteCode = remoteCode;
  }

  public static SpaceTradersIntegrationException remoteError(
      int remoteStatus, Integer remoteCode, String message) {
    return new SpaceTradersIntegrationException(
        Reason.REMOTE_ERROR, message, remoteStatus, remoteCode, null);
  }

  public Reason reason() {
    return reason;
  }

  public Integer remoteStatus() {
    return remoteStatus;
  }

  public Integer remoteCode() {
    return remoteCode;
  }
}
