package com.example.spacetraders.gateway.api;

import com.example.spacetraders.gateway.service.GatewayConfigurationException;
import com.example.spacetraders.gateway.service.GatewayMetrics;
import com.example.spacetraders.gateway.service.MissingCredentialException;
import com.example.spacetraders.gateway.service.SpaceTradersIntegrationException;
import com.example.spacetraders.gateway.service.TokenStorageException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@RequiredArgsConstructor
public class GatewayApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(GatewayApiExceptionHandler.class);

  private final GatewayMetrics gatewayMetrics;

  @ExceptionHandler(SpaceTradersIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleSpaceTradersIntegration(
      SpaceTradersIntegrationException ex) {
    final String code =
        switch (ex.reason()) {
          case REMOTE_ERROR -> "SPACETRADERS_REMOTE_ERROR";
          case TIMEOUT -> "SPACETRADERS_TIMEOUT";
          case CONNECTION_FAILED -> "SPACETRADERS_CONNECTION_FAILED";
          case INTERRUPTED -> "SPACETRADERS_INTERRUPTED";
          case INVALID_RESPONSE -> "SPACETRADERS_INVALID_RESPONSE";
        };
    final HttpStatus status =
        switch (ex.reason()) {
          case REMOTE_ERROR -> remoteStatusToHttpStatus(ex.remoteStatus());
          case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
          case INTERRUPTED -> HttpStatus.SERVICE_UNAVAILABLE;
          case CONNECTION_FAILED, INVALID_RESPONSE -> HttpStatus.BAD_GATEWAY;
        };
    gatewayMetrics.recordApiError(code);
    return ResponseEntity.status(status)
        .body(new ApiErrorResponse(code, ex.getMessage(), ex.remoteStatus()));
  }

  @ExceptionHandler(MissingCredentialException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingCredential(MissingCredentialException ex) {
    gatewayMetrics.recordApiError("ACCOUNT_TOKEN_MISSING");
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("ACCOUNT_TOKEN_MISSING", ex.getMessage()));
  }

  @ExceptionHandler(GatewayConfigurationException.class)
  public ResponseEntity<ApiErrorResponse> handleConfiguration(GatewayConfigurationException ex) {
    logger.error("gateway configuration error", ex);
    gatewayMetrics.recordApiError("GATEWAY_MISCONFIGURED");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("GATEWAY_MISCONFIGURED", ex.getMessage()));
  }

  @ExceptionHandler(TokenStorageException.class)
  public ResponseEntity<ApiErrorResponse> handleTokenStorage(TokenStorageException ex) {
    logger.error("agent token storage failed", ex);
    gatewayMetrics.recordApiError("TOKEN_STORAGE_FAILED");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("TOKEN_STORAGE_FAILED", "agent token storage failed"));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    gatewayMetrics.recordApiError("INVALID_REQUEST");
    return ResponseEntity.badRequest().body(new ApiErrorResponse("INVALID_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    gatewayMetrics.recordApiError("INVALID_REQUEST");
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .orElse("request is invalid");
    return ResponseEntity.badRequest().body(new ApiErrorResponse("INVALID_REQUEST", message));
  }

  private HttpStatus remoteStatusToHttpStatus(Integer remoteStatus) {
    if (remoteStatus == null) {
      return HttpStatus.BAD_GATEWAY;
    }
    final HttpStatus resolved = HttpStatus.resolve(remoteStatus);
    if (resolved == null || !resolved.is4xxClientError()) {
      return HttpStatus.BAD_GATEWAY;
    }
    return resolved;
  }
}
