/*
 * どこで: Gateway API 層テスト
 * 何を: 例外ハンドラの HTTP ステータス変換とエラーコード別メトリクス記録を検証する
 * なぜ: 下流障害の種類ごとの応答とカウントが崩れないことを保証するため
 */
package com.example.spacetraders.gateway.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import com.example.spacetraders.gateway.service.GatewayConfigurationException;
import com.example.spacetraders.gateway.service.GatewayMetrics;
import com.example.spacetraders.gateway.service.SpaceTradersIntegrationException;
import com.example.spacetraders.gateway.service.TokenStorageException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class GatewayApiExceptionHandlerTest {

  private final GatewayMetrics metrics = Mockito.mock(GatewayMetrics.class);
  private final GatewayApiExceptionHandler handler = new GatewayApiExceptionHandler(metrics);

  @Test
  void remoteClientErrorKeepsRemoteStatus() {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handleSpaceTradersIntegration(
            SpaceTradersIntegrationException.remoteError(422, 4109, "invalid faction"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(response.getBody())
        .isEqualTo(new ApiErrorResponse("SPACETRADERS_REMOTE_ERROR", "invalid faction", 422));
    verify(metrics).recordApiError("SPACETRADERS_REMOTE_ERROR");
  }

  @Test
  void transportFailuresMapToGatewayStatuses() {
    final ResponseEntity<ApiErrorResponse> timeout =
        handler.handleSpaceTradersIntegration(
            new SpaceTradersIntegrationException(
                SpaceTradersIntegrationException.Reason.TIMEOUT, "timeout"));
    final ResponseEntity<ApiErrorResponse> connection =
        handler.handleSpaceTradersIntegration(
            new SpaceTradersIntegrationException(
                SpaceTradersIntegrationException.Reason.CONNECTION_FAILED, "refused"));
    final ResponseEntity<ApiErrorResponse> interrupted =
        handler.handleSpaceTradersIntegration(
            new SpaceTradersIntegrationException(
                SpaceTradersIntegrationException.Reason.INTERRUPTED, "interrupted"));

    assertThat(timeout.getStatusCode()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
    assertThat(connection.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(interrupted.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    verify(metrics).recordApiError("SPACETRADERS_TIMEOUT");
    verify(metrics).recordApiError("SPACETRADERS_CONNECTION_FAILED");
    verify(metrics).recordApiError("SPACETRADERS_INTERRUPTED");
  }

  @Test
  void storageAndConfigurationErrorsAre500() {
    final ResponseEntity<ApiErrorResponse> storage =
        handler.handleTokenStorage(
            new TokenStorageException(Path.of("agent_tokens.json"), "failed", null));
    final ResponseEntity<ApiErrorResponse> configuration =
        handler.handleConfiguration(new GatewayConfigurationException("period must be positive"));

    assertThat(storage.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(storage.getBody().code()).isEqualTo("TOKEN_STORAGE_FAILED");
    assertThat(configuration.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(configuration.getBody().code()).isEqualTo("GATEWAY_MISCONFIGURED");
  }
}
