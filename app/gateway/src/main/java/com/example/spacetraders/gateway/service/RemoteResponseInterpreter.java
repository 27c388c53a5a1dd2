/*
 * どこで: Gateway サービス層
 * 何を: SpaceTraders の応答エンベロープ(data / error.message)を成功・204・失敗に分類する
 * なぜ: 全ての呼び出し元が同じ規則で成功/失敗を判定するため
 */
package com.example.spacetraders.gateway.service;

import com.example.spacetraders.gateway.model.RawResponse;
import com.example.spacetraders.gateway.model.RemotePage;
import com.example.spacetraders.gateway.model.RemoteResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RemoteResponseInterpreter {

  static final String UNKNOWN_ERROR = "Unknown error";

  private static final Logger logger = LoggerFactory.getLogger(RemoteResponseInterpreter.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public RemoteResponseInterpreter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public RemoteResult interpret(RawResponse response) {
    final int status = response.statusCode();
    if (status == 204) {
      return new RemoteResult.NoContent(status);
    }
    if (status == 200 || status == 201) {
      final JsonNode root = parseSuccessBody(response);
      return new RemoteResult.Success(status, root.path("data"), root.path("meta"));
    }
    return toFailure(response);
  }

  /** Returns the {@code data} member of a 200/201 response, otherwise raises a remote error. */
  public JsonNode requireData(RawResponse response, String operation) {
    return requireSuccess(response, operation).data();
  }

  /** Like {@link #requireData} for list endpoints, keeping the envelope's paging {@code meta}. */
  public RemotePage requirePage(RawResponse response, String operation) {
    final RemoteResult.Success success = requireSuccess(response, operation);
    if (!success.data().isArray()) {
      throw new SpaceTradersIntegrationException(
          SpaceTradersIntegrationException.Reason.INVALID_RESPONSE,
          "spacetraders " + operation + " data is not a list");
    }
    return new RemotePage(success.data(), success.meta().isObject() ? success.meta() : null);
  }

  public SpaceTradersIntegrationException asException(
      RemoteResult.Failure failure, String operation) {
    logger.info(
        "spacetraders {} failed status={} code={} message={}",
        operation,
        failure.statusCode(),
        failure.code(),
        failure.message());
    return SpaceTradersIntegrationException.remoteError(
        failure.statusCode(), failure.code(), failure.message());
  }

  private RemoteResult.Success requireSuccess(RawResponse response, String operation) {
    final RemoteResult result = interpret(response);
    if (result instanceof RemoteResult.Failure failure) {
      throw asException(failure, operation);
    }
    if (result instanceof RemoteResult.NoContent) {
      logger.warn("spacetraders {} returned no content where data was expected", operation);
      throw new SpaceTradersIntegrationException(
          SpaceTradersIntegrationException.Reason.INVALID_RESPONSE,
          "spacetraders " + operation + " returned no content");
    }
    final RemoteResult.Success success = (RemoteResult.Success) result;
    if (success.data().isMissingNode()) {
      logger.warn(
          "spacetraders {} returned status={} without data", operation, success.statusCode());
      throw new SpaceTradersIntegrationException(
          SpaceTradersIntegrationException.Reason.INVALID_RESPONSE,
          "spacetraders " + operation + " response has no data");
    }
    return success;
  }

  private JsonNode parseSuccessBody(RawResponse response) {
    if (!response.hasBody()) {
      throw new SpaceTradersIntegrationException(
          SpaceTradersIntegrationException.Reason.INVALID_RESPONSE,
          "spacetraders response body is empty for status " + response.statusCode());
    }
    try {
      return objectMapper.readTree(response.body());
    } catch (JsonProcessingException ex) {
      throw new SpaceTradersIntegrationException(
          SpaceTradersIntegrationException.Reason.INVALID_RESPONSE,
          "spacetraders response is not valid JSON",
          ex);
    }
  }

  private RemoteResult.Failure toFailure(RawResponse response) {
    final int status = response.statusCode();
    if (!response.hasBody()) {
      return new RemoteResult.Failure(status, null, UNKNOWN_ERROR);
    }
    final JsonNode error;
    try {
      error = objectMapper.readTree(response.body()).path("error");
    } catch (JsonProcessingException ex) {
      logger.debug("spacetraders error body is not JSON status={}", status);
      return new RemoteResult.Failure(status, null, UNKNOWN_ERROR);
    }
    final JsonNode message = error.path("message");
    final JsonNode code = error.path("code");
    return new RemoteResult.Failure(
        status,
        code.canConvertToInt() ? code.asInt() : null,
        message.isTextual() && !message.asText().isBlank() ? message.asText() : UNKNOWN_ERROR);
  }
}
