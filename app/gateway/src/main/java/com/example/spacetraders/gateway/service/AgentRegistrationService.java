/*
 * どこで: Gateway サービス層
 * 何を: アカウントトークンでエージェントを登録し、発行されたトークンを保存する
 * なぜ: トークンストアへ書き込む唯一の経路として登録処理を一箇所に閉じるため
 */
package com.example.spacetraders.gateway.service;

import com.example.spacetraders.gateway.model.CredentialSelection;
import com.example.spacetraders.gateway.model.RawResponse;
import com.example.spacetraders.gateway.model.RegisteredAgent;
import com.example.spacetraders.gateway.model.RemoteResult;
import com.example.spacetraders.gateway.model.SpaceTradersRequest;
import com.example.spacetraders.gateway.service.dto.RegisterAgentBody;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AgentRegistrationService {

  public static final String DEFAULT_FACTION = "COSMIC";

  private static final Logger logger = LoggerFactory.getLogger(AgentRegistrationService.class);
  private static final String REGISTER_PATH = "register";

  private final SpaceTradersDispatcher dispatcher;
  private final RemoteResponseInterpreter interpreter;
  private final AgentTokenStore tokenStore;
  private final GatewayMetrics gatewayMetrics;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public AgentRegistrationService(
      SpaceTradersDispatcher dispatcher,
      RemoteResponseInterpreter interpreter,
      AgentTokenStore tokenStore,
      GatewayMetrics gatewayMetrics,
      ObjectMapper objectMapper) {
    this.dispatcher = dispatcher;
    this.interpreter = interpreter;
    this.tokenStore = tokenStore;
    this.gatewayMetrics = gatewayMetrics;
    this.objectMapper = objectMapper;
  }

  public RegisteredAgent register(String symbol, String faction) {
    if (symbol == null || symbol.isBlank()) {
      throw new IllegalArgumentException("symbol is required");
    }
    final String resolvedFaction = faction == null || faction.isBlank() ? DEFAULT_FACTION : faction;
    final RawResponse response =
        dispatcher.dispatch(
            SpaceTradersRequest.post(
                REGISTER_PATH,
                CredentialSelection.account(),
                serialize(new RegisterAgentBody(symbol.trim(), resolvedFaction.trim()))));

    if (response.statusCode() != 201) {
      gatewayMetrics.recordRegistrationResult("rejected");
      final RemoteResult result = interpreter.interpret(response);
      if (result instanceof RemoteResult.Failure failure) {
        throw interpreter.asException(failure, "register");
      }
      throw new SpaceTradersIntegrationException(
          SpaceTradersIntegrationException.Reason.INVALID_RESPONSE,
          "spacetraders register returned unexpected status " + response.statusCode());
    }

    final JsonNode data;
    try {
      data = interpreter.requireData(response, "register");
    } catch (SpaceTradersIntegrationException ex) {
      gatewayMetrics.recordRegistrationResult("invalid_response");
      throw ex;
    }
    final String token = textOrNull(data.path("token"));
    final JsonNode agent = data.path("agent");
    final String canonicalSymbol = textOrNull(agent.path("symbol"));
    if (token == null || canonicalSymbol == null) {
      gatewayMetrics.recordRegistrationResult("invalid_response");
      throw new SpaceTradersIntegrationException(
          SpaceTradersIntegrationException.Reason.INVALID_RESPONSE,
          "spacetraders register response is missing token or agent symbol");
    }

    tokenStore.store(canonicalSymbol, token);
    gatewayMetrics.recordRegistrationResult("success");
    logger.info(
        "agent registered agentSymbol={} faction={}",
        canonicalSymbol,
        textOrNull(agent.path("startingFaction")));
    return new RegisteredAgent(
        canonicalSymbol,
        textOrNull(agent.path("startingFaction")),
        textOrNull(agent.path("headquarters")));
  }

  private String serialize(RegisterAgentBody body) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize register request", ex);
    }
  }

  private static String textOrNull(JsonNode node) {
    if (node == null || !node.isTextual() || node.asText().isBlank()) {
      return null;
    }
    return node.asText();
  }
}
