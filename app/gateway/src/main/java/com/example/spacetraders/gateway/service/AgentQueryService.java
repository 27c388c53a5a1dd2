package com.example.spacetraders.gateway.service;

import com.example.spacetraders.gateway.model.CredentialSelection;
import com.example.spacetraders.gateway.model.RemotePage;
import com.example.spacetraders.gateway.model.SpaceTradersRequest;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriUtils;

@Service
@RequiredArgsConstructor
public class AgentQueryService {

  private final SpaceTradersDispatcher dispatcher;
  private final RemoteResponseInterpreter interpreter;
  private final AgentTokenStore tokenStore;

  /** {@code my/agent} with the agent's own token, or unauthenticated when none is stored. */
  public JsonNode getMyAgent(String agentSymbol) {
    validateAgentSymbol(agentSymbol);
    return interpreter.requireData(
        dispatcher.dispatch(
            SpaceTradersRequest.get("my/agent", CredentialSelection.agent(agentSymbol))),
        "getMyAgent");
  }

  public JsonNode getPublicAgent(String agentSymbol) {
    validateAgentSymbol(agentSymbol);
    return interpreter.requireData(
        dispatcher.dispatch(
            SpaceTradersRequest.get(
                "agents/" + UriUtils.encodePathSegment(agentSymbol, "UTF-8"),
                CredentialSelection.none())),
        "getPublicAgent");
  }

  /** {@code agents}: one page of every agent in the game, read with the caller's token. */
  public RemotePage listAgents(String agentSymbol) {
    validateAgentSymbol(agentSymbol);
    return interpreter.requirePage(
        dispatcher.dispatch(
            SpaceTradersRequest.get("agents", CredentialSelection.agent(agentSymbol))),
        "listAgents");
  }

  public List<String> listStoredAgents() {
    return List.copyOf(tokenStore.snapshot().keySet());
  }

  private void validateAgentSymbol(String agentSymbol) {
    if (agentSymbol == null || agentSymbol.isBlank()) {
      throw new IllegalArgumentException("agentSymbol is required");
    }
  }
}
