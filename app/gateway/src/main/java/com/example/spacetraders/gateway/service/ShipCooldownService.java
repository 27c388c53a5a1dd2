package com.example.spacetraders.gateway.service;

import com.example.spacetraders.gateway.model.CredentialSelection;
import com.example.spacetraders.gateway.model.RemoteResult;
import com.example.spacetraders.gateway.model.ShipCooldown;
import com.example.spacetraders.gateway.model.SpaceTradersRequest;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriUtils;

@Service
@RequiredArgsConstructor
public class ShipCooldownService {

  private final SpaceTradersDispatcher dispatcher;
  private final RemoteResponseInterpreter interpreter;

  /** Empty when the remote answers 204, meaning the ship has no active cooldown. */
  public Optional<ShipCooldown> getCooldown(String agentSymbol, String shipSymbol) {
    if (agentSymbol == null || agentSymbol.isBlank()) {
      throw new IllegalArgumentException("agentSymbol is required");
    }
    if (shipSymbol == null || shipSymbol.isBlank()) {
      throw new IllegalArgumentException("shipSymbol is required");
    }
    final RemoteResult result =
        interpreter.interpret(
            dispatcher.dispatch(
                SpaceTradersRequest.get(
                    "my/ships/" + UriUtils.encodePathSegment(shipSymbol, "UTF-8") + "/cooldown",
                    CredentialSelection.agent(agentSymbol))));
    if (result instanceof RemoteResult.NoContent) {
      return Optional.empty();
    }
    if (result instanceof RemoteResult.Failure failure) {
      throw interpreter.asException(failure, "getCooldown");
    }
    final JsonNode data = ((RemoteResult.Success) result).data();
    if (!data.isObject()) {
      throw new SpaceTradersIntegrationException(
          SpaceTradersIntegrationException.Reason.INVALID_RESPONSE,
          "spacetraders cooldown response has no data");
    }
    return Optional.of(
        new ShipCooldown(
            data.path("shipSymbol").asText(shipSymbol),
            data.path("totalSeconds").asLong(),
            data.path("remainingSeconds").asLong(),
            data.path("expiration").isTextual() ? data.path("expiration").asText() : null));
  }
}
