package com.example.spacetraders.gateway.service;

import com.example.spacetraders.gateway.model.CredentialSelection;
import com.example.spacetraders.gateway.model.SpaceTradersRequest;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriUtils;

/** Account-scoped reads of global game data. */
@Service
@RequiredArgsConstructor
public class ReferenceDataService {

  private final SpaceTradersDispatcher dispatcher;
  private final RemoteResponseInterpreter interpreter;

  public JsonNode listFactions() {
    return interpreter.requireData(
        dispatcher.dispatch(SpaceTradersRequest.get("factions", CredentialSelection.account())),
        "listFactions");
  }

  public JsonNode getFaction(String factionSymbol) {
    if (factionSymbol == null || factionSymbol.isBlank()) {
      throw new IllegalArgumentException("factionSymbol is required");
    }
    return interpreter.requireData(
        dispatcher.dispatch(
            SpaceTradersRequest.get(
                "factions/" + UriUtils.encodePathSegment(factionSymbol, "UTF-8"),
                CredentialSelection.account())),
        "getFaction");
  }
}
