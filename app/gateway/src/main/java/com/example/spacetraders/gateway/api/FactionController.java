package com.example.spacetraders.gateway.api;

import com.example.spacetraders.gateway.service.ReferenceDataService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/factions")
@RequiredArgsConstructor
public class FactionController {

  private final ReferenceDataService referenceDataService;

  @GetMapping
  public ResponseEntity<JsonNode> listFactions() {
    return ResponseEntity.ok(referenceDataService.listFactions());
  }

  @GetMapping("/{factionSymbol}")
  public ResponseEntity<JsonNode> getFaction(@PathVariable("factionSymbol") String factionSymbol) {
    return ResponseEntity.ok(referenceDataService.getFaction(factionSymbol));
  }
}
