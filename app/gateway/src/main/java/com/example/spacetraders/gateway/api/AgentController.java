/*
 * どこで: Gateway API
 * 何を: エージェント登録・参照・一覧・クールダウン確認 API を公開する
 * なぜ: SpaceTraders を直接呼ばず、レート制限とトークン管理を持つゲートウェイ経由にするため
 */
package com.example.spacetraders.gateway.api;

import com.example.spacetraders.gateway.api.request.RegisterAgentRequest;
import com.example.spacetraders.gateway.api.response.AgentDirectoryResponse;
import com.example.spacetraders.gateway.api.response.RegisterAgentResponse;
import com.example.spacetraders.gateway.api.response.ShipCooldownResponse;
import com.example.spacetraders.gateway.api.response.StoredAgentsResponse;
import com.example.spacetraders.gateway.model.RegisteredAgent;
import com.example.spacetraders.gateway.model.RemotePage;
import com.example.spacetraders.gateway.service.AgentQueryService;
import com.example.spacetraders.gateway.service.AgentRegistrationService;
import com.example.spacetraders.gateway.service.ShipCooldownService;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/agents")
@RequiredArgsConstructor
public class AgentController {

  private final AgentRegistrationService agentRegistrationService;
  private final AgentQueryService agentQueryService;
  private final ShipCooldownService shipCooldownService;

  @PostMapping
  public ResponseEntity<RegisterAgentResponse> register(
      @Valid @RequestBody RegisterAgentRequest request) {
    final RegisteredAgent agent =
        agentRegistrationService.register(request.symbol(), request.faction());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            new RegisterAgentResponse(
                agent.symbol(), agent.startingFaction(), agent.headquarters()));
  }

  @GetMapping
  public ResponseEntity<StoredAgentsResponse> listStoredAgents() {
    return ResponseEntity.ok(new StoredAgentsResponse(agentQueryService.listStoredAgents()));
  }

  @GetMapping("/{agentSymbol}")
  public ResponseEntity<JsonNode> getAgent(@PathVariable("agentSymbol") String agentSymbol) {
    return ResponseEntity.ok(agentQueryService.getMyAgent(agentSymbol));
  }

  @GetMapping("/{agentSymbol}/public")
  public ResponseEntity<JsonNode> getPublicAgent(
      @PathVariable("agentSymbol") String agentSymbol) {
    return ResponseEntity.ok(agentQueryService.getPublicAgent(agentSymbol));
  }

  @GetMapping("/{agentSymbol}/directory")
  public ResponseEntity<AgentDirectoryResponse> listAgents(
      @PathVariable("agentSymbol") String agentSymbol) {
    final RemotePage page = agentQueryService.listAgents(agentSymbol);
    return ResponseEntity.ok(new AgentDirectoryResponse(page.data(), page.meta()));
  }

  @GetMapping("/{agentSymbol}/ships/{shipSymbol}/cooldown")
  public ResponseEntity<ShipCooldownResponse> getCooldown(
      @PathVariable("agentSymbol") String agentSymbol,
      @PathVariable("shipSymbol") String shipSymbol) {
    return ResponseEntity.ok(
        shipCooldownService
            .getCooldown(agentSymbol, shipSymbol)
            .map(ShipCooldownResponse::from)
            .orElseGet(() -> ShipCooldownResponse.inactive(shipSymbol)));
  }
}
