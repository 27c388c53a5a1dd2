package com.example.spacetraders.gateway.api.response;

import java.util.List;

public record StoredAgentsResponse(List<String> agents) {

  public StoredAgentsResponse {
    agents = agents == null ? List.of() : List.copyOf(agents);
  }
}
