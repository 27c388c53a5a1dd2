package com.example.spacetraders.gateway.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withNoContent;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.spacetraders.gateway.model.ShipCooldown;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

class ShipCooldownServiceTest {

  private static final String COOLDOWN_URL = GatewayFixture.BASE_URL + "/my/ships/ALPHA-1/cooldown";

  @TempDir Path tempDir;

  @Test
  void noContentMeansNoCooldown() {
    final GatewayFixture fixture = GatewayFixture.create(tempDir);
    fixture.tokenStore().store("ALPHA", "tok123");
    fixture
        .server()
        .expect(requestTo(COOLDOWN_URL))
        .andExpect(header("Authorization", "Bearer tok123"))
        .andRespond(withNoContent());

    final Optional<ShipCooldown> cooldown = newService(fixture).getCooldown("ALPHA", "ALPHA-1");

    assertThat(cooldown).isEmpty();
    fixture.server().verify();
  }

  @Test
  void activeCooldownIsMapped() {
    final GatewayFixture fixture = GatewayFixture.create(tempDir);
    fixture
        .server()
        .expect(requestTo(COOLDOWN_URL))
        .andRespond(
            withSuccess(
                """
                {"data":{"shipSymbol":"ALPHA-1","totalSeconds":70,"remainingSeconds":42,"expiration":"2026-01-01T00:01:10Z"}}
                """,
                MediaType.APPLICATION_JSON));

    final Optional<ShipCooldown> cooldown = newService(fixture).getCooldown("ALPHA", "ALPHA-1");

    assertThat(cooldown)
        .contains(new ShipCooldown("ALPHA-1", 70L, 42L, "2026-01-01T00:01:10Z"));
  }

  @Test
  void remoteFailureIsRaised() {
    final GatewayFixture fixture = GatewayFixture.create(tempDir);
    fixture
        .server()
        .expect(requestTo(COOLDOWN_URL))
        .andRespond(
            withStatus(HttpStatus.NOT_FOUND)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":{\"message\":\"Ship not found\"}}"));

    assertThatThrownBy(() -> newService(fixture).getCooldown("ALPHA", "ALPHA-1"))
        .isInstanceOfSatisfying(
            SpaceTradersIntegrationException.class,
            ex -> {
              assertThat(ex.reason())
                  .isEqualTo(SpaceTradersIntegrationException.Reason.REMOTE_ERROR);
              assertThat(ex.getMessage()).isEqualTo("Ship not found");
            });
  }

  @Test
  void blankShipSymbolIsRejected() {
    final GatewayFixture fixture = GatewayFixture.create(tempDir);

    assertThatThrownBy(() -> newService(fixture).getCooldown("ALPHA", " "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("shipSymbol is required");
  }

  private ShipCooldownService newService(GatewayFixture fixture) {
    return new ShipCooldownService(fixture.dispatcher(), fixture.interpreter());
  }
}
