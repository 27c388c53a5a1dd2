package com.example.spacetraders.gateway.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

class SpaceTradersClientConfigTest {

  @Test
  void jdkTransportIsTheDefault() {
    assertThat(SpaceTradersClientConfig.requestFactory(properties(null)))
        .isInstanceOf(JdkClientHttpRequestFactory.class);
  }

  @Test
  void simpleTransportUsesUrlConnection() {
    assertThat(
            SpaceTradersClientConfig.requestFactory(
                properties(SpaceTradersProperties.Transport.SIMPLE)))
        .isInstanceOf(SimpleClientHttpRequestFactory.class);
  }

  private SpaceTradersProperties properties(SpaceTradersProperties.Transport transport) {
    return new SpaceTradersProperties(
        "http://spacetraders.test/v2",
        "",
        Path.of("agent_tokens.json"),
        2,
        Duration.ofSeconds(1),
        Duration.ofSeconds(1),
        Duration.ofSeconds(1),
        transport);
  }
}
