/*
 * どこで: Gateway 設定
 * 何を: SpaceTraders 呼び出し用 RestClient/レートリミッタ/トークンストアを組み立てる
 * なぜ: ゲートウェイの共有状態をプロセスに一つだけ明示的に生成して注入するため
 */
package com.example.spacetraders.gateway.config;

import com.example.spacetraders.common.time.Sleeper;
import com.example.spacetraders.gateway.service.AgentTokenStore;
import com.example.spacetraders.gateway.service.IntervalRateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(SpaceTradersProperties.class)
public class SpaceTradersClientConfig {

  private static final Logger logger = LoggerFactory.getLogger(SpaceTradersClientConfig.class);

  @Bean
  RestClient spaceTradersRestClient(
      RestClient.Builder builder, SpaceTradersProperties properties) {
    // URL は dispatcher 側で組み立てるため baseUrl は設定しない。
    logger.info("spacetraders transport={}", properties.transport());
    return builder.requestFactory(requestFactory(properties)).build();
  }

  static ClientHttpRequestFactory requestFactory(SpaceTradersProperties properties) {
    if (properties.transport() == SpaceTradersProperties.Transport.SIMPLE) {
      final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
      requestFactory.setConnectTimeout(properties.connectTimeout());
      requestFactory.setReadTimeout(properties.readTimeout());
      return requestFactory;
    }
    final HttpClient httpClient =
        HttpClient.newBuilder().connectTimeout(properties.connectTimeout()).build();
    final JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.readTimeout());
    return requestFactory;
  }

  @Bean
  IntervalRateLimiter spaceTradersRateLimiter(
      SpaceTradersProperties properties, Clock clock, Sleeper sleeper) {
    return new IntervalRateLimiter(
        properties.requestsPerPeriod(), properties.period(), clock, sleeper);
  }

  @Bean
  AgentTokenStore agentTokenStore(SpaceTradersProperties properties, ObjectMapper objectMapper) {
    if (!properties.hasAccountToken()) {
      logger.warn(
          "spacetraders account token is not configured; account-scoped operations will fail");
    }
    final AgentTokenStore store = new AgentTokenStore(properties.tokensFile(), objectMapper);
    store.load();
    return store;
  }
}
