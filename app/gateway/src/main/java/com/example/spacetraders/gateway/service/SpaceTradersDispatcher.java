/*
 * どこで: Gateway サービス層
 * 何を: レート制限枠を取得し、資格情報を解決して SpaceTraders API へ 1 回だけリクエストを送る
 * なぜ: 全ての呼び出し元が同じ枠・同じ資格情報の優先順位で下流へ到達するため
 */
package com.example.spacetraders.gateway.service;

import com.example.spacetraders.gateway.config.SpaceTradersProperties;
import com.example.spacetraders.gateway.model.CredentialSelection;
import com.example.spacetraders.gateway.model.RawResponse;
import com.example.spacetraders.gateway.model.SpaceTradersRequest;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Sends exactly one request per {@link #dispatch} call and returns the remote status and body
 * untouched. Non-2xx statuses are data, not exceptions; only precondition violations and transport
 * failures throw.
 */
@Service
public class SpaceTradersDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(SpaceTradersDispatcher.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient spaceTradersRestClient;

  private final SpaceTradersProperties properties;
  private final IntervalRateLimiter rateLimiter;
  private final AgentTokenStore tokenStore;
  private final GatewayMetrics gatewayMetrics;
  private final Clock clock;

  public SpaceTradersDispatcher(
      RestClient spaceTradersRestClient,
      SpaceTradersProperties properties,
      IntervalRateLimiter rateLimiter,
      AgentTokenStore tokenStore,
      GatewayMetrics gatewayMetrics,
      Clock clock) {
    this.spaceTradersRestClient = spaceTradersRestClient;
    this.properties = properties;
    this.rateLimiter = rateLimiter;
    this.tokenStore = tokenStore;
    this.gatewayMetrics = gatewayMetrics;
    this.clock = clock;
  }

  public RawResponse dispatch(SpaceTradersRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("request is required");
    }
    requireAccountTokenIfSelected(request.credential());
    final URI uri = resolveUri(request.path());
    acquireSlot(request);
    final Optional<String> token = resolveToken(request.credential());
    final String method = request.method().name();
    logger.debug(
        "spacetraders dispatch method={} path={} credential={} authenticated={}",
        method,
        request.path(),
        describe(request.credential()),
        token.isPresent());
    try {
      RestClient.RequestBodySpec spec =
          spaceTradersRestClient
              .method(request.method())
              .uri(uri)
              .headers(headers -> applyHeaders(headers, request, token));
      if (request.hasBody()) {
        spec = spec.contentType(MediaType.APPLICATION_JSON).body(request.body());
      }
      final RawResponse response =
          spec.exchange(
              (clientRequest, clientResponse) ->
                  new RawResponse(
                      clientResponse.getStatusCode().value(),
                      StreamUtils.copyToString(clientResponse.getBody(), StandardCharsets.UTF_8)));
      gatewayMetrics.recordDispatch(method, response.statusCode());
      if (response.statusCode() >= 400) {
        logger.info(
            "spacetraders {} {} returned status={}", method, request.path(), response.statusCode());
      }
      return response;
    } catch (ResourceAccessException ex) {
      gatewayMetrics.recordTransportError(method);
      throw mapResourceException(ex, method, request.path());
    } catch (RestClientException ex) {
      gatewayMetrics.recordTransportError(method);
      logger.warn("spacetraders {} {} response could not be read", method, request.path(), ex);
      throw new SpaceTradersIntegrationException(
          SpaceTradersIntegrationException.Reason.INVALID_RESPONSE,
          "spacetraders response could not be read",
          ex);
    }
  }

  private void requireAccountTokenIfSelected(CredentialSelection credential) {
    if (credential instanceof CredentialSelection.Account && !properties.hasAccountToken()) {
      throw new MissingCredentialException(
          "spacetraders account token is not configured (set SPACETRADERS_API_KEY)");
    }
  }

  private void acquireSlot(SpaceTradersRequest request) {
    final Instant waitStartedAt = Instant.now(clock);
    try {
      final Instant dispatchedAt = rateLimiter.acquire();
      final Duration waited = Duration.between(waitStartedAt, dispatchedAt);
      gatewayMetrics.recordRateLimitWait(waited);
      if (!waited.isZero() && !waited.isNegative()) {
        logger.debug("spacetraders rate limit waited={}ms", waited.toMillis());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn(
          "interrupted while waiting for rate limit slot method={} path={}",
          request.method().name(),
          request.path());
      throw new SpaceTradersIntegrationException(
          SpaceTradersIntegrationException.Reason.INTERRUPTED,
          "interrupted while waiting for rate limit slot",
          ex);
    }
  }

  private Optional<String> resolveToken(CredentialSelection credential) {
    if (credential instanceof CredentialSelection.Account) {
      return Optional.of(properties.accountToken());
    }
    if (credential instanceof CredentialSelection.Agent agent) {
      final Optional<String> token = tokenStore.get(agent.agentSymbol());
      if (token.isEmpty()) {
        // トークン未保存のエージェントは公開エンドポイント向けに未認証で送る。
        logger.debug(
            "no stored token, sending unauthenticated agentSymbol={}", agent.agentSymbol());
      }
      return token;
    }
    return Optional.empty();
  }

  private void applyHeaders(
      HttpHeaders headers, SpaceTradersRequest request, Optional<String> token) {
    request.extraHeaders().forEach(headers::set);
    headers.remove(HttpHeaders.AUTHORIZATION);
    token.ifPresent(headers::setBearerAuth);
  }

  URI resolveUri(String path) {
    String base = properties.baseUrl();
    while (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    String relative = path;
    while (relative.startsWith("/")) {
      relative = relative.substring(1);
    }
    return URI.create(base + "/" + relative);
  }

  private SpaceTradersIntegrationException mapResourceException(
      ResourceAccessException ex, String method, String path) {
    if (isTimeout(ex)) {
      logger.warn("spacetraders {} {} timed out", method, path);
      return new SpaceTradersIntegrationException(
          SpaceTradersIntegrationException.Reason.TIMEOUT, "spacetraders request timeout", ex);
    }
    logger.warn("spacetraders {} {} connection failed", method, path, ex);
    return new SpaceTradersIntegrationException(
        SpaceTradersIntegrationException.Reason.CONNECTION_FAILED,
        "spacetraders connection failed",
        ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private String describe(CredentialSelection credential) {
    if (credential instanceof CredentialSelection.Agent agent) {
      return "agent:" + agent.agentSymbol();
    }
    return credential.toString().toLowerCase(Locale.ROOT);
  }
}
