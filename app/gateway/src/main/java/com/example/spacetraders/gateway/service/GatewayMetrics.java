/*
 * どこで: Gateway サービス層
 * 何を: SpaceTraders 呼び出し結果・レート制限待ち時間・登録結果・API エラーのメトリクスを記録する
 * なぜ: レート制限による待ちと下流エラーの増加を Prometheus から直接観測できるようにするため
 */
package com.example.spacetraders.gateway.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class GatewayMetrics {

  private static final String METRIC_DISPATCH_TOTAL = "spacetraders.dispatch.total";
  private static final String METRIC_RATE_LIMIT_WAIT = "spacetraders.ratelimit.wait";
  private static final String METRIC_REGISTRATION_TOTAL = "spacetraders.registration.total";
  private static final String METRIC_API_ERROR_TOTAL = "gateway.api.error.total";

  private final MeterRegistry meterRegistry;
  private final Timer rateLimitWaitTimer;
  private final ConcurrentMap<String, Counter> dispatchCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> registrationCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> apiErrorCounters = new ConcurrentHashMap<>();

  public GatewayMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.rateLimitWaitTimer =
        Timer.builder(METRIC_RATE_LIMIT_WAIT)
            .description("Time spent waiting for a SpaceTraders rate limit slot")
            .register(meterRegistry);
  }

  public void recordDispatch(String method, int statusCode) {
    recordDispatchOutcome(method, (statusCode / 100) + "xx");
  }

  public void recordTransportError(String method) {
    recordDispatchOutcome(method, "transport_error");
  }

  public void recordRateLimitWait(Duration waited) {
    rateLimitWaitTimer.record(waited.isNegative() ? Duration.ZERO : waited);
  }

  public void recordRegistrationResult(String result) {
    registrationCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_REGISTRATION_TOTAL)
                    .description("SpaceTraders agent registration outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordApiError(String code) {
    apiErrorCounters
        .computeIfAbsent(
            code,
            ignored ->
                Counter.builder(METRIC_API_ERROR_TOTAL)
                    .description("Gateway API errors by code")
                    .tags(Tags.of("code", code))
                    .register(meterRegistry))
        .increment();
  }

  private void recordDispatchOutcome(String method, String outcome) {
    final String key = method + "|" + outcome;
    dispatchCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_DISPATCH_TOTAL)
                    .description("SpaceTraders requests dispatched by method and outcome")
                    .tags(Tags.of("method", method, "outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }
}
