/*
 * どこで: Gateway 設定
 * 何を: SpaceTraders API 呼び出し設定(接続先/アカウントトークン/トークンファイル/レート制限/通信方式)を保持する
 * なぜ: 起動時に一度だけ読み込み、不正なレート制限設定を起動時に検出するため
 */
package com.example.spacetraders.gateway.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "spacetraders")
@Validated
public record SpaceTradersProperties(
    @NotBlank String baseUrl,
    String accountToken,
    @NotNull Path tokensFile,
    @NotNull @Positive Integer requestsPerPeriod,
    @NotNull Duration period,
    @NotNull Duration connectTimeout,
    @NotNull Duration readTimeout,
    @NotNull Transport transport) {

  public static final String DEFAULT_BASE_URL = "https://api.spacetraders.io/v2";

  /** HTTP client backing the outbound {@code RestClient}. */
  public enum Transport {
    /** {@code java.net.http.HttpClient}; supports every HTTP method including PATCH. */
    JDK,
    /** {@code HttpURLConnection}; no PATCH. */
    SIMPLE
  }

  public SpaceTradersProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl;
    accountToken = accountToken == null ? "" : accountToken.trim();
    tokensFile = tokensFile == null ? Path.of("agent_tokens.json") : tokensFile;
    requestsPerPeriod = requestsPerPeriod == null ? 2 : requestsPerPeriod;
    period = period == null ? Duration.ofSeconds(1) : period;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
    transport = transport == null ? Transport.JDK : transport;
  }

  public boolean hasAccountToken() {
    return !accountToken.isBlank();
  }

  @AssertTrue(message = "spacetraders.period must be positive")
  public boolean isPeriodPositive() {
    return isPositiveDuration(period);
  }

  @AssertTrue(message = "spacetraders.read-timeout must be positive")
  public boolean isReadTimeoutPositive() {
    return isPositiveDuration(readTimeout);
  }

  @AssertTrue(message = "spacetraders.connect-timeout must be positive")
  public boolean isConnectTimeoutPositive() {
    return isPositiveDuration(connectTimeout);
  }

  @Override
  public String toString() {
    // accountToken は出力しない。
    return "SpaceTradersProperties[baseUrl="
        + baseUrl
        + ", accountToken="
        + (hasAccountToken() ? "***" : "<absent>")
        + ", tokensFile="
        + tokensFile
        + ", requestsPerPeriod="
        + requestsPerPeriod
        + ", period="
        + period
        + ", transport="
        + transport
        + "]";
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
