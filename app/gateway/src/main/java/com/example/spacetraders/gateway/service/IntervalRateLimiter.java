/*
 * どこで: Gateway サービス層
 * 何を: プロセス全体で共有する最小リクエスト間隔を強制する
 * なぜ: SpaceTraders API は固定間隔のレート制限で、全エージェント・全リクエストが同じ枠を消費するため
 */
package com.example.spacetraders.gateway.service;

import com.example.spacetraders.common.time.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single shared timestamp limiter: consecutive {@link #acquire()} returns are at least {@code
 * period / requestsPerPeriod} apart. All callers are serialized on one fair lock, so the check,
 * the wait and the timestamp update form one critical section.
 */
public class IntervalRateLimiter {

  private final Clock clock;
  private final Sleeper sleeper;
  private final Duration minInterval;
  private final ReentrantLock lock = new ReentrantLock(true);

  private Instant lastRequestAt;

  public IntervalRateLimiter(int requestsPerPeriod, Duration period, Clock clock, Sleeper sleeper) {
    if (requestsPerPeriod <= 0) {
      throw new GatewayConfigurationException(
          "requestsPerPeriod must be positive: " + requestsPerPeriod);
    }
    if (period == null || period.isZero() || period.isNegative()) {
      throw new GatewayConfigurationException("period must be positive: " + period);
    }
    if (clock == null || sleeper == null) {
      throw new IllegalArgumentException("clock and sleeper are required");
    }
    this.clock = clock;
    this.sleeper = sleeper;
    this.minInterval = period.dividedBy(requestsPerPeriod);
    this.lastRequestAt = Instant.now(clock);
  }

  /**
   * Blocks until a slot is free, then records and returns the dispatch instant.
   *
   * @throws InterruptedException if interrupted while waiting; no slot is consumed in that case
   */
  public Instant acquire() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      Duration remaining = remaining();
      while (remaining.compareTo(Duration.ZERO) > 0) {
        sleeper.sleep(remaining);
        remaining = remaining();
      }
      lastRequestAt = Instant.now(clock);
      return lastRequestAt;
    } finally {
      lock.unlock();
    }
  }

  public Duration minInterval() {
    return minInterval;
  }

  private Duration remaining() {
    final Instant now = Instant.now(clock);
    if (now.isBefore(lastRequestAt)) {
      // 時計が巻き戻った場合は現在時刻を基準に一間隔待つ。
      lastRequestAt = now;
    }
    return minInterval.minus(Duration.between(lastRequestAt, now));
  }
}
