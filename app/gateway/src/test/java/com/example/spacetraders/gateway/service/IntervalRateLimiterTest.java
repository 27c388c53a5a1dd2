package com.example.spacetraders.gateway.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.spacetraders.common.time.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class IntervalRateLimiterTest {

  private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

  @Test
  void minIntervalIsPeriodDividedByRequests() {
    final ManualClock clock = new ManualClock(START);
    final IntervalRateLimiter limiter =
        new IntervalRateLimiter(2, Duration.ofSeconds(1), clock, clock.advancingSleeper());

    assertThat(limiter.minInterval()).isEqualTo(Duration.ofMillis(500));
  }

  @Test
  void rejectsNonPositiveRequestsPerPeriodAtConstruction() {
    final ManualClock clock = new ManualClock(START);

    assertThatThrownBy(
            () -> new IntervalRateLimiter(0, Duration.ofSeconds(1), clock, Sleeper.blocking()))
        .isInstanceOf(GatewayConfigurationException.class)
        .hasMessageContaining("requestsPerPeriod");
    assertThatThrownBy(
            () -> new IntervalRateLimiter(-3, Duration.ofSeconds(1), clock, Sleeper.blocking()))
        .isInstanceOf(GatewayConfigurationException.class);
  }

  @Test
  void rejectsNonPositivePeriodAtConstruction() {
    final ManualClock clock = new ManualClock(START);

    assertThatThrownBy(() -> new IntervalRateLimiter(2, Duration.ZERO, clock, Sleeper.blocking()))
        .isInstanceOf(GatewayConfigurationException.class)
        .hasMessageContaining("period");
  }

  @Test
  void firstAcquireWaitsOneIntervalFromConstruction() throws InterruptedException {
    final ManualClock clock = new ManualClock(START);
    final List<Duration> sleeps = new ArrayList<>();
    final IntervalRateLimiter limiter =
        new IntervalRateLimiter(
            2,
            Duration.ofSeconds(1),
            clock,
            duration -> {
              sleeps.add(duration);
              clock.advance(duration);
            });

    final Instant dispatchedAt = limiter.acquire();

    assertThat(sleeps).containsExactly(Duration.ofMillis(500));
    assertThat(dispatchedAt).isEqualTo(START.plusMillis(500));
  }

  @Test
  void sleepsOnlyForTheRemainderOfTheInterval() throws InterruptedException {
    final ManualClock clock = new ManualClock(START);
    final List<Duration> sleeps = new ArrayList<>();
    final IntervalRateLimiter limiter =
        new IntervalRateLimiter(
            2,
            Duration.ofSeconds(1),
            clock,
            duration -> {
              sleeps.add(duration);
              clock.advance(duration);
            });
    clock.advance(Duration.ofSeconds(5));
    final Instant first = limiter.acquire();

    clock.advance(Duration.ofMillis(200));
    final Instant second = limiter.acquire();

    assertThat(sleeps).containsExactly(Duration.ofMillis(300));
    assertThat(Duration.between(first, second)).isEqualTo(Duration.ofMillis(500));
  }

  @Test
  void doesNotSleepWhenIntervalAlreadyElapsed() throws InterruptedException {
    final ManualClock clock = new ManualClock(START);
    final List<Duration> sleeps = new ArrayList<>();
    final IntervalRateLimiter limiter =
        new IntervalRateLimiter(
            2,
            Duration.ofSeconds(1),
            clock,
            duration -> {
              sleeps.add(duration);
              clock.advance(duration);
            });
    clock.advance(Duration.ofSeconds(2));

    final Instant dispatchedAt = limiter.acquire();

    assertThat(sleeps).isEmpty();
    assertThat(dispatchedAt).isEqualTo(START.plusSeconds(2));
  }

  @Test
  void sleepsAgainWhenWokenEarly() throws InterruptedException {
    final ManualClock clock = new ManualClock(START);
    final List<Duration> sleeps = new ArrayList<>();
    final IntervalRateLimiter limiter =
        new IntervalRateLimiter(
            2,
            Duration.ofSeconds(1),
            clock,
            duration -> {
              // 初回だけ要求の半分で起きる
              clock.advance(sleeps.isEmpty() ? duration.dividedBy(2) : duration);
              sleeps.add(duration);
            });

    final Instant dispatchedAt = limiter.acquire();

    assertThat(sleeps).containsExactly(Duration.ofMillis(500), Duration.ofMillis(250));
    assertThat(dispatchedAt).isEqualTo(START.plusMillis(500));
  }

  @Test
  void waitsFullIntervalWhenClockMovesBackwards() throws InterruptedException {
    final ManualClock clock = new ManualClock(START);
    final IntervalRateLimiter limiter =
        new IntervalRateLimiter(2, Duration.ofSeconds(1), clock, clock.advancingSleeper());
    final Instant first = limiter.acquire();

    clock.set(first.minusSeconds(60));
    final Instant second = limiter.acquire();

    assertThat(second).isEqualTo(first.minusSeconds(60).plusMillis(500));
  }

  @Test
  void interruptedWaitDoesNotConsumeSlot() throws InterruptedException {
    final ManualClock clock = new ManualClock(START);
    final boolean[] interrupt = {true};
    final IntervalRateLimiter limiter =
        new IntervalRateLimiter(
            2,
            Duration.ofSeconds(1),
            clock,
            duration -> {
              if (interrupt[0]) {
                throw new InterruptedException("test");
              }
              clock.advance(duration);
            });

    assertThatThrownBy(limiter::acquire).isInstanceOf(InterruptedException.class);

    interrupt[0] = false;
    assertThat(limiter.acquire()).isEqualTo(START.plusMillis(500));
  }

  @Test
  void consecutiveAcquiresOnRealClockAreHalfASecondApart() throws InterruptedException {
    final IntervalRateLimiter limiter =
        new IntervalRateLimiter(2, Duration.ofSeconds(1), Clock.systemUTC(), Sleeper.blocking());

    final Instant first = limiter.acquire();
    final Instant second = limiter.acquire();

    assertThat(Duration.between(first, second)).isGreaterThanOrEqualTo(Duration.ofMillis(500));
  }

  @Test
  void concurrentAcquiresAreSpacedByMinInterval() throws Exception {
    final IntervalRateLimiter limiter =
        new IntervalRateLimiter(20, Duration.ofSeconds(1), Clock.systemUTC(), Sleeper.blocking());
    final int callers = 8;
    final ExecutorService executor = Executors.newFixedThreadPool(callers);
    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<Instant>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < callers; i++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  return limiter.acquire();
                }));
      }
      start.countDown();

      final List<Instant> dispatched = new ArrayList<>();
      for (Future<Instant> future : futures) {
        dispatched.add(future.get(10, TimeUnit.SECONDS));
      }
      Collections.sort(dispatched);

      for (int i = 0; i + 1 < dispatched.size(); i++) {
        assertThat(Duration.between(dispatched.get(i), dispatched.get(i + 1)))
            .isGreaterThanOrEqualTo(limiter.minInterval());
      }
    } finally {
      executor.shutdownNow();
    }
  }
}
