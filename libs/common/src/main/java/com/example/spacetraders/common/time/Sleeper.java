package com.example.spacetraders.common.time;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/** Suspends the calling thread. Tests substitute an implementation that advances a manual clock. */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper blocking() {
    return duration -> {
      if (duration.isZero() || duration.isNegative()) {
        return;
      }
      TimeUnit.NANOSECONDS.sleep(duration.toNanos());
    };
  }
}
