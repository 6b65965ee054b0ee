package com.daveeberhart.backup_util.cloud_volumes.pipeline;

import java.time.Duration;
import java.util.Optional;
import java.util.function.DoubleSupplier;
import java.util.function.LongSupplier;

/**
 * Backoff schedule for retrying one volume.
 * <p>
 * Delays start at {@value #INITIAL_INTERVAL_MILLIS}ms and grow by {@value #MULTIPLIER} per attempt,
 * randomized by &plusmn;{@value #RANDOMIZATION_FACTOR} and never longer than the max interval.
 * Once the time since the schedule was created, plus the next delay, would pass the max elapsed
 * time, there is no next delay.
 *
 * @author deberhar
 */
public class ExponentialBackoff {
  static final long INITIAL_INTERVAL_MILLIS = 500;
  static final double MULTIPLIER = 1.5;
  static final double RANDOMIZATION_FACTOR = 0.5;

  private final Duration maxInterval;
  private final Duration maxElapsed;
  private final LongSupplier nanoClock;
  private final DoubleSupplier random;
  private final long startNanos;

  private double currentMillis = INITIAL_INTERVAL_MILLIS;

  /**
   * @param p_nanoClock monotonic clock, in nanoseconds
   * @param p_random source of values in [0, 1)
   */
  ExponentialBackoff(Duration p_maxInterval, Duration p_maxElapsed, LongSupplier p_nanoClock, DoubleSupplier p_random) {
    maxInterval = p_maxInterval;
    maxElapsed = p_maxElapsed;
    nanoClock = p_nanoClock;
    random = p_random;
    startNanos = p_nanoClock.getAsLong();
  }

  /**
   * @return How long to wait before the next attempt, or empty if it's time to give up.
   */
  public Optional<Duration> nextDelay() {
    long elapsedMillis = Duration.ofNanos(nanoClock.getAsLong() - startNanos).toMillis();
    long capMillis = maxInterval.toMillis();

    double delta = RANDOMIZATION_FACTOR * currentMillis;
    double randomized = currentMillis - delta + random.getAsDouble() * (2 * delta);
    long delayMillis = Math.min((long)randomized, capMillis);
    currentMillis = Math.min(currentMillis * MULTIPLIER, capMillis);

    if (elapsedMillis + delayMillis > maxElapsed.toMillis()) {
      return Optional.empty();
    }
    return Optional.of(Duration.ofMillis(delayMillis));
  }

  public Duration getElapsed() {
    return Duration.ofNanos(nanoClock.getAsLong() - startNanos);
  }

}
