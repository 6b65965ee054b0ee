package com.daveeberhart.backup_util.cloud_volumes.backend.restore;

import java.time.Duration;

/**
 * How often to re-probe an object being restored, and for how long.
 * <p>
 * The interval starts at {@code initialInterval} and doubles after each probe, up to
 * {@code maxInterval}.  Waiting stops once another sleep would take the total past {@code maxWait}.
 *
 * @author deberhar
 */
public final class PollSchedule {
  public static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofSeconds(30);
  public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofMinutes(15);
  /** Deep Archive standard retrievals take up to 48 hours. */
  public static final Duration DEFAULT_MAX_WAIT = Duration.ofHours(48);

  private final Duration initialInterval;
  private final Duration maxInterval;
  private final Duration maxWait;

  public PollSchedule(Duration p_initialInterval, Duration p_maxInterval, Duration p_maxWait) {
    if (p_initialInterval.isNegative() || p_initialInterval.isZero()) {
      throw new IllegalArgumentException("Poll interval must be positive; was " + p_initialInterval);
    }
    initialInterval = p_initialInterval;
    maxInterval = p_maxInterval.compareTo(p_initialInterval) < 0 ? p_initialInterval : p_maxInterval;
    maxWait = p_maxWait;
  }

  public Duration getInitialInterval() {
    return initialInterval;
  }

  public Duration getMaxWait() {
    return maxWait;
  }

  /**
   * @return The interval to use after {@code p_current}.
   */
  public Duration next(Duration p_current) {
    Duration doubled = p_current.multipliedBy(2);
    return doubled.compareTo(maxInterval) > 0 ? maxInterval : doubled;
  }

  @Override
  public String toString() {
    return "every " + initialInterval + " (up to " + maxInterval + ") for at most " + maxWait;
  }

}
