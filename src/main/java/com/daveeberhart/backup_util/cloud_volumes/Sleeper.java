package com.daveeberhart.backup_util.cloud_volumes;

import java.time.Duration;

/**
 * Waits out a backoff or polling interval.  Swapped for a recording fake in tests so nothing
 * sleeps for real.
 *
 * @author deberhar
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = p_duration -> Thread.sleep(p_duration.toMillis());

  /**
   * @throws InterruptedException if the waiting thread is interrupted; callers treat this as cancellation
   */
  void sleep(Duration p_duration) throws InterruptedException;

}
