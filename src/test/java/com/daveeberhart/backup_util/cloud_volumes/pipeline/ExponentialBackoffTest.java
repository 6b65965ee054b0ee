package com.daveeberhart.backup_util.cloud_volumes.pipeline;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.Assert;
import org.junit.Test;

/**
 * @author deberhar
 */
public class ExponentialBackoffTest {
  private final AtomicLong clock = new AtomicLong();

  @Test
  public void testGrowthAndCap() {
    ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofHours(1), clock::get, () -> 0.5);

    Assert.assertEquals(Optional.of(Duration.ofMillis(500)), backoff.nextDelay());
    Assert.assertEquals(Optional.of(Duration.ofMillis(750)), backoff.nextDelay());
    Assert.assertEquals(Optional.of(Duration.ofMillis(1000)), backoff.nextDelay());
    Assert.assertEquals(Optional.of(Duration.ofMillis(1000)), backoff.nextDelay());
  }

  @Test
  public void testJitter() {
    ExponentialBackoff low = new ExponentialBackoff(Duration.ofSeconds(30), Duration.ofHours(1), clock::get, () -> 0.0);
    Assert.assertEquals(Optional.of(Duration.ofMillis(250)), low.nextDelay());

    ExponentialBackoff high = new ExponentialBackoff(Duration.ofSeconds(30), Duration.ofHours(1), clock::get, () -> 0.999);
    long millis = high.nextDelay().get().toMillis();
    Assert.assertTrue(String.valueOf(millis), millis > 740 && millis <= 750);
  }

  @Test
  public void testJitterNeverPassesCap() {
    ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofMillis(600), Duration.ofHours(1), clock::get, () -> 0.999);
    for (int i = 0; i < 10; i++) {
      Assert.assertTrue(backoff.nextDelay().get().compareTo(Duration.ofMillis(600)) <= 0);
    }
  }

  @Test
  public void testDeadline() {
    ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofSeconds(30), Duration.ofSeconds(2), clock::get, () -> 0.5);

    Assert.assertTrue(backoff.nextDelay().isPresent());
    clock.addAndGet(Duration.ofMillis(500).toNanos());
    Assert.assertTrue(backoff.nextDelay().isPresent());
    clock.addAndGet(Duration.ofMillis(750).toNanos());
    Assert.assertFalse(backoff.nextDelay().isPresent());
    Assert.assertEquals(Duration.ofMillis(1250), backoff.getElapsed());
  }

  @Test
  public void testNoRetryTime() {
    ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofSeconds(30), Duration.ZERO, clock::get, () -> 0.5);
    Assert.assertFalse(backoff.nextDelay().isPresent());
  }

}
