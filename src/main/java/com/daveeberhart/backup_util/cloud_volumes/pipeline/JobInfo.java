package com.daveeberhart.backup_util.cloud_volumes.pipeline;

import java.time.Duration;
import java.time.format.DateTimeParseException;

import com.daveeberhart.backup_util.cloud_volumes.error.BadConfigException;

/**
 * Limits for one upload run.
 *
 * @author deberhar
 */
public class JobInfo {
  public static final String PROP_MAX_PARALLEL = "upload.maxParallel";
  public static final String PROP_MAX_BACKOFF_TIME = "upload.maxBackoffTime";
  public static final String PROP_MAX_RETRY_TIME = "upload.maxRetryTime";
  public static final String PROP_FAILURE_POLICY = "upload.failurePolicy";

  private final int maxParallelUploads;
  private final Duration maxBackoffTime;
  private final Duration maxRetryTime;
  private final FailurePolicy failurePolicy;

  public JobInfo(int p_maxParallelUploads, Duration p_maxBackoffTime, Duration p_maxRetryTime) {
    this(p_maxParallelUploads, p_maxBackoffTime, p_maxRetryTime, FailurePolicy.CONTINUE);
  }

  /**
   * @param p_maxParallelUploads most uploads in flight at any time
   * @param p_maxBackoffTime longest wait between two attempts at the same volume
   * @param p_maxRetryTime how long to keep retrying one volume, measured from its first attempt
   * @param p_failurePolicy what to do with the other volumes once one has failed
   */
  public JobInfo(int p_maxParallelUploads, Duration p_maxBackoffTime, Duration p_maxRetryTime, FailurePolicy p_failurePolicy) {
    if (p_maxParallelUploads <= 0) {
      throw new BadConfigException("Max parallel uploads must be positive; was " + p_maxParallelUploads);
    }
    if (p_maxBackoffTime.isNegative() || p_maxBackoffTime.isZero()) {
      throw new BadConfigException("Max backoff time must be positive; was " + p_maxBackoffTime);
    }
    if (p_maxRetryTime.isNegative()) {
      throw new BadConfigException("Max retry time can't be negative; was " + p_maxRetryTime);
    }

    maxParallelUploads = p_maxParallelUploads;
    maxBackoffTime = p_maxBackoffTime;
    maxRetryTime = p_maxRetryTime;
    failurePolicy = p_failurePolicy;
  }

  /**
   * Read the limits from system properties ({@code -Dupload.maxParallel=8}, {@code -Dupload.maxRetryTime=PT1H}...).
   */
  public static JobInfo fromSystemProperties() {
    String policy = System.getProperty(PROP_FAILURE_POLICY, FailurePolicy.CONTINUE.name());
    FailurePolicy failurePolicy;
    try {
      failurePolicy = FailurePolicy.valueOf(policy.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new BadConfigException("Setting " + PROP_FAILURE_POLICY + " must be CONTINUE or ABORT; was " + policy, e);
    }

    return new JobInfo(
        Integer.getInteger(PROP_MAX_PARALLEL, 5),
        durationProperty(PROP_MAX_BACKOFF_TIME, Duration.ofSeconds(30)),
        durationProperty(PROP_MAX_RETRY_TIME, Duration.ofHours(12)),
        failurePolicy);
  }

  private static Duration durationProperty(String p_prop, Duration p_default) {
    String val = System.getProperty(p_prop);
    if (val == null || val.trim().isEmpty()) {
      return p_default;
    }
    try {
      return Duration.parse(val.trim());
    } catch (DateTimeParseException e) {
      throw new BadConfigException("Setting " + p_prop + " must be an ISO-8601 duration (e.g. PT30S); was " + val, e);
    }
  }

  public int getMaxParallelUploads() {
    return maxParallelUploads;
  }

  public Duration getMaxBackoffTime() {
    return maxBackoffTime;
  }

  public Duration getMaxRetryTime() {
    return maxRetryTime;
  }

  public FailurePolicy getFailurePolicy() {
    return failurePolicy;
  }

  @Override
  public String toString() {
    return "JobInfo[parallel " + maxParallelUploads + ", backoff <= " + maxBackoffTime + ", retry <= " + maxRetryTime + ", " + failurePolicy + "]";
  }

}
