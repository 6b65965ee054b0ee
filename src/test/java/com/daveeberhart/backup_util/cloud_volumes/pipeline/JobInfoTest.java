package com.daveeberhart.backup_util.cloud_volumes.pipeline;

import java.time.Duration;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

import com.daveeberhart.backup_util.cloud_volumes.error.BadConfigException;

/**
 * @author deberhar
 */
public class JobInfoTest {

  @After
  public void tearDown() {
    System.clearProperty(JobInfo.PROP_MAX_PARALLEL);
    System.clearProperty(JobInfo.PROP_MAX_BACKOFF_TIME);
    System.clearProperty(JobInfo.PROP_MAX_RETRY_TIME);
    System.clearProperty(JobInfo.PROP_FAILURE_POLICY);
  }

  @Test
  public void testDefaults() {
    JobInfo job = JobInfo.fromSystemProperties();
    Assert.assertEquals(5, job.getMaxParallelUploads());
    Assert.assertEquals(Duration.ofSeconds(30), job.getMaxBackoffTime());
    Assert.assertEquals(Duration.ofHours(12), job.getMaxRetryTime());
    Assert.assertEquals(FailurePolicy.CONTINUE, job.getFailurePolicy());
  }

  @Test
  public void testFromProperties() {
    System.setProperty(JobInfo.PROP_MAX_PARALLEL, "8");
    System.setProperty(JobInfo.PROP_MAX_BACKOFF_TIME, "PT1M");
    System.setProperty(JobInfo.PROP_MAX_RETRY_TIME, "PT2H");
    System.setProperty(JobInfo.PROP_FAILURE_POLICY, "abort");

    JobInfo job = JobInfo.fromSystemProperties();
    Assert.assertEquals(8, job.getMaxParallelUploads());
    Assert.assertEquals(Duration.ofMinutes(1), job.getMaxBackoffTime());
    Assert.assertEquals(Duration.ofHours(2), job.getMaxRetryTime());
    Assert.assertEquals(FailurePolicy.ABORT, job.getFailurePolicy());
  }

  @Test(expected=BadConfigException.class)
  public void testBadPolicy() {
    System.setProperty(JobInfo.PROP_FAILURE_POLICY, "sometimes");
    JobInfo.fromSystemProperties();
  }

  @Test(expected=BadConfigException.class)
  public void testBadDuration() {
    System.setProperty(JobInfo.PROP_MAX_RETRY_TIME, "12 hours");
    JobInfo.fromSystemProperties();
  }

  @Test(expected=BadConfigException.class)
  public void testZeroParallel() {
    new JobInfo(0, Duration.ofSeconds(30), Duration.ofHours(12));
  }

  @Test(expected=BadConfigException.class)
  public void testZeroBackoff() {
    new JobInfo(5, Duration.ZERO, Duration.ofHours(12));
  }

  @Test(expected=BadConfigException.class)
  public void testZeroBackoffProperty() {
    System.setProperty(JobInfo.PROP_MAX_BACKOFF_TIME, "PT0S");
    JobInfo.fromSystemProperties();
  }

}
