package com.daveeberhart.backup_util.cloud_volumes.backend.restore;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Assert;
import org.junit.Test;

import com.daveeberhart.backup_util.cloud_volumes.Sleeper;
import com.daveeberhart.backup_util.cloud_volumes.error.BackupFailedException.RestoreTimeoutException;

/**
 * @author deberhar
 */
public class ArchiveRestorerTest {
  private final PollSchedule schedule = new PollSchedule(Duration.ofSeconds(1), Duration.ofSeconds(4), Duration.ofSeconds(20));
  private final List<Duration> sleeps = new ArrayList<>();
  private final ScriptedOperations ops = new ScriptedOperations();
  private final ArchiveRestorer restorer = new ArchiveRestorer(ops, schedule, sleeps::add);

  @Test
  public void testStandardObject() throws Exception {
    ops.probes.add(RestoreProbe.standard());

    Assert.assertEquals(RestoreState.STANDARD, restorer.ensureAvailable("vol-0001"));
    Assert.assertEquals(0, ops.requests);
    Assert.assertTrue(sleeps.isEmpty());
  }

  @Test
  public void testAlreadyRestored() throws Exception {
    ops.probes.add(RestoreProbe.archived(false));

    Assert.assertEquals(RestoreState.AVAILABLE, restorer.ensureAvailable("vol-0001"));
    Assert.assertEquals(0, ops.requests);
    Assert.assertTrue(sleeps.isEmpty());
  }

  @Test
  public void testRequestAndWait() throws Exception {
    ops.probes.addAll(Arrays.asList(
        RestoreProbe.archived(null),
        RestoreProbe.archived(true),
        RestoreProbe.archived(true),
        RestoreProbe.archived(true),
        RestoreProbe.archived(false)));

    Assert.assertEquals(RestoreState.AVAILABLE, restorer.ensureAvailable("vol-0001"));
    Assert.assertEquals(1, ops.requests);
    Assert.assertEquals(Arrays.asList(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(4)), sleeps);
    Assert.assertTrue(ops.probes.isEmpty());
  }

  @Test
  public void testAlreadyInProgress() throws Exception {
    ops.requestResult = RestoreRequestResult.ALREADY_IN_PROGRESS;
    ops.probes.addAll(Arrays.asList(
        RestoreProbe.archived(null),
        RestoreProbe.archived(true),
        RestoreProbe.archived(null)));

    Assert.assertEquals(RestoreState.AVAILABLE, restorer.ensureAvailable("vol-0001"));
    Assert.assertEquals(1, ops.requests);
    Assert.assertEquals(2, sleeps.size());
  }

  @Test
  public void testTimeout() throws Exception {
    ops.probes.add(RestoreProbe.archived(true));
    ops.stuck = RestoreProbe.archived(true);

    try {
      restorer.ensureAvailable("vol-0001");
      Assert.fail("Should have timed out");
    } catch (RestoreTimeoutException e) {
      // 1 + 2 + 4 + 4 + 4 + 4 = 19; another 4 would pass 20
      Assert.assertEquals(6, sleeps.size());
      Assert.assertEquals(0, ops.requests);
    }
  }

  @Test
  public void testProbeError() throws Exception {
    ops.probes.add(RestoreProbe.standard());
    ops.failOn = "vol-0002";

    try {
      restorer.ensureAvailable(Arrays.asList("vol-0001", "vol-0002", "vol-0003"));
      Assert.fail("Should have failed");
    } catch (IOException e) {
      Assert.assertEquals("No such key: vol-0002", e.getMessage());
      Assert.assertEquals(Arrays.asList("vol-0001", "vol-0002"), ops.probed);
    }
  }

  @Test(timeout=10000)
  public void testInterruptedWhileWaiting() throws Exception {
    ops.stuck = RestoreProbe.archived(true);
    final CountDownLatch waiting = new CountDownLatch(1);
    Sleeper slow = d -> {
      waiting.countDown();
      Sleeper.THREAD.sleep(d);
    };
    final ArchiveRestorer hourly = new ArchiveRestorer(ops,
        new PollSchedule(Duration.ofHours(1), Duration.ofHours(1), Duration.ofHours(48)), slow);
    final AtomicReference<Throwable> thrown = new AtomicReference<>();

    Thread t = new Thread(() -> {
      try {
        hourly.ensureAvailable("vol-0001");
      } catch (IOException | InterruptedException | RuntimeException e) {
        thrown.set(e);
      }
    }, "restore-wait");
    t.start();
    Assert.assertTrue(waiting.await(5, TimeUnit.SECONDS));

    t.interrupt();
    t.join(5000);

    Assert.assertFalse(t.isAlive());
    Assert.assertTrue(String.valueOf(thrown.get()), thrown.get() instanceof InterruptedException);
    // No probe after the interrupted wait
    Assert.assertEquals(Arrays.asList("vol-0001"), ops.probed);
  }

  @Test
  public void testInterruptFlagKept() throws Exception {
    ops.stuck = RestoreProbe.archived(true);
    ArchiveRestorer interrupted = new ArchiveRestorer(ops, schedule, d -> {
      Thread.currentThread().interrupt();
      throw new InterruptedException("Cancelled");
    });

    try {
      interrupted.ensureAvailable(Arrays.asList("vol-0001", "vol-0002"));
      Assert.fail("Should have been interrupted");
    } catch (InterruptedException e) {
      Assert.assertTrue(Thread.interrupted());
      Assert.assertEquals(Arrays.asList("vol-0001"), ops.probed);
    }
  }

  @Test
  public void testNoKeys() throws Exception {
    restorer.ensureAvailable(Collections.<String>emptyList());
    restorer.ensureAvailable((List<String>)null);
    Assert.assertTrue(ops.probed.isEmpty());
  }

  private static final class ScriptedOperations implements RestoreOperations {
    private final Deque<RestoreProbe> probes = new ArrayDeque<>();
    private final List<String> probed = new ArrayList<>();
    private RestoreProbe stuck;
    private RestoreRequestResult requestResult = RestoreRequestResult.ACCEPTED;
    private String failOn;
    private int requests;

    @Override
    public RestoreProbe probe(String p_key) throws IOException {
      probed.add(p_key);
      if (p_key.equals(failOn)) {
        throw new IOException("No such key: " + p_key);
      }
      if (probes.isEmpty() && stuck != null) {
        return stuck;
      }
      return probes.isEmpty() ? RestoreProbe.standard() : probes.removeFirst();
    }

    @Override
    public RestoreRequestResult requestRestore(String p_key) {
      requests++;
      return requestResult;
    }
  }

}
