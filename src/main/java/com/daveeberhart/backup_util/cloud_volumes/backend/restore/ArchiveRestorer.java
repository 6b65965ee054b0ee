package com.daveeberhart.backup_util.cloud_volumes.backend.restore;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.backup_util.cloud_volumes.Sleeper;
import com.daveeberhart.backup_util.cloud_volumes.error.BackupFailedException.RestoreTimeoutException;

/**
 * Makes archived objects readable again: requests a restore where none was requested, then polls
 * until the provider reports the restored copy is available.
 * <p>
 * Keys are handled one after the other; the first key that can't be made available aborts the
 * whole call.  Probe and request errors are rethrown as the provider raised them.
 *
 * @author deberhar
 */
public class ArchiveRestorer {
  private static final Logger log = LoggerFactory.getLogger(ArchiveRestorer.class);

  private final RestoreOperations operations;
  private final PollSchedule schedule;
  private final Sleeper sleeper;

  public ArchiveRestorer(RestoreOperations p_operations, PollSchedule p_schedule, Sleeper p_sleeper) {
    operations = p_operations;
    schedule = p_schedule;
    sleeper = p_sleeper;
  }

  /**
   * Return once every key is {@link RestoreState#STANDARD} or {@link RestoreState#AVAILABLE}.
   *
   * @throws RestoreTimeoutException if a restore doesn't finish within the poll schedule
   */
  public void ensureAvailable(List<String> p_keys) throws IOException, InterruptedException {
    if (p_keys == null || p_keys.isEmpty()) {
      return;
    }

    for (String key : p_keys) {
      ensureAvailable(key);
    }
  }

  /**
   * @return The terminal state the key ended up in.
   */
  public RestoreState ensureAvailable(String p_key) throws IOException, InterruptedException {
    RestoreProbe probe = operations.probe(p_key);
    RestoreState state = RestoreState.initial(probe);
    log.debug("Object {} is {} ({})", p_key, state, probe);

    if (state == RestoreState.ARCHIVED_UNREQUESTED) {
      RestoreRequestResult result = operations.requestRestore(p_key);
      if (result == RestoreRequestResult.ALREADY_IN_PROGRESS) {
        log.info("Restore of object {} was already requested; waiting for it to complete", p_key);
      }
      state = state.afterRequest(result);
    }

    Duration waited = Duration.ZERO;
    Duration interval = schedule.getInitialInterval();
    while (state.isPolling()) {
      if (waited.plus(interval).compareTo(schedule.getMaxWait()) > 0) {
        throw new RestoreTimeoutException("Restore of object " + p_key + " did not complete within " + schedule.getMaxWait());
      }

      log.debug("Waiting {} for restore of object {} ({} so far)", interval, p_key, waited);
      sleeper.sleep(interval);
      waited = waited.plus(interval);
      interval = schedule.next(interval);

      state = state.afterPoll(operations.probe(p_key));
    }

    if (!waited.isZero()) {
      log.info("Object {} is {} after waiting {}", p_key, state, waited);
    }
    return state;
  }

}
