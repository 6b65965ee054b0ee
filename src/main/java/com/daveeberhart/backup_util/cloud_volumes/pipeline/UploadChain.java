package com.daveeberhart.backup_util.cloud_volumes.pipeline;

import java.io.IOException;
import java.time.Duration;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.backup_util.cloud_volumes.Sleeper;
import com.daveeberhart.backup_util.cloud_volumes.backend.Backend;
import com.daveeberhart.backup_util.cloud_volumes.volume.Checksums;
import com.daveeberhart.backup_util.cloud_volumes.volume.Volume;

/**
 * Uploads a stream of volumes to a backend, at most {@link JobInfo#getMaxParallelUploads()} at a time.
 * <p>
 * Each volume is checked before its first attempt, then retried with exponential backoff until it
 * succeeds, fails permanently, or runs out of retry time.  Volumes that made it come out of
 * {@link UploadRun#successes()}; the first failure is reported by {@link UploadRun#await()}.
 *
 * @author deberhar
 */
public class UploadChain {
  private static final Logger log = LoggerFactory.getLogger(UploadChain.class);

  private static final AtomicInteger RUN_COUNTER = new AtomicInteger();

  private final Backend backend;
  private final JobInfo job;
  private final String destination;
  private final Sleeper sleeper;
  private final LongSupplier nanoClock;
  private final DoubleSupplier random;

  UploadChain(Backend p_backend, JobInfo p_job, String p_destination, Sleeper p_sleeper, LongSupplier p_nanoClock, DoubleSupplier p_random) {
    backend = p_backend;
    job = p_job;
    destination = p_destination;
    sleeper = p_sleeper;
    nanoClock = p_nanoClock;
    random = p_random;
  }

  /**
   * Start uploading.  Returns immediately; the inputs are consumed on a background thread.
   *
   * @param p_inputs volumes to upload; may block while the producer catches up
   * @param p_destination where the volumes are going, for logging
   */
  public static UploadRun start(Iterator<? extends Volume> p_inputs, Backend p_backend, JobInfo p_job, String p_destination) {
    return new UploadChain(p_backend, p_job, p_destination, Sleeper.THREAD, System::nanoTime,
        () -> ThreadLocalRandom.current().nextDouble()).run(p_inputs);
  }

  UploadRun run(Iterator<? extends Volume> p_inputs) {
    final int parallel = job.getMaxParallelUploads();
    final int runId = RUN_COUNTER.incrementAndGet();
    final UploadRun run = new UploadRun(job.getFailurePolicy());
    final ExecutorService workers = Executors.newFixedThreadPool(parallel, threadFactory("upload-" + runId + "-worker-"));

    Thread dispatcher = threadFactory("upload-" + runId + "-dispatcher").newThread(
        () -> dispatch(p_inputs, workers, run, parallel));
    run.setDispatcher(dispatcher);
    log.info("Uploading to {} with {}", destination, job);
    dispatcher.start();
    return run;
  }

  private void dispatch(Iterator<? extends Volume> p_inputs, ExecutorService p_workers, UploadRun p_run, int p_parallel) {
    // one slot per worker keeps the producer from running ahead of the uploads
    final Semaphore slots = new Semaphore(p_parallel);
    final Semaphore tokens = new Semaphore(p_parallel);
    int dispatched = 0;
    try {
      while (!p_run.isStopping() && p_inputs.hasNext()) {
        final Volume volume = p_inputs.next();
        slots.acquire();
        if (p_run.isStopping()) {
          slots.release();
          break;
        }
        try {
          p_workers.execute(() -> {
            p_run.enter();
            try {
              if (!p_run.isStopping()) {
                process(volume, tokens, p_run);
              }
            } finally {
              p_run.leave();
              // don't carry a stray interrupt into the next volume on this thread
              Thread.interrupted();
              slots.release();
            }
          });
          dispatched++;
        } catch (RejectedExecutionException e) {
          slots.release();
          throw e;
        }
      }
    } catch (InterruptedException e) {
      log.info("Upload to {} stopped after dispatching {} volumes", destination, dispatched);
    } catch (RuntimeException e) {
      // the producer broke; nothing more to dispatch
      log.error("Could not read the next volume for {}", destination, e);
      p_run.failed(null, e);
    } finally {
      slots.acquireUninterruptibly(p_parallel);
      p_workers.shutdown();
      log.info("Upload to {} finished: {} volumes dispatched{}", destination, dispatched,
          p_run.getFirstError() == null ? "" : ", first failure: " + p_run.getFirstError().getMessage());
      p_run.finish();
    }
  }

  private void process(Volume p_volume, Semaphore p_tokens, UploadRun p_run) {
    try {
      uploadWithRetry(p_volume, p_tokens, p_run);
      p_run.succeeded(p_volume);
    } catch (InterruptedException e) {
      log.info("Upload of {} interrupted", p_volume);
    } catch (IOException | RuntimeException e) {
      log.error("Failed to upload {} to {}", p_volume, destination, e);
      p_run.failed(p_volume, e);
    } catch (Error e) {
      log.error("Failed to upload {} to {}", p_volume, destination, e);
      p_run.failed(p_volume, e);
      throw e;
    }
  }

  private void uploadWithRetry(Volume p_volume, Semaphore p_tokens, UploadRun p_run) throws IOException, InterruptedException {
    Checksums.decode(p_volume.getChecksum());

    ExponentialBackoff backoff = new ExponentialBackoff(job.getMaxBackoffTime(), job.getMaxRetryTime(), nanoClock, random);
    for (int attempt = 1; ; attempt++) {
      Exception failure;
      p_tokens.acquire();
      try {
        backend.upload(p_volume);
        if (attempt > 1) {
          log.info("Uploaded {} on attempt {}", p_volume, attempt);
        }
        return;
      } catch (IOException | RuntimeException e) {
        failure = e;
      } finally {
        p_tokens.release();
      }

      if (p_run.isStopping()) {
        throw new InterruptedException("Upload of " + p_volume + " stopped");
      }
      if (FailureClassifier.isPermanent(failure)) {
        throw rethrow(failure);
      }
      Optional<Duration> delay = backoff.nextDelay();
      if (!delay.isPresent()) {
        log.warn("Giving up on {} after {} attempts in {}", p_volume, attempt, backoff.getElapsed());
        throw rethrow(failure);
      }
      log.warn("Upload of {} failed (attempt {}): {}. Retrying in {}ms", p_volume, attempt, failure.getMessage(), delay.get().toMillis());
      sleeper.sleep(delay.get());
    }
  }

  private static IOException rethrow(Exception p_failure) {
    if (p_failure instanceof RuntimeException) {
      throw (RuntimeException)p_failure;
    }
    return (IOException)p_failure;
  }

  private static ThreadFactory threadFactory(final String p_name) {
    final AtomicInteger count = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, p_name.endsWith("-") ? p_name + count.incrementAndGet() : p_name);
      t.setDaemon(true);
      return t;
    };
  }

}
