package com.daveeberhart.backup_util.cloud_volumes.pipeline;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.backup_util.cloud_volumes.error.BackupFailedException;
import com.daveeberhart.backup_util.cloud_volumes.error.BackupFailedException.UploadFailedException;
import com.daveeberhart.backup_util.cloud_volumes.volume.Volume;

/**
 * Handle on a running {@link UploadChain}: the stream of volumes that made it, plus a join point
 * that reports the first failure.
 *
 * @author deberhar
 */
public class UploadRun {
  private static final Logger log = LoggerFactory.getLogger(UploadRun.class);

  private static final Object END = new Object();

  private final BlockingQueue<Object> successes = new LinkedBlockingQueue<>();
  private final CompletableFuture<Void> completion = new CompletableFuture<>();
  private final AtomicReference<Throwable> firstError = new AtomicReference<>();
  private final AtomicBoolean stopping = new AtomicBoolean();
  private final AtomicBoolean consumed = new AtomicBoolean();
  private final Set<Thread> activeThreads = ConcurrentHashMap.newKeySet();
  private final FailurePolicy failurePolicy;

  private volatile boolean cancelled;
  private volatile Thread dispatcher;

  UploadRun(FailurePolicy p_failurePolicy) {
    failurePolicy = p_failurePolicy;
  }

  /**
   * Volumes that were uploaded, in completion order.  Iterating blocks until the next volume
   * finishes, and ends once every volume has been dealt with.  Can only be iterated once.
   */
  public Iterable<Volume> successes() {
    return () -> {
      if (!consumed.compareAndSet(false, true)) {
        throw new IllegalStateException("Successes of an upload run can only be iterated once");
      }
      return new SuccessIterator();
    };
  }

  /**
   * Completes normally if every volume was uploaded, exceptionally with the first failure
   * otherwise, and is cancelled if the run was.
   */
  public CompletableFuture<Void> completion() {
    return completion;
  }

  /**
   * Wait for the whole run to finish.
   *
   * @throws UploadFailedException with the first volume failure as its cause
   * @throws CancellationException if the run was cancelled
   */
  public void await() throws InterruptedException {
    try {
      completion.get();
    } catch (ExecutionException e) {
      throw new UploadFailedException("Upload failed: " + e.getCause().getMessage(), e.getCause());
    }
  }

  /**
   * Stop dispatching volumes and interrupt the uploads in flight.  The run still finishes
   * normally (successes end, completion is cancelled) once the workers have stopped.
   */
  public void cancel() {
    cancelled = true;
    stop();
  }

  public boolean isCancelled() {
    return cancelled;
  }

  public boolean isDone() {
    return completion.isDone();
  }

  public Throwable getFirstError() {
    return firstError.get();
  }

  boolean isStopping() {
    return stopping.get();
  }

  void setDispatcher(Thread p_dispatcher) {
    dispatcher = p_dispatcher;
  }

  void enter() {
    activeThreads.add(Thread.currentThread());
  }

  void leave() {
    activeThreads.remove(Thread.currentThread());
  }

  void succeeded(Volume p_volume) {
    successes.add(p_volume);
  }

  void failed(Volume p_volume, Throwable p_error) {
    if (firstError.compareAndSet(null, p_error)) {
      log.error("First failure in this run: {}", p_volume, p_error);
    }
    if (failurePolicy == FailurePolicy.ABORT && !stopping.get()) {
      log.warn("Aborting remaining uploads after failure of {}", p_volume);
      stop();
    }
  }

  /**
   * Called by the dispatcher once no worker is running.
   */
  void finish() {
    successes.add(END);
    if (cancelled) {
      completion.cancel(false);
    } else if (firstError.get() != null) {
      completion.completeExceptionally(firstError.get());
    } else {
      completion.complete(null);
    }
  }

  private void stop() {
    if (!stopping.compareAndSet(false, true)) {
      return;
    }
    Thread d = dispatcher;
    if (d != null) {
      d.interrupt();
    }
    for (Thread t : activeThreads) {
      if (t != Thread.currentThread()) {
        t.interrupt();
      }
    }
  }

  private class SuccessIterator implements Iterator<Volume> {
    private Object next;

    @Override
    public boolean hasNext() {
      if (next == null) {
        try {
          next = successes.take();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new BackupFailedException("Interrupted while waiting for uploads", e);
        }
      }
      return next != END;
    }

    @Override
    public Volume next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Volume v = (Volume)next;
      next = null;
      return v;
    }
  }

}
