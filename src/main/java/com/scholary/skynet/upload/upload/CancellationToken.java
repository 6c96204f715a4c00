package com.scholary.skynet.upload.upload;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation for one logical upload.
 *
 * <p>Passed explicitly into the coordinator. Sessions poll it between chunks and sleep on it
 * between retries, so a cancel wakes them immediately. A {@link #child()} token is cancelled with
 * its parent but can also be cancelled on its own, which is how a failing session aborts its
 * siblings without touching the caller's token.
 */
public final class CancellationToken {

  private final CountDownLatch latch = new CountDownLatch(1);
  private final List<Runnable> callbacks = new ArrayList<>();
  private boolean cancelled;
  private CancellationToken parent;
  private Runnable parentLink;

  public static CancellationToken create() {
    return new CancellationToken();
  }

  public void cancel() {
    List<Runnable> toRun;
    synchronized (this) {
      if (cancelled) {
        return;
      }
      cancelled = true;
      toRun = new ArrayList<>(callbacks);
      callbacks.clear();
    }
    latch.countDown();
    toRun.forEach(Runnable::run);
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  /** Register a callback run once on cancel, or immediately if already cancelled. */
  public void onCancel(Runnable callback) {
    synchronized (this) {
      if (!cancelled) {
        callbacks.add(callback);
        return;
      }
    }
    callback.run();
  }

  /** Create a token cancelled with this one. Call {@link #detach()} on it once it is done. */
  public CancellationToken child() {
    CancellationToken child = new CancellationToken();
    Runnable link = child::cancel;
    synchronized (child) {
      child.parent = this;
      child.parentLink = link;
    }
    onCancel(link);
    return child;
  }

  /** Unlink a child token from its parent. No-op for root tokens or repeated calls. */
  public void detach() {
    CancellationToken from;
    Runnable link;
    synchronized (this) {
      from = parent;
      link = parentLink;
      parent = null;
      parentLink = null;
    }
    if (from != null) {
      from.removeCallback(link);
    }
  }

  private synchronized void removeCallback(Runnable callback) {
    callbacks.remove(callback);
  }

  synchronized int callbackCount() {
    return callbacks.size();
  }

  public void throwIfCancelled() {
    if (isCancelled()) {
      throw new UploadCancelledException("Upload was cancelled");
    }
  }

  /**
   * Sleep for {@code duration} unless cancelled first.
   *
   * @throws UploadCancelledException if the token is cancelled or the thread interrupted
   */
  public void sleep(Duration duration) {
    throwIfCancelled();
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      if (latch.await(duration.toNanos(), TimeUnit.NANOSECONDS)) {
        throw new UploadCancelledException("Upload was cancelled while waiting to retry");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UploadCancelledException("Interrupted while waiting to retry", e);
    }
  }
}
