/*
 * Copyright (c) 2025 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.rebound.task;

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rebound.ScheduledRetry;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link TaskStateController} that also cancels the request's pending {@link ScheduledRetry}, if
 * any, when cancelled.
 *
 * <p>If the pending retry hadn't started when cancelled, its work is performed right away in its
 * cancelled state, so that the request concludes now rather than when the timer would have fired.
 * Whether the retry had started and cancelling it is decided in one atomic step by {@link
 * ScheduledRetry#cancel()}, so concurrent cancellations, or a cancellation racing the timer,
 * still run the retry work exactly once.
 *
 * <p>Suspending doesn't affect the pending retry.
 */
public final class RetryCancellingTaskStateController extends ForwardingTaskStateController {
  private final TaskStateController delegate;
  private final ReentrantLock lock = new ReentrantLock();

  @GuardedBy("lock")
  private @Nullable ScheduledRetry pendingRetry;

  @GuardedBy("lock")
  private boolean cancelled;

  public RetryCancellingTaskStateController(TaskStateController delegate) {
    this.delegate = requireNonNull(delegate);
  }

  @Override
  protected TaskStateController delegate() {
    return delegate;
  }

  /**
   * Tracks the given retry as the pending one. If this controller is already cancelled, the retry
   * is cancelled and performed right away. Retries that have already started aren't tracked.
   */
  public void trackPendingRetry(ScheduledRetry retry) {
    requireNonNull(retry);
    boolean cancelNow;
    lock.lock();
    try {
      cancelNow = cancelled;
      if (!cancelNow && !retry.isStarted()) {
        pendingRetry = retry;
      }
    } finally {
      lock.unlock();
    }

    if (cancelNow) {
      cancelAndPerform(retry);
    }
  }

  /** Stops tracking the given retry if it's the pending one. */
  public void clearPendingRetry(ScheduledRetry retry) {
    lock.lock();
    try {
      if (pendingRetry == retry) {
        pendingRetry = null;
      }
    } finally {
      lock.unlock();
    }
  }

  public Optional<ScheduledRetry> pendingRetry() {
    lock.lock();
    try {
      return Optional.ofNullable(pendingRetry);
    } finally {
      lock.unlock();
    }
  }

  public boolean isCancelled() {
    lock.lock();
    try {
      return cancelled;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void cancel() {
    super.cancel();

    ScheduledRetry retry;
    lock.lock();
    try {
      cancelled = true;
      retry = pendingRetry;
      pendingRetry = null;
    } finally {
      lock.unlock();
    }

    if (retry != null) {
      cancelAndPerform(retry);
    }
  }

  private static void cancelAndPerform(ScheduledRetry retry) {
    if (retry.cancel()) {
      retry.perform();
    }
  }
}
