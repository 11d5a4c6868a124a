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

package com.github.mizosoft.rebound;

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rebound.internal.Utils;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Retry work scheduled by a {@link RetryScheduler} to run after a delay. The work runs at most
 * once, either when the delay elapses or when {@link #perform() forced}. The timer firing and
 * {@link #cancel()} race on a single atomic state, so exactly one of them wins.
 */
public final class ScheduledRetry {
  private static final int PENDING = 0;
  private static final int FIRED = 1;
  private static final int CANCELLED = 2;

  private final Runnable work;
  private final AtomicInteger state = new AtomicInteger(PENDING);
  private final AtomicBoolean performed = new AtomicBoolean();

  private volatile @Nullable Future<?> timer;

  private ScheduledRetry(Runnable work) {
    this.work = requireNonNull(work);
  }

  /** Returns whether this retry was cancelled before its work started. */
  public boolean isCancelled() {
    return state.get() == CANCELLED;
  }

  /** Returns whether the work has started, either by the timer or by {@link #perform()}. */
  public boolean isStarted() {
    return performed.get();
  }

  /**
   * Cancels this retry if its work hasn't started yet. Returns {@code true} if this call is the one
   * that cancelled the retry, in which case the timer won't run the work.
   */
  public boolean cancel() {
    if (!state.compareAndSet(PENDING, CANCELLED)) {
      return false;
    }
    var currentTimer = timer;
    if (currentTimer != null) {
      currentTimer.cancel(false);
    }
    return true;
  }

  /**
   * Runs the work right away in the calling thread, unless it has already run. A cancelled retry's
   * work can still be performed. It's expected to observe the cancellation and conclude the
   * request.
   */
  public void perform() {
    state.compareAndSet(PENDING, FIRED);
    if (performed.compareAndSet(false, true)) {
      work.run();
    }
  }

  /**
   * Runs the work if this retry is neither cancelled nor started. Called by schedulers when the
   * delay elapses.
   */
  public void fire() {
    if (state.compareAndSet(PENDING, FIRED) && performed.compareAndSet(false, true)) {
      work.run();
    }
  }

  /** Binds the timer that fires this retry, so that it's cancelled along with it. */
  public void bindTimer(Future<?> timer) {
    this.timer = requireNonNull(timer);
    if (isCancelled()) {
      timer.cancel(false);
    }
  }

  @Override
  public String toString() {
    int s = state.get();
    return Utils.toStringIdentityPrefix(this)
        + "[state="
        + (s == PENDING ? "PENDING" : s == FIRED ? "FIRED" : "CANCELLED")
        + ", performed="
        + performed.get()
        + "]";
  }

  /** Returns a pending retry that runs the given work. */
  public static ScheduledRetry of(Runnable work) {
    return new ScheduledRetry(work);
  }
}
