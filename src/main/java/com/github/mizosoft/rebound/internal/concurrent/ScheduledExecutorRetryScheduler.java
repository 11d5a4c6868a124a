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

package com.github.mizosoft.rebound.internal.concurrent;

import static com.github.mizosoft.rebound.internal.Validate.requireNonNegativeDelay;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

import com.github.mizosoft.rebound.RetryScheduler;
import com.github.mizosoft.rebound.ScheduledRetry;
import com.github.mizosoft.rebound.internal.Utils;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;

/** A {@link RetryScheduler} backed by a {@link ScheduledExecutorService}. */
public final class ScheduledExecutorRetryScheduler implements RetryScheduler {
  private static final Logger logger =
      System.getLogger(ScheduledExecutorRetryScheduler.class.getName());

  private final ScheduledExecutorService scheduler;
  private final Executor executor;

  public ScheduledExecutorRetryScheduler(ScheduledExecutorService scheduler, Executor executor) {
    this.scheduler = requireNonNull(scheduler);
    this.executor = requireNonNull(executor);
  }

  @Override
  public ScheduledRetry schedule(Duration delay, Runnable work) {
    requireNonNegativeDelay(delay);
    var retry = ScheduledRetry.of(work);
    if (delay.isZero()) {
      fireOnExecutor(retry);
    } else {
      retry.bindTimer(
          scheduler.schedule(() -> fireOnExecutor(retry), NANOSECONDS.convert(delay), NANOSECONDS));
    }
    return retry;
  }

  private void fireOnExecutor(ScheduledRetry retry) {
    try {
      executor.execute(retry::fire);
    } catch (RejectedExecutionException e) {
      logger.log(Level.WARNING, "Executor rejected retry, firing it inline", e);
      retry.fire();
    }
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[scheduler="
        + scheduler
        + ", executor="
        + executor
        + "]";
  }
}
