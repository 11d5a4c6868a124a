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

import com.github.mizosoft.rebound.internal.concurrent.ScheduledExecutorRetryScheduler;
import com.github.mizosoft.rebound.internal.concurrent.SharedExecutors;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/** Schedules retry work to run after a delay. */
@FunctionalInterface
public interface RetryScheduler {

  /**
   * Schedules the given work to run after the given delay. A zero delay runs the work as soon as
   * possible.
   */
  ScheduledRetry schedule(Duration delay, Runnable work);

  /**
   * Returns a {@code RetryScheduler} that waits on the given {@code ScheduledExecutorService} and
   * runs work on the given {@code Executor}.
   */
  static RetryScheduler create(ScheduledExecutorService scheduler, Executor executor) {
    return new ScheduledExecutorRetryScheduler(scheduler, executor);
  }

  /** Returns a {@code RetryScheduler} that uses the library's shared daemon threads. */
  static RetryScheduler defaultScheduler() {
    return DefaultRetrySchedulerHolder.INSTANCE;
  }
}

final class DefaultRetrySchedulerHolder {
  static final RetryScheduler INSTANCE =
      new ScheduledExecutorRetryScheduler(SharedExecutors.scheduler(), SharedExecutors.executor());

  private DefaultRetrySchedulerHolder() {}
}
