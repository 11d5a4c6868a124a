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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Daemon executors backing the default {@link com.github.mizosoft.rebound.RetryScheduler}. Each is
 * created on first use. Timers of cancelled retries are removed from the scheduler's queue right
 * away, so a long backoff that's cancelled doesn't linger.
 */
public final class SharedExecutors {
  private SharedExecutors() {}

  /** Returns the executor on which fired retries run. */
  public static ExecutorService executor() {
    return ExecutorHolder.EXECUTOR;
  }

  /** Returns the single-threaded scheduler that waits out retry delays. */
  public static ScheduledExecutorService scheduler() {
    return SchedulerHolder.SCHEDULER;
  }

  private static ThreadFactory daemonThreadFactory(String prefix) {
    var nextThreadId = new AtomicInteger();
    return r -> {
      var thread = new Thread(r, prefix + nextThreadId.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    };
  }

  private static final class ExecutorHolder {
    static final ExecutorService EXECUTOR =
        Executors.newCachedThreadPool(daemonThreadFactory("rebound-retry-"));
  }

  private static final class SchedulerHolder {
    static final ScheduledExecutorService SCHEDULER;

    static {
      var scheduler = new ScheduledThreadPoolExecutor(1, daemonThreadFactory("rebound-timer-"));
      scheduler.setRemoveOnCancelPolicy(true);
      SCHEDULER = scheduler;
    }
  }
}
