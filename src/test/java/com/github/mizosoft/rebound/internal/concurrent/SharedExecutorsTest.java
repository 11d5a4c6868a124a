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

import static com.github.mizosoft.rebound.testing.TestUtils.TIMEOUT_SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

import com.github.mizosoft.rebound.RetryScheduler;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(TIMEOUT_SECONDS)
class SharedExecutorsTest {
  @Test
  void executorsAreShared() {
    assertThat(SharedExecutors.executor()).isSameAs(SharedExecutors.executor());
    assertThat(SharedExecutors.scheduler()).isSameAs(SharedExecutors.scheduler());
  }

  @Test
  void retriesRunOnDaemonThreads() {
    var thread = new CompletableFuture<Thread>();
    RetryScheduler.defaultScheduler()
        .schedule(Duration.ofMillis(10), () -> thread.complete(Thread.currentThread()));
    assertThat(thread)
        .succeedsWithin(Duration.ofSeconds(TIMEOUT_SECONDS))
        .satisfies(
            t -> {
              assertThat(t.isDaemon()).isTrue();
              assertThat(t.getName()).startsWith("rebound-retry-");
            });
  }

  @Test
  void cancelledRetryLeavesTimerQueue() {
    var scheduler = (ScheduledThreadPoolExecutor) SharedExecutors.scheduler();
    assertThat(scheduler.getRemoveOnCancelPolicy()).isTrue();

    int queuedBefore = scheduler.getQueue().size();
    var retry = RetryScheduler.defaultScheduler().schedule(Duration.ofHours(1), () -> {});
    assertThat(scheduler.getQueue()).hasSize(queuedBefore + 1);
    assertThat(retry.cancel()).isTrue();
    assertThat(scheduler.getQueue()).hasSize(queuedBefore);
  }
}
