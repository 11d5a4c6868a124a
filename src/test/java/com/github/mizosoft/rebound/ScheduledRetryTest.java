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

import static com.github.mizosoft.rebound.testing.TestUtils.TIMEOUT_SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

import com.github.mizosoft.rebound.testing.ExecutorExtension;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;

@Timeout(TIMEOUT_SECONDS)
class ScheduledRetryTest {
  @Test
  void fireRunsWorkOnce() {
    var runs = new AtomicInteger();
    var retry = ScheduledRetry.of(runs::incrementAndGet);
    assertThat(retry.isStarted()).isFalse();
    retry.fire();
    retry.fire();
    retry.perform();
    assertThat(runs).hasValue(1);
    assertThat(retry.isStarted()).isTrue();
    assertThat(retry.isCancelled()).isFalse();
  }

  @Test
  void cancelPreventsFiring() {
    var runs = new AtomicInteger();
    var retry = ScheduledRetry.of(runs::incrementAndGet);
    assertThat(retry.cancel()).isTrue();
    assertThat(retry.cancel()).isFalse();
    retry.fire();
    assertThat(runs).hasValue(0);
    assertThat(retry.isCancelled()).isTrue();
  }

  @Test
  void cancelledRetryCanStillBePerformed() {
    var runs = new AtomicInteger();
    var retry = ScheduledRetry.of(runs::incrementAndGet);
    assertThat(retry.cancel()).isTrue();
    retry.perform();
    retry.perform();
    retry.fire();
    assertThat(runs).hasValue(1);
  }

  @Test
  void cancelAfterFiringFails() {
    var retry = ScheduledRetry.of(() -> {});
    retry.fire();
    assertThat(retry.cancel()).isFalse();
    assertThat(retry.isCancelled()).isFalse();
  }

  @Test
  void cancelCancelsBoundTimer() {
    var timer = new CompletableFuture<Void>();
    var retry = ScheduledRetry.of(() -> {});
    retry.bindTimer(timer);
    retry.cancel();
    assertThat(timer).isCancelled();
  }

  @Test
  void bindingTimerAfterCancellationCancelsTimer() {
    var timer = new CompletableFuture<Void>();
    var retry = ScheduledRetry.of(() -> {});
    retry.cancel();
    retry.bindTimer(timer);
    assertThat(timer).isCancelled();
  }

  @RepeatedTest(10)
  @ExtendWith(ExecutorExtension.class)
  void fireRacingCancelHasOneWinner(Executor executor) throws Exception {
    var runs = new AtomicInteger();
    var cancelled = new AtomicBoolean();
    var retry = ScheduledRetry.of(runs::incrementAndGet);
    var arrival = new CountDownLatch(2);
    var fired =
        CompletableFuture.runAsync(
            () -> {
              arrival.countDown();
              awaitUninterruptibly(arrival);
              retry.fire();
            },
            executor);
    var cancel =
        CompletableFuture.runAsync(
            () -> {
              arrival.countDown();
              awaitUninterruptibly(arrival);
              cancelled.set(retry.cancel());
            },
            executor);
    CompletableFuture.allOf(fired, cancel).get();

    // Exactly one of firing or cancellation takes effect.
    assertThat(runs.get() + (cancelled.get() ? 1 : 0)).isEqualTo(1);
  }

  private static void awaitUninterruptibly(CountDownLatch latch) {
    try {
      latch.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }
}
