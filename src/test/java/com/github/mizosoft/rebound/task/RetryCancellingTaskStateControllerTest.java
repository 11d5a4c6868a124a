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

import static com.github.mizosoft.rebound.testing.TestUtils.TIMEOUT_SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

import com.github.mizosoft.rebound.OutgoingRequest;
import com.github.mizosoft.rebound.ScheduledRetry;
import com.github.mizosoft.rebound.testing.ExecutorExtension;
import com.github.mizosoft.rebound.testing.RecordingEventSink;
import com.github.mizosoft.rebound.testing.RecordingTransport;
import com.github.mizosoft.rebound.testing.RecordingTransport.RecordingTask;
import com.github.mizosoft.rebound.transport.Transport;
import com.github.mizosoft.rebound.transport.TransportResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;

@Timeout(TIMEOUT_SECONDS)
@ExtendWith(ExecutorExtension.class)
class RetryCancellingTaskStateControllerTest {
  private RecordingEventSink eventSink;
  private BasicTaskStateController basicController;
  private RetryCancellingTaskStateController controller;
  private RecordingTask task;

  @BeforeEach
  void setUp() {
    eventSink = new RecordingEventSink();
    basicController = BasicTaskStateController.newBuilder().eventSink(eventSink).build();
    controller = new RetryCancellingTaskStateController(basicController);

    var transport = new RecordingTransport();
    transport.dispatch(
        OutgoingRequest.GET("https://example.com"),
        new Transport.Callback() {
          @Override
          public void onResponse(TransportResponse response) {}

          @Override
          public void onFailure(Throwable failure) {}
        });
    task = transport.lastAttempt().task();
    basicController.attach(task);
    controller.resume();
  }

  @Test
  void forwardsToDelegate() {
    controller.suspend();
    assertThat(controller.state()).isEqualTo(TaskState.SUSPENDED);
    assertThat(task.suspendCount()).isOne();
    controller.resume();
    assertThat(controller.state()).isEqualTo(TaskState.RUNNING);
    assertThat(controller.toString()).contains("BasicTaskStateController");
  }

  @Test
  void cancelPerformsPendingRetry() {
    var runs = new AtomicInteger();
    var retry = ScheduledRetry.of(runs::incrementAndGet);
    basicController.complete(task);
    controller.trackPendingRetry(retry);
    assertThat(controller.pendingRetry()).containsSame(retry);

    controller.cancel();
    assertThat(retry.isCancelled()).isTrue();
    assertThat(runs).hasValue(1);
    assertThat(controller.pendingRetry()).isEmpty();
    assertThat(controller.isCancelled()).isTrue();
    assertThat(eventSink.count(TaskEvent.Type.DID_CANCEL)).isOne();

    // Firing the cancelled retry afterwards has no effect.
    retry.fire();
    assertThat(runs).hasValue(1);
  }

  @Test
  void cancelWithoutPendingRetry() {
    controller.cancel();
    assertThat(task.cancelCount()).isOne();
    assertThat(controller.isCancelled()).isTrue();
    assertThat(eventSink.count(TaskEvent.Type.DID_CANCEL)).isOne();
  }

  @Test
  void suspendDoesNotAffectPendingRetry() {
    var runs = new AtomicInteger();
    var retry = ScheduledRetry.of(runs::incrementAndGet);
    controller.trackPendingRetry(retry);
    controller.suspend();
    assertThat(retry.isCancelled()).isFalse();
    assertThat(controller.pendingRetry()).containsSame(retry);
    retry.fire();
    assertThat(runs).hasValue(1);
  }

  @Test
  void trackingAfterCancelPerformsRightAway() {
    controller.cancel();
    var runs = new AtomicInteger();
    var retry = ScheduledRetry.of(runs::incrementAndGet);
    controller.trackPendingRetry(retry);
    assertThat(retry.isCancelled()).isTrue();
    assertThat(runs).hasValue(1);
    assertThat(controller.pendingRetry()).isEmpty();
  }

  @Test
  void startedRetryIsNotTracked() {
    var retry = ScheduledRetry.of(() -> {});
    retry.fire();
    controller.trackPendingRetry(retry);
    assertThat(controller.pendingRetry()).isEmpty();
  }

  @Test
  void clearPendingRetryOnlyClearsGivenRetry() {
    var first = ScheduledRetry.of(() -> {});
    var second = ScheduledRetry.of(() -> {});
    controller.trackPendingRetry(second);
    controller.clearPendingRetry(first);
    assertThat(controller.pendingRetry()).containsSame(second);
    controller.clearPendingRetry(second);
    assertThat(controller.pendingRetry()).isEmpty();
  }

  @Test
  void cancelAfterRetryFiredDoesNotRerunWork() {
    var runs = new AtomicInteger();
    var retry = ScheduledRetry.of(runs::incrementAndGet);
    controller.trackPendingRetry(retry);
    retry.fire();
    controller.cancel();
    assertThat(runs).hasValue(1);
    assertThat(retry.isCancelled()).isFalse();
  }

  @RepeatedTest(10)
  void concurrentCancelsRunRetryWorkOnce(Executor executor) throws Exception {
    var runs = new AtomicInteger();
    var retry = ScheduledRetry.of(runs::incrementAndGet);
    basicController.complete(task);
    controller.trackPendingRetry(retry);

    int threadCount = 8;
    var arrival = new CountDownLatch(threadCount);
    var futures = new ArrayList<CompletableFuture<Void>>();
    for (int i = 0; i < threadCount; i++) {
      futures.add(
          CompletableFuture.runAsync(
              () -> {
                arrival.countDown();
                awaitUninterruptibly(arrival);
                controller.cancel();
              },
              executor));
    }
    CompletableFuture.allOf(futures.toArray(CompletableFuture<?>[]::new)).get();

    assertThat(runs).hasValue(1);
    assertThat(eventSink.count(TaskEvent.Type.DID_CANCEL)).isOne();
  }

  @RepeatedTest(10)
  void cancelRacingTimerRunsRetryWorkOnce(Executor executor) throws Exception {
    var runs = new AtomicInteger();
    var retry = ScheduledRetry.of(runs::incrementAndGet);
    controller.trackPendingRetry(retry);

    var arrival = new CountDownLatch(2);
    var futures =
        List.of(
            CompletableFuture.runAsync(
                () -> {
                  arrival.countDown();
                  awaitUninterruptibly(arrival);
                  retry.fire();
                },
                executor),
            CompletableFuture.runAsync(
                () -> {
                  arrival.countDown();
                  awaitUninterruptibly(arrival);
                  controller.cancel();
                },
                executor));
    CompletableFuture.allOf(futures.toArray(CompletableFuture<?>[]::new)).get();

    assertThat(runs).hasValue(1);
    assertThat(eventSink.count(TaskEvent.Type.DID_CANCEL)).isOne();
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
