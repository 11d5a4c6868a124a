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
import com.github.mizosoft.rebound.internal.concurrent.TaskQueue;
import com.github.mizosoft.rebound.task.BasicTaskStateController;
import com.github.mizosoft.rebound.task.CancelStrategy;
import com.github.mizosoft.rebound.task.RetryCancellingTaskStateController;
import com.github.mizosoft.rebound.task.TaskState;
import com.github.mizosoft.rebound.transport.Transport;
import com.github.mizosoft.rebound.transport.TransportResponse;
import com.github.mizosoft.rebound.transport.TransportTask;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A logical request sent by a {@link Session}, spanning the first attempt and any retries. Attempts
 * are made one after another. The next attempt starts only after the previous one's retry decision
 * is made.
 *
 * <p>The {@link #response() response future} completes exactly once, with either the response,
 * the last attempt's error, the error a retrier decided on, or a {@link CancellationException} if
 * the call is cancelled. Cancelling the response future cancels the call.
 */
public final class Call {
  private static final Logger logger = System.getLogger(Call.class.getName());

  private final Session session;
  private final OutgoingRequest request;
  private final BasicTaskStateController taskController;
  private final RetryCancellingTaskStateController controller;
  private final CompletableFuture<Response> responseFuture = new CompletableFuture<>();
  private final AtomicInteger retryCount = new AtomicInteger();
  private final AtomicBoolean cancelled = new AtomicBoolean();

  private volatile @Nullable OutgoingRequest lastRequest;

  Call(Session session, OutgoingRequest request, CancelStrategy cancelStrategy) {
    this.session = session;
    this.request = request;
    this.taskController =
        BasicTaskStateController.newBuilder()
            .eventSink(session.eventSink())
            .cancelStrategy(cancelStrategy)
            .clock(session.clock())
            .queue(TaskQueue.createSuspended(session.executor()))
            .build();
    this.controller = new RetryCancellingTaskStateController(taskController);
    responseFuture.whenComplete(
        (__, ex) -> {
          if (ex instanceof CancellationException) {
            cancelAttempts();
          }
        });
  }

  void start(boolean startImmediately) {
    if (startImmediately) {
      controller.resume();
    }
    attempt();
  }

  /** Returns the original request, before adaptation. */
  public OutgoingRequest request() {
    return request;
  }

  /** Returns the request of the latest attempt, as sent after adaptation. */
  public Optional<OutgoingRequest> lastRequest() {
    return Optional.ofNullable(lastRequest);
  }

  public CompletableFuture<Response> response() {
    return responseFuture;
  }

  /** Returns the number of retries made so far. */
  public int retryCount() {
    return retryCount.get();
  }

  public TaskState state() {
    return controller.state();
  }

  public boolean isCancelled() {
    return cancelled.get() && !taskController.isFinished();
  }

  /** Starts the call if it's not started yet, or continues it if suspended. */
  public void resume() {
    controller.resume();
  }

  /** Pauses the current attempt. A pending retry still fires. */
  public void suspend() {
    controller.suspend();
  }

  /**
   * Cancels the call. The current attempt's task is cancelled, a pending retry is cancelled, and
   * the response future completes with a {@link CancellationException}. Does nothing if the call
   * has already concluded.
   */
  public void cancel() {
    if (!responseFuture.isDone()) {
      cancelAttempts();
    }
  }

  private void cancelAttempts() {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    controller.cancel();
    // A concurrently concluding attempt that got to finish first delivers its own result.
    if (!taskController.isFinished()) {
      completeCancelled();
    }
  }

  private void attempt() {
    if (cancelled.get()) {
      completeCancelled();
      return;
    }

    session
        .interceptor()
        .adapt(request)
        .whenComplete(
            (adaptedRequest, exception) -> {
              if (exception != null) {
                fail(toAdaptationException(Utils.getDeepCompletionCause(exception)));
              } else {
                dispatch(adaptedRequest);
              }
            });
  }

  private AdaptationException toAdaptationException(Throwable cause) {
    return cause instanceof AdaptationException
        ? (AdaptationException) cause
        : new AdaptationException("Couldn't adapt " + request, cause);
  }

  private void dispatch(OutgoingRequest adaptedRequest) {
    if (cancelled.get()) {
      completeCancelled();
      return;
    }

    lastRequest = adaptedRequest;
    var callback = new AttemptCallback(adaptedRequest);
    TransportTask task;
    try {
      task = session.transport().dispatch(adaptedRequest, callback);
    } catch (RuntimeException e) {
      onAttemptFailure(adaptedRequest, TransportException.from(e), null);
      return;
    }
    callback.task = task;

    if (!taskController.attach(task)) {
      completeCancelled();
    } else if (cancelled.get()) {
      // The call was cancelled before the task was attached, so the task escaped that cancel.
      controller.cancel();
    }
  }

  private void onAttemptFailure(
      OutgoingRequest attemptRequest, Throwable error, @Nullable ResponseInfo response) {
    if (cancelled.get()) {
      completeCancelled();
      return;
    }

    var context = RetryContext.of(attemptRequest, retryCount.get(), error, response);
    session
        .interceptor()
        .retry(context)
        .whenComplete(
            (decision, exception) -> {
              if (exception != null) {
                fail(Utils.getDeepCompletionCause(exception));
              } else {
                onRetryDecision(context, decision);
              }
            });
  }

  private void onRetryDecision(RetryContext context, RetryDecision decision) {
    logger.log(Level.DEBUG, () -> "Retry decision for " + context + ": " + decision);
    switch (decision.kind()) {
      case RETRY_NOW:
        retryCount.incrementAndGet();
        attempt();
        break;

      case RETRY_AFTER:
        scheduleRetry(decision.delay().orElseThrow());
        break;

      case DO_NOT_RETRY:
        fail(context.lastError());
        break;

      case DO_NOT_RETRY_WITH_ERROR:
        fail(decision.error().orElseThrow());
        break;

      default:
        throw new AssertionError("Unexpected decision: " + decision);
    }
  }

  private void scheduleRetry(Duration delay) {
    var work = new RetryWork();
    var retry = session.retryScheduler().schedule(delay, work);
    work.retry = retry;
    controller.trackPendingRetry(retry);
  }

  private void succeed(Response response) {
    if (cancelled.get() || !taskController.finish()) {
      completeCancelled();
    } else {
      responseFuture.complete(response);
    }
  }

  private void fail(Throwable error) {
    if (cancelled.get() || !taskController.finish()) {
      completeCancelled();
      return;
    }
    logger.log(Level.DEBUG, () -> "Call for " + request + " failed", error);
    responseFuture.completeExceptionally(error);
  }

  private void completeCancelled() {
    responseFuture.completeExceptionally(new CancellationException("Call was cancelled"));
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[request="
        + request
        + ", retryCount="
        + retryCount.get()
        + ", state="
        + controller.state()
        + "]";
  }

  /** Runs the next attempt when a delayed retry fires, or concludes the call if cancelled. */
  private final class RetryWork implements Runnable {
    volatile @MonotonicNonNull ScheduledRetry retry;

    RetryWork() {}

    @Override
    public void run() {
      var currentRetry = retry;
      if (currentRetry != null) {
        controller.clearPendingRetry(currentRetry);
      }
      if (cancelled.get() || (currentRetry != null && currentRetry.isCancelled())) {
        completeCancelled();
        return;
      }
      retryCount.incrementAndGet();
      attempt();
    }
  }

  private final class AttemptCallback implements Transport.Callback {
    private final OutgoingRequest attemptRequest;
    private final AtomicBoolean called = new AtomicBoolean();

    volatile @MonotonicNonNull TransportTask task;

    AttemptCallback(OutgoingRequest attemptRequest) {
      this.attemptRequest = attemptRequest;
    }

    @Override
    public void onResponse(TransportResponse response) {
      requireNonNull(response);
      if (!called.compareAndSet(false, true)) {
        return;
      }
      completeTask();
      if (session.isAcceptable(response.statusCode())) {
        succeed(new Response(attemptRequest, response.info(), response.body(), retryCount.get()));
      } else {
        onAttemptFailure(
            attemptRequest, new ResponseStatusException(response.info()), response.info());
      }
    }

    @Override
    public void onFailure(Throwable failure) {
      requireNonNull(failure);
      if (!called.compareAndSet(false, true)) {
        return;
      }
      completeTask();
      onAttemptFailure(attemptRequest, TransportException.from(failure), null);
    }

    private void completeTask() {
      var currentTask = task;
      if (currentTask != null) {
        taskController.complete(currentTask);
      }
    }
  }
}
