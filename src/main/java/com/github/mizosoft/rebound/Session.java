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
import com.github.mizosoft.rebound.task.CancelStrategy;
import com.github.mizosoft.rebound.task.EventSink;
import com.github.mizosoft.rebound.transport.Transport;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.function.IntPredicate;

/**
 * Sends requests through a {@link Transport}, adapting them and retrying failed attempts with an
 * {@link Interceptor}.
 *
 * <pre>{@code
 * var session = Session.newBuilder(HttpClientTransport.create())
 *     .interceptor(Interceptor.newBuilder()
 *         .adapter(Adapter.header("Authorization", "Bearer " + token))
 *         .retrier(ExponentialBackoffRetryPolicy.create())
 *         .build())
 *     .build();
 * var response = session.send(OutgoingRequest.GET("https://example.com")).response().get();
 * }</pre>
 */
public final class Session {
  private final Transport transport;
  private final Interceptor interceptor;
  private final RetryScheduler retryScheduler;
  private final EventSink eventSink;
  private final Executor executor;
  private final Clock clock;
  private final IntPredicate acceptableStatus;
  private final boolean startImmediately;
  private final CancelStrategy cancelStrategy;

  private Session(Builder builder) {
    this.transport = builder.transport;
    this.interceptor = builder.interceptor;
    this.retryScheduler = builder.retryScheduler;
    this.eventSink = builder.eventSink;
    this.executor = builder.executor;
    this.clock = builder.clock;
    this.acceptableStatus = builder.acceptableStatus;
    this.startImmediately = builder.startImmediately;
    this.cancelStrategy = builder.cancelStrategy;
  }

  /** Starts sending the given request with this session's cancel strategy. */
  public Call send(OutgoingRequest request) {
    return send(request, cancelStrategy);
  }

  /** Starts sending the given request, cancelling its tasks with the given strategy. */
  public Call send(OutgoingRequest request, CancelStrategy cancelStrategy) {
    requireNonNull(request);
    requireNonNull(cancelStrategy);
    var call = new Call(this, request, cancelStrategy);
    call.start(startImmediately);
    return call;
  }

  public Transport transport() {
    return transport;
  }

  public Interceptor interceptor() {
    return interceptor;
  }

  public RetryScheduler retryScheduler() {
    return retryScheduler;
  }

  EventSink eventSink() {
    return eventSink;
  }

  Executor executor() {
    return executor;
  }

  Clock clock() {
    return clock;
  }

  boolean isAcceptable(int statusCode) {
    return acceptableStatus.test(statusCode);
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[transport="
        + transport
        + ", interceptor="
        + interceptor
        + "]";
  }

  public static Builder newBuilder(Transport transport) {
    return new Builder(transport);
  }

  /** A builder of {@code Session} instances. */
  public static final class Builder {
    private final Transport transport;
    private Interceptor interceptor = Interceptor.empty();
    private RetryScheduler retryScheduler = RetryScheduler.defaultScheduler();
    private EventSink eventSink = EventSink.none();
    private Executor executor = Runnable::run;
    private Clock clock = Utils.systemMillisUtc();
    private IntPredicate acceptableStatus = statusCode -> statusCode >= 200 && statusCode < 300;
    private boolean startImmediately = true;
    private CancelStrategy cancelStrategy = CancelStrategy.plain();

    Builder(Transport transport) {
      this.transport = requireNonNull(transport);
    }

    @CanIgnoreReturnValue
    public Builder interceptor(Interceptor interceptor) {
      this.interceptor = requireNonNull(interceptor);
      return this;
    }

    /**
     * Sets the scheduler of delayed retries. The default scheduler waits on a shared daemon
     * thread.
     */
    @CanIgnoreReturnValue
    public Builder retryScheduler(RetryScheduler retryScheduler) {
      this.retryScheduler = requireNonNull(retryScheduler);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder eventSink(EventSink eventSink) {
      this.eventSink = requireNonNull(eventSink);
      return this;
    }

    /**
     * Sets the executor on which tasks are started. By default, tasks are started on the thread
     * that resumes the call, or that completes the previous step.
     */
    @CanIgnoreReturnValue
    public Builder executor(Executor executor) {
      this.executor = requireNonNull(executor);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder clock(Clock clock) {
      this.clock = requireNonNull(clock);
      return this;
    }

    /**
     * Sets the predicate deciding which status codes make a successful response. Other status
     * codes fail the attempt with a {@link ResponseStatusException}. The default accepts 2xx.
     */
    @CanIgnoreReturnValue
    public Builder acceptableStatus(IntPredicate acceptableStatus) {
      this.acceptableStatus = requireNonNull(acceptableStatus);
      return this;
    }

    /**
     * Sets whether calls are resumed as soon as they're sent. Otherwise, calls wait for {@link
     * Call#resume()}. The default is {@code true}.
     */
    @CanIgnoreReturnValue
    public Builder startImmediately(boolean startImmediately) {
      this.startImmediately = startImmediately;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder cancelStrategy(CancelStrategy cancelStrategy) {
      this.cancelStrategy = requireNonNull(cancelStrategy);
      return this;
    }

    public Session build() {
      return new Session(this);
    }
  }
}
