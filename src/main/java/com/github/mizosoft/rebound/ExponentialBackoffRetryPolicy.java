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

import static com.github.mizosoft.rebound.internal.Utils.requireValidToken;
import static com.github.mizosoft.rebound.internal.Validate.requireArgument;
import static com.github.mizosoft.rebound.internal.Validate.requireNonNegative;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rebound.TransportException.Reason;
import com.github.mizosoft.rebound.internal.Utils;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * A {@link Retrier} that retries idempotent requests failing with transient errors or overload
 * statuses, backing off exponentially between retries.
 *
 * <p>A failed attempt is retried if all of the following hold:
 *
 * <ol>
 *   <li>The request has been retried less than {@link Builder#retryLimit(int) retryLimit} times.
 *   <li>The request's method is one of the {@link Builder#retryableMethods(Set) retryable
 *       methods}.
 *   <li>Either a response was received with one of the {@link Builder#retryableStatusCodes(Set)
 *       retryable status codes}, or the failure is (or is caused by) a {@link TransportException}
 *       with one of the {@link Builder#retryableReasons(Set) retryable reasons}.
 * </ol>
 *
 * <p>The delay before the next attempt is {@code base^retryCount * scale} seconds. With the
 * defaults, that's 0.5s, 1s, 2s, 4s and so on.
 */
public final class ExponentialBackoffRetryPolicy implements Retrier {
  static final int DEFAULT_RETRY_LIMIT = 2;
  static final int DEFAULT_BASE = 2;
  static final double DEFAULT_SCALE = 0.5;
  static final double CONNECTION_LOST_SCALE = 0.25;
  static final Set<String> DEFAULT_RETRYABLE_METHODS =
      Set.of("GET", "HEAD", "PUT", "DELETE", "OPTIONS", "TRACE");
  static final Set<Integer> DEFAULT_RETRYABLE_STATUS_CODES = Set.of(408, 500, 502, 503, 504);

  private final int retryLimit;
  private final int base;
  private final double scale;
  private final Set<String> retryableMethods;
  private final Set<Integer> retryableStatusCodes;
  private final Set<Reason> retryableReasons;

  private ExponentialBackoffRetryPolicy(Builder builder) {
    this.retryLimit = builder.retryLimit;
    this.base = builder.base;
    this.scale = builder.scale;
    this.retryableMethods = Set.copyOf(builder.retryableMethods);
    this.retryableStatusCodes = Set.copyOf(builder.retryableStatusCodes);
    this.retryableReasons = Set.copyOf(builder.retryableReasons);
  }

  public int retryLimit() {
    return retryLimit;
  }

  public int base() {
    return base;
  }

  public double scale() {
    return scale;
  }

  public Set<String> retryableMethods() {
    return retryableMethods;
  }

  public Set<Integer> retryableStatusCodes() {
    return retryableStatusCodes;
  }

  public Set<Reason> retryableReasons() {
    return retryableReasons;
  }

  @Override
  public CompletableFuture<RetryDecision> retry(RetryContext context) {
    return CompletableFuture.completedFuture(decide(context));
  }

  /** Decides whether the failed attempt described by the given context is to be retried. */
  public RetryDecision decide(RetryContext context) {
    requireNonNull(context);
    if (context.retryCount() >= retryLimit
        || !retryableMethods.contains(context.request().method())
        || !isRetryableFailure(context)) {
      return RetryDecision.doNotRetry();
    }
    return RetryDecision.retryAfter(delayFor(context.retryCount()));
  }

  /** Returns the delay to apply before the retry following the given number of retries. */
  public Duration delayFor(int retryCount) {
    requireNonNegative(retryCount, "retryCount");
    return Utils.ofFractionalSeconds(Math.pow(base, retryCount) * scale);
  }

  private boolean isRetryableFailure(RetryContext context) {
    if (context
        .lastResponse()
        .map(response -> retryableStatusCodes.contains(response.statusCode()))
        .orElse(false)) {
      return true;
    }
    for (Throwable cause = context.lastError(); cause != null; cause = cause.getCause()) {
      if (cause instanceof TransportException
          && retryableReasons.contains(((TransportException) cause).reason())) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[retryLimit="
        + retryLimit
        + ", base="
        + base
        + ", scale="
        + scale
        + ", retryableMethods="
        + retryableMethods
        + ", retryableStatusCodes="
        + retryableStatusCodes
        + ", retryableReasons="
        + retryableReasons
        + ']';
  }

  /** Returns an {@code ExponentialBackoffRetryPolicy} with the default configuration. */
  public static ExponentialBackoffRetryPolicy create() {
    return newBuilder().build();
  }

  /**
   * Returns an {@code ExponentialBackoffRetryPolicy} that only retries requests failing because the
   * network connection was lost, backing off with a scale of 0.25 seconds.
   */
  public static ExponentialBackoffRetryPolicy connectionLost() {
    return newBuilder()
        .exponentialBackoffScale(CONNECTION_LOST_SCALE)
        .retryableStatusCodes(Set.of())
        .retryableReasons(Set.of(Reason.NETWORK_CONNECTION_LOST))
        .build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@code ExponentialBackoffRetryPolicy} instances. */
  public static final class Builder {
    private int retryLimit = DEFAULT_RETRY_LIMIT;
    private int base = DEFAULT_BASE;
    private double scale = DEFAULT_SCALE;
    private Set<String> retryableMethods = DEFAULT_RETRYABLE_METHODS;
    private Set<Integer> retryableStatusCodes = DEFAULT_RETRYABLE_STATUS_CODES;
    private Set<Reason> retryableReasons = Reason.transientReasons();

    Builder() {}

    /** Sets the maximum number of retries, not counting the first attempt. The default is 2. */
    @CanIgnoreReturnValue
    public Builder retryLimit(int retryLimit) {
      this.retryLimit = requireNonNegative(retryLimit, "retryLimit");
      return this;
    }

    /** Sets the base of the exponent, which must be at least 2. The default is 2. */
    @CanIgnoreReturnValue
    public Builder exponentialBackoffBase(int base) {
      requireArgument(base >= 2, "Expected base to be at least 2: %d", base);
      this.base = base;
      return this;
    }

    /** Sets the scale, in seconds, the exponent is multiplied by. The default is 0.5. */
    @CanIgnoreReturnValue
    public Builder exponentialBackoffScale(double scale) {
      requireArgument(
          Double.isFinite(scale) && scale > 0, "Expected scale to be positive: %f", scale);
      this.scale = scale;
      return this;
    }

    /** Sets the methods of requests that can be retried. */
    @CanIgnoreReturnValue
    public Builder retryableMethods(Set<String> methods) {
      this.retryableMethods =
          methods.stream()
              .map(method -> requireValidToken(method).toUpperCase(Locale.ROOT))
              .collect(Collectors.toUnmodifiableSet());
      return this;
    }

    /** Sets the response status codes that can be retried. */
    @CanIgnoreReturnValue
    public Builder retryableStatusCodes(Set<Integer> statusCodes) {
      this.retryableStatusCodes = Set.copyOf(statusCodes);
      return this;
    }

    /**
     * Sets the {@link TransportException} reasons that can be retried. The default is all {@link
     * Reason#isTransient() transient} reasons.
     */
    @CanIgnoreReturnValue
    public Builder retryableReasons(Set<Reason> reasons) {
      this.retryableReasons = Set.copyOf(reasons);
      return this;
    }

    public ExponentialBackoffRetryPolicy build() {
      return new ExponentialBackoffRetryPolicy(this);
    }
  }
}
