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

import static com.github.mizosoft.rebound.internal.Validate.requireNonNegativeDelay;
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The outcome of consulting a {@link Retrier}. A decision either requires a retry ({@link
 * Kind#RETRY_NOW}, {@link Kind#RETRY_AFTER}), or is terminal for the current attempt ({@link
 * Kind#DO_NOT_RETRY}, {@link Kind#DO_NOT_RETRY_WITH_ERROR}).
 */
public final class RetryDecision {
  private static final RetryDecision RETRY_NOW = new RetryDecision(Kind.RETRY_NOW, null, null);
  private static final RetryDecision DO_NOT_RETRY =
      new RetryDecision(Kind.DO_NOT_RETRY, null, null);

  private final Kind kind;
  private final @Nullable Duration delay;
  private final @Nullable Throwable error;

  private RetryDecision(Kind kind, @Nullable Duration delay, @Nullable Throwable error) {
    this.kind = kind;
    this.delay = delay;
    this.error = error;
  }

  public Kind kind() {
    return kind;
  }

  /** Returns whether another attempt is to be made. */
  public boolean isRetryRequired() {
    return kind == Kind.RETRY_NOW || kind == Kind.RETRY_AFTER;
  }

  /**
   * Returns the delay before the next attempt, which is {@code Duration.ZERO} for {@link
   * Kind#RETRY_NOW}, or an empty {@code Optional} if no retry is required.
   */
  public Optional<Duration> delay() {
    return kind == Kind.RETRY_NOW ? Optional.of(Duration.ZERO) : Optional.ofNullable(delay);
  }

  /** Returns the error that overrides the natural outcome, if any. */
  public Optional<Throwable> error() {
    return Optional.ofNullable(error);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof RetryDecision)) {
      return false;
    }
    var other = (RetryDecision) obj;
    return kind == other.kind
        && Objects.equals(delay, other.delay)
        && Objects.equals(error, other.error);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, delay, error);
  }

  @Override
  public String toString() {
    switch (kind) {
      case RETRY_AFTER:
        return "RetryDecision[RETRY_AFTER " + delay + "]";
      case DO_NOT_RETRY_WITH_ERROR:
        return "RetryDecision[DO_NOT_RETRY_WITH_ERROR " + error + "]";
      default:
        return "RetryDecision[" + kind + "]";
    }
  }

  public static RetryDecision retryNow() {
    return RETRY_NOW;
  }

  public static RetryDecision retryAfter(Duration delay) {
    return new RetryDecision(Kind.RETRY_AFTER, requireNonNegativeDelay(delay), null);
  }

  public static RetryDecision doNotRetry() {
    return DO_NOT_RETRY;
  }

  public static RetryDecision doNotRetryWithError(Throwable error) {
    return new RetryDecision(Kind.DO_NOT_RETRY_WITH_ERROR, null, requireNonNull(error));
  }

  public enum Kind {
    RETRY_NOW,
    RETRY_AFTER,
    DO_NOT_RETRY,
    DO_NOT_RETRY_WITH_ERROR
  }
}
