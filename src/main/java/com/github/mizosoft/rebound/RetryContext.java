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

import static com.github.mizosoft.rebound.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rebound.internal.Utils;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/** The state a {@link Retrier} decides upon after an attempt fails. */
public interface RetryContext {

  /** Returns the request of the failed attempt, as sent after adaptation. */
  OutgoingRequest request();

  /**
   * Returns the number of times the request has been retried before the failed attempt. This is
   * {@code 0} when the first attempt fails.
   */
  int retryCount();

  /**
   * Returns the failure of the last attempt. If a response was received but had an unacceptable
   * status, this is a {@link ResponseStatusException}.
   */
  Throwable lastError();

  /** Returns the status line and headers of the last response, if one was received. */
  Optional<ResponseInfo> lastResponse();

  /**
   * Creates a new {@code RetryContext} from the given state.
   *
   * @throws IllegalArgumentException if {@code retryCount} is negative
   */
  static RetryContext of(
      OutgoingRequest request,
      int retryCount,
      Throwable lastError,
      @Nullable ResponseInfo lastResponse) {
    return new RetryContextImpl(request, retryCount, lastError, lastResponse);
  }

  /** Creates a new {@code RetryContext} for a failure where no response was received. */
  static RetryContext of(OutgoingRequest request, int retryCount, Throwable lastError) {
    return of(request, retryCount, lastError, null);
  }
}

final class RetryContextImpl implements RetryContext {
  private final OutgoingRequest request;
  private final int retryCount;
  private final Throwable lastError;
  private final @Nullable ResponseInfo lastResponse;

  RetryContextImpl(
      OutgoingRequest request,
      int retryCount,
      Throwable lastError,
      @Nullable ResponseInfo lastResponse) {
    requireArgument(retryCount >= 0, "Expected retryCount to be non-negative");
    this.request = requireNonNull(request);
    this.retryCount = retryCount;
    this.lastError = requireNonNull(lastError);
    this.lastResponse = lastResponse;
  }

  @Override
  public OutgoingRequest request() {
    return request;
  }

  @Override
  public int retryCount() {
    return retryCount;
  }

  @Override
  public Throwable lastError() {
    return lastError;
  }

  @Override
  public Optional<ResponseInfo> lastResponse() {
    return Optional.ofNullable(lastResponse);
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[request="
        + request
        + ", retryCount="
        + retryCount
        + ", lastError="
        + lastError
        + ", lastResponse="
        + lastResponse
        + ']';
  }
}
