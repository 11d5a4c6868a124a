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

import static com.github.mizosoft.rebound.internal.Utils.requireValidHeaderName;
import static com.github.mizosoft.rebound.internal.Utils.requireValidHeaderValue;
import static java.util.Objects.requireNonNull;

import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * A step that may rewrite an {@link OutgoingRequest} before it's sent. Adaptation is asynchronous,
 * and the returned future may complete on any thread. A failed future fails the attempt, and the
 * failure is never retried.
 */
@FunctionalInterface
public interface Adapter {

  /**
   * Adapts the given request. The returned future completes with either a new request or the given
   * one.
   */
  CompletableFuture<OutgoingRequest> adapt(OutgoingRequest request);

  /**
   * Returns an {@code Adapter} that synchronously applies the given function. Exceptions thrown by
   * the function fail the returned future.
   */
  static Adapter of(UnaryOperator<OutgoingRequest> adapter) {
    requireNonNull(adapter);
    return request -> {
      try {
        return CompletableFuture.completedFuture(
            requireNonNull(adapter.apply(request), "adapted request"));
      } catch (RuntimeException e) {
        return CompletableFuture.failedFuture(e);
      }
    };
  }

  /** Returns an {@code Adapter} that sets the given header, replacing any previous values. */
  static Adapter header(String name, String value) {
    requireValidHeaderName(name);
    requireValidHeaderValue(value);
    return of(request -> request.toBuilder().header(name, value).build());
  }

  /** Returns an {@code Adapter} that returns requests as-is. */
  static Adapter identity() {
    return CompletableFuture::completedFuture;
  }
}
