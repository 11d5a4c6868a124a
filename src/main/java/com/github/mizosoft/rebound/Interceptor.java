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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.CompletableFuture;

/**
 * A named, ordered pair of {@link Adapter adapters} and {@link Retrier retriers}. An {@code
 * Interceptor} is itself both an adapter and a retrier, composing its parts as follows:
 *
 * <ul>
 *   <li>Adapters are evaluated strictly in order, each receiving the output of the previous one.
 *       The first failure stops the chain and is surfaced as-is. Remaining adapters are not
 *       evaluated.
 *   <li>Retriers are evaluated strictly in order. The first decision that's not {@link
 *       RetryDecision#doNotRetry()} wins. Remaining retriers are not consulted. {@code
 *       doNotRetry()} is returned if all retriers abstain, or if there are none. A retrier that
 *       fails yields a {@link RetryDecision#doNotRetryWithError(Throwable)} carrying its failure.
 * </ul>
 *
 * <p>Evaluation is asynchronous. Each step is started only after the previous one completes, which
 * may happen on a different thread. An {@code Interceptor} holds no per-evaluation state, so it
 * can be shared among concurrent requests.
 */
public final class Interceptor implements Adapter, Retrier {
  private static final String DEFAULT_NAME = "interceptor";

  private final String name;
  private final List<Adapter> adapters;
  private final List<Retrier> retriers;

  private Interceptor(String name, List<Adapter> adapters, List<Retrier> retriers) {
    this.name = name;
    this.adapters = List.copyOf(adapters);
    this.retriers = List.copyOf(retriers);
  }

  public String name() {
    return name;
  }

  public List<Adapter> adapters() {
    return adapters;
  }

  public List<Retrier> retriers() {
    return retriers;
  }

  @Override
  public CompletableFuture<OutgoingRequest> adapt(OutgoingRequest request) {
    requireNonNull(request);
    var result = new CompletableFuture<OutgoingRequest>();
    adaptFrom(0, request, result);
    return result;
  }

  private void adaptFrom(
      int index, OutgoingRequest request, CompletableFuture<OutgoingRequest> result) {
    if (index >= adapters.size()) {
      result.complete(request);
      return;
    }

    var adapter = adapters.get(index);
    CompletableFuture<OutgoingRequest> adaptedFuture;
    try {
      adaptedFuture = requireNonNull(adapter.adapt(request), "adapter returned a null future");
    } catch (RuntimeException e) {
      result.completeExceptionally(e);
      return;
    }
    adaptedFuture.whenComplete(
        (adaptedRequest, exception) -> {
          if (exception != null) {
            result.completeExceptionally(Utils.getDeepCompletionCause(exception));
          } else if (adaptedRequest == null) {
            result.completeExceptionally(
                new NullPointerException("adapter completed with a null request: " + adapter));
          } else {
            adaptFrom(index + 1, adaptedRequest, result);
          }
        });
  }

  @Override
  public CompletableFuture<RetryDecision> retry(RetryContext context) {
    requireNonNull(context);
    var result = new CompletableFuture<RetryDecision>();
    retryFrom(0, context, result);
    return result;
  }

  private void retryFrom(int index, RetryContext context, CompletableFuture<RetryDecision> result) {
    if (index >= retriers.size()) {
      result.complete(RetryDecision.doNotRetry());
      return;
    }

    var retrier = retriers.get(index);
    CompletableFuture<RetryDecision> decisionFuture;
    try {
      decisionFuture = requireNonNull(retrier.retry(context), "retrier returned a null future");
    } catch (RuntimeException e) {
      result.complete(RetryDecision.doNotRetryWithError(e));
      return;
    }
    decisionFuture.whenComplete(
        (decision, exception) -> {
          if (exception != null) {
            result.complete(
                RetryDecision.doNotRetryWithError(Utils.getDeepCompletionCause(exception)));
          } else if (decision == null) {
            result.complete(
                RetryDecision.doNotRetryWithError(
                    new NullPointerException("null decision from retrier: " + retrier)));
          } else if (decision.kind() == RetryDecision.Kind.DO_NOT_RETRY) {
            retryFrom(index + 1, context, result); // Abstain.
          } else {
            result.complete(decision);
          }
        });
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[name="
        + name
        + ", adapters="
        + adapters.size()
        + ", retriers="
        + retriers.size()
        + ']';
  }

  /** Returns an {@code Interceptor} with no adapters or retriers. */
  public static Interceptor empty() {
    return newBuilder().build();
  }

  /**
   * Returns an {@code Interceptor} that composes the given ones. Adapters and retriers of each
   * interceptor are evaluated in argument order.
   */
  public static Interceptor of(Interceptor... interceptors) {
    var builder = newBuilder();
    var name = new StringJoiner(", ", "[", "]");
    for (var interceptor : interceptors) {
      builder.adapters(interceptor.adapters).retriers(interceptor.retriers);
      name.add(interceptor.name);
    }
    return builder.name(name.toString()).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@code Interceptor} instances. */
  public static final class Builder {
    private String name = DEFAULT_NAME;
    private final List<Adapter> adapters = new ArrayList<>();
    private final List<Retrier> retriers = new ArrayList<>();

    Builder() {}

    @CanIgnoreReturnValue
    public Builder name(String name) {
      requireArgument(!name.isBlank(), "blank name");
      this.name = name;
      return this;
    }

    /** Adds the given adapter after the ones added so far. */
    @CanIgnoreReturnValue
    public Builder adapter(Adapter adapter) {
      adapters.add(requireNonNull(adapter));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder adapters(List<? extends Adapter> adapters) {
      adapters.forEach(this::adapter);
      return this;
    }

    /** Adds the given retrier after the ones added so far. */
    @CanIgnoreReturnValue
    public Builder retrier(Retrier retrier) {
      retriers.add(requireNonNull(retrier));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder retriers(List<? extends Retrier> retriers) {
      retriers.forEach(this::retrier);
      return this;
    }

    public Interceptor build() {
      return new Interceptor(name, adapters, retriers);
    }
  }
}
