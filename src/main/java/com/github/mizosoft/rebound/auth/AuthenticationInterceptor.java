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

package com.github.mizosoft.rebound.auth;

import static com.github.mizosoft.rebound.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rebound.Adapter;
import com.github.mizosoft.rebound.Interceptor;
import com.github.mizosoft.rebound.OutgoingRequest;
import com.github.mizosoft.rebound.RetryContext;
import com.github.mizosoft.rebound.RetryDecision;
import com.github.mizosoft.rebound.Retrier;
import com.github.mizosoft.rebound.internal.Utils;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An {@link Adapter} and {@link Retrier} that authenticates requests with a credential, and
 * refreshes the credential when it requires so or when a request fails due to an authentication
 * error. Requests are authenticated through an {@link Authenticator}.
 *
 * <p>Only one refresh runs at a time. Requests adapted while a refresh is running wait for it, and
 * so do failed requests asking for a retry. When the refresh succeeds, waiting requests are adapted
 * with the new credential and failed ones are retried right away. When it fails, all of them fail
 * with its error.
 *
 * <p>An optional {@link RefreshWindow} bounds how many refreshes may happen within an interval.
 * Exceeding it fails waiting requests with an {@link AuthenticationException} of reason {@link
 * AuthenticationException.Reason#EXCESSIVE_REFRESH}, which protects against refresh loops caused by
 * a server that keeps rejecting fresh credentials.
 *
 * @param <C> the type of the credential
 */
public final class AuthenticationInterceptor<C extends AuthenticationCredential>
    implements Adapter, Retrier {
  private static final Logger logger = System.getLogger(AuthenticationInterceptor.class.getName());

  private final Authenticator<C> authenticator;
  private final @Nullable RefreshWindow refreshWindow;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();

  @GuardedBy("lock")
  private @Nullable C credential;

  @GuardedBy("lock")
  private boolean refreshing;

  @GuardedBy("lock")
  private final Deque<Instant> refreshInstants = new ArrayDeque<>();

  @GuardedBy("lock")
  private List<DeferredAdaptation> deferredAdaptations = new ArrayList<>();

  @GuardedBy("lock")
  private List<CompletableFuture<RetryDecision>> deferredRetries = new ArrayList<>();

  private AuthenticationInterceptor(Builder<C> builder) {
    this.authenticator = builder.authenticator;
    this.refreshWindow = builder.refreshWindow;
    this.clock = builder.clock;
    this.credential = builder.credential;
  }

  public Optional<C> credential() {
    lock.lock();
    try {
      return Optional.ofNullable(credential);
    } finally {
      lock.unlock();
    }
  }

  /** Replaces the current credential, as when the user logs in again. */
  public void credential(@Nullable C credential) {
    lock.lock();
    try {
      this.credential = credential;
    } finally {
      lock.unlock();
    }
  }

  public Optional<RefreshWindow> refreshWindow() {
    return Optional.ofNullable(refreshWindow);
  }

  /** Returns an {@link Interceptor} named {@code authentication} that delegates to this. */
  public Interceptor toInterceptor() {
    return Interceptor.newBuilder().name("authentication").adapter(this).retrier(this).build();
  }

  @Override
  public CompletableFuture<OutgoingRequest> adapt(OutgoingRequest request) {
    requireNonNull(request);
    C currentCredential;
    CompletableFuture<OutgoingRequest> deferred = null;
    Runnable refreshStart = null;
    lock.lock();
    try {
      if (refreshing) {
        return defer(request);
      }
      currentCredential = credential;
      if (currentCredential == null) {
        return CompletableFuture.failedFuture(missingCredential());
      }
      if (currentCredential.requiresRefresh()) {
        deferred = defer(request);
        refreshStart = startRefresh(currentCredential);
      }
    } finally {
      lock.unlock();
    }

    if (refreshStart != null) {
      refreshStart.run();
      return deferred;
    }
    return applyCredential(currentCredential, request);
  }

  @Override
  public CompletableFuture<RetryDecision> retry(RetryContext context) {
    var response = context.lastResponse();
    if (response.isEmpty()
        || !authenticator.didFailDueToAuthenticationError(
            context.request(), response.get(), context.lastError())) {
      return CompletableFuture.completedFuture(RetryDecision.doNotRetry());
    }

    var decision = new CompletableFuture<RetryDecision>();
    Runnable refreshStart = null;
    lock.lock();
    try {
      var currentCredential = credential;
      if (currentCredential == null) {
        return CompletableFuture.completedFuture(
            RetryDecision.doNotRetryWithError(missingCredential()));
      }
      if (!authenticator.isAuthenticatedWith(context.request(), currentCredential)) {
        // The credential was refreshed after the request was sent.
        return CompletableFuture.completedFuture(RetryDecision.retryNow());
      }
      deferredRetries.add(decision);
      if (!refreshing) {
        refreshStart = startRefresh(currentCredential);
      }
    } finally {
      lock.unlock();
    }

    if (refreshStart != null) {
      refreshStart.run();
    }
    return decision;
  }

  private CompletableFuture<OutgoingRequest> applyCredential(
      C currentCredential, OutgoingRequest request) {
    try {
      return CompletableFuture.completedFuture(
          requireNonNull(authenticator.apply(currentCredential, request), "authenticated request"));
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  @GuardedBy("lock")
  private CompletableFuture<OutgoingRequest> defer(OutgoingRequest request) {
    var deferred = new DeferredAdaptation(request);
    deferredAdaptations.add(deferred);
    return deferred.future;
  }

  /**
   * Marks a refresh as running and returns the action that starts it, which is to run outside the
   * lock. An excessive refresh instead fails what's waiting on it.
   */
  @GuardedBy("lock")
  private Runnable startRefresh(C currentCredential) {
    var now = clock.instant();
    if (isRefreshExcessive(now)) {
      var adaptations = takeDeferredAdaptations();
      var retries = takeDeferredRetries();
      var error =
          new AuthenticationException(
              AuthenticationException.Reason.EXCESSIVE_REFRESH,
              "Credential was refreshed more than allowed by " + refreshWindow);
      return () -> failAll(adaptations, retries, error);
    }

    refreshInstants.addLast(now);
    refreshing = true;
    return () -> refresh(currentCredential);
  }

  @GuardedBy("lock")
  private boolean isRefreshExcessive(Instant now) {
    if (refreshWindow == null) {
      return false;
    }
    var windowStart = now.minus(refreshWindow.interval());
    while (!refreshInstants.isEmpty() && refreshInstants.peekFirst().isBefore(windowStart)) {
      refreshInstants.removeFirst();
    }
    return refreshInstants.size() >= refreshWindow.maxRefreshes();
  }

  private void refresh(C currentCredential) {
    CompletableFuture<C> refreshFuture;
    try {
      refreshFuture = requireNonNull(authenticator.refresh(currentCredential), "refresh future");
    } catch (RuntimeException e) {
      refreshFuture = CompletableFuture.failedFuture(e);
    }
    refreshFuture.whenComplete(
        (refreshedCredential, exception) -> {
          if (exception != null) {
            onRefreshFailure(Utils.getDeepCompletionCause(exception));
          } else {
            onRefreshSuccess(refreshedCredential);
          }
        });
  }

  private void onRefreshSuccess(C refreshedCredential) {
    List<DeferredAdaptation> adaptations;
    List<CompletableFuture<RetryDecision>> retries;
    lock.lock();
    try {
      credential = refreshedCredential;
      refreshing = false;
      adaptations = takeDeferredAdaptations();
      retries = takeDeferredRetries();
    } finally {
      lock.unlock();
    }

    for (var adaptation : adaptations) {
      adapt(adaptation.request)
          .whenComplete(
              (request, exception) -> {
                if (exception != null) {
                  adaptation.future.completeExceptionally(exception);
                } else {
                  adaptation.future.complete(request);
                }
              });
    }
    for (var retry : retries) {
      retry.complete(RetryDecision.retryNow());
    }
  }

  private void onRefreshFailure(Throwable error) {
    logger.log(Level.WARNING, "Couldn't refresh credential", error);
    List<DeferredAdaptation> adaptations;
    List<CompletableFuture<RetryDecision>> retries;
    lock.lock();
    try {
      refreshing = false;
      adaptations = takeDeferredAdaptations();
      retries = takeDeferredRetries();
    } finally {
      lock.unlock();
    }
    failAll(adaptations, retries, error);
  }

  private static void failAll(
      List<DeferredAdaptation> adaptations,
      List<CompletableFuture<RetryDecision>> retries,
      Throwable error) {
    for (var adaptation : adaptations) {
      adaptation.future.completeExceptionally(error);
    }
    for (var retry : retries) {
      retry.complete(RetryDecision.doNotRetryWithError(error));
    }
  }

  @GuardedBy("lock")
  private List<DeferredAdaptation> takeDeferredAdaptations() {
    var taken = deferredAdaptations;
    deferredAdaptations = new ArrayList<>();
    return taken;
  }

  @GuardedBy("lock")
  private List<CompletableFuture<RetryDecision>> takeDeferredRetries() {
    var taken = deferredRetries;
    deferredRetries = new ArrayList<>();
    return taken;
  }

  private static AuthenticationException missingCredential() {
    return new AuthenticationException(
        AuthenticationException.Reason.MISSING_CREDENTIAL, "No credential to authenticate with");
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[authenticator="
        + authenticator
        + ", refreshWindow="
        + refreshWindow
        + "]";
  }

  public static <C extends AuthenticationCredential> Builder<C> newBuilder(
      Authenticator<C> authenticator) {
    return new Builder<>(authenticator);
  }

  private static final class DeferredAdaptation {
    final OutgoingRequest request;
    final CompletableFuture<OutgoingRequest> future = new CompletableFuture<>();

    DeferredAdaptation(OutgoingRequest request) {
      this.request = request;
    }
  }

  /** Limits credential refreshes to {@code maxRefreshes} within any {@code interval}. */
  public static final class RefreshWindow {
    private static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
    private static final int DEFAULT_MAX_REFRESHES = 5;

    private final Duration interval;
    private final int maxRefreshes;

    private RefreshWindow(Duration interval, int maxRefreshes) {
      this.interval = interval;
      this.maxRefreshes = maxRefreshes;
    }

    public Duration interval() {
      return interval;
    }

    public int maxRefreshes() {
      return maxRefreshes;
    }

    @Override
    public String toString() {
      return "RefreshWindow[interval=" + interval + ", maxRefreshes=" + maxRefreshes + "]";
    }

    /** Returns a window allowing 5 refreshes every 30 seconds. */
    public static RefreshWindow defaultWindow() {
      return new RefreshWindow(DEFAULT_INTERVAL, DEFAULT_MAX_REFRESHES);
    }

    public static RefreshWindow of(Duration interval, int maxRefreshes) {
      requireNonNull(interval);
      requireArgument(
          !interval.isNegative() && !interval.isZero(), "non-positive interval: %s", interval);
      requireArgument(maxRefreshes > 0, "non-positive maxRefreshes: %d", maxRefreshes);
      return new RefreshWindow(interval, maxRefreshes);
    }
  }

  /** A builder of {@code AuthenticationInterceptor} instances. */
  public static final class Builder<C extends AuthenticationCredential> {
    private final Authenticator<C> authenticator;
    private @Nullable C credential;
    private @Nullable RefreshWindow refreshWindow;
    private Clock clock = Utils.systemMillisUtc();

    Builder(Authenticator<C> authenticator) {
      this.authenticator = requireNonNull(authenticator);
    }

    /** Sets the initial credential. Without one, requests fail till a credential is set. */
    @CanIgnoreReturnValue
    public Builder<C> credential(C credential) {
      this.credential = requireNonNull(credential);
      return this;
    }

    /** Sets the window limiting refreshes. By default, refreshes aren't limited. */
    @CanIgnoreReturnValue
    public Builder<C> refreshWindow(RefreshWindow refreshWindow) {
      this.refreshWindow = requireNonNull(refreshWindow);
      return this;
    }

    /** Sets the clock against which refreshes are timed for the refresh window. */
    @CanIgnoreReturnValue
    public Builder<C> clock(Clock clock) {
      this.clock = requireNonNull(clock);
      return this;
    }

    public AuthenticationInterceptor<C> build() {
      return new AuthenticationInterceptor<>(this);
    }
  }
}
