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

package com.github.mizosoft.rebound.transport;

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rebound.Headers;
import com.github.mizosoft.rebound.OutgoingRequest;
import com.github.mizosoft.rebound.TransportException;
import com.github.mizosoft.rebound.internal.Utils;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link Transport} that sends requests with a {@link HttpClient}. Tasks are sent with {@link
 * HttpClient#sendAsync} on their first resume, and are cancelled by cancelling the returned future.
 * Suspension isn't supported, so {@link TransportTask#suspend()} is ignored.
 */
public final class HttpClientTransport implements Transport {
  private static final Logger logger = System.getLogger(HttpClientTransport.class.getName());

  private final HttpClient client;
  private final AtomicLong nextTaskId = new AtomicLong();

  private HttpClientTransport(HttpClient client) {
    this.client = requireNonNull(client);
  }

  public HttpClient client() {
    return client;
  }

  @Override
  public TransportTask dispatch(OutgoingRequest request, Callback callback) {
    return new HttpClientTask(
        nextTaskId.incrementAndGet(), requireNonNull(request), requireNonNull(callback));
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this) + "[client=" + client + "]";
  }

  /** Returns a {@code HttpClientTransport} that uses a new default {@code HttpClient}. */
  public static HttpClientTransport create() {
    return new HttpClientTransport(HttpClient.newHttpClient());
  }

  public static HttpClientTransport create(HttpClient client) {
    return new HttpClientTransport(client);
  }

  static HttpRequest toHttpRequest(OutgoingRequest request) {
    var builder =
        HttpRequest.newBuilder(request.uri())
            .method(
                request.method(),
                request
                    .body()
                    .map(BodyPublishers::ofByteArray)
                    .orElseGet(BodyPublishers::noBody));
    request.headers().map().forEach((name, values) -> values.forEach(v -> builder.header(name, v)));
    return builder.build();
  }

  static TransportResponse toTransportResponse(HttpResponse<byte[]> response) {
    var headers = Headers.newBuilder();
    response
        .headers()
        .map()
        .forEach(
            (name, values) -> {
              if (!name.startsWith(":")) { // Skip HTTP/2 pseudo-headers.
                values.forEach(value -> headers.add(name, value));
              }
            });
    return TransportResponse.of(response.statusCode(), headers.build(), response.body());
  }

  private final class HttpClientTask implements TransportTask {
    private final long id;
    private final OutgoingRequest request;
    private final Callback callback;
    private final AtomicBoolean completed = new AtomicBoolean();
    private final ReentrantLock lock = new ReentrantLock();

    @GuardedBy("lock")
    private @Nullable CompletableFuture<HttpResponse<byte[]>> sendFuture;

    @GuardedBy("lock")
    private boolean cancelled;

    HttpClientTask(long id, OutgoingRequest request, Callback callback) {
      this.id = id;
      this.request = request;
      this.callback = callback;
    }

    @Override
    public long id() {
      return id;
    }

    @Override
    public void resume() {
      CompletableFuture<HttpResponse<byte[]>> future;
      lock.lock();
      try {
        if (cancelled || sendFuture != null) {
          return;
        }
        future = send();
        sendFuture = future;
      } finally {
        lock.unlock();
      }
      future.whenComplete(this::complete);
    }

    private CompletableFuture<HttpResponse<byte[]>> send() {
      HttpRequest httpRequest;
      try {
        httpRequest = toHttpRequest(request);
      } catch (IllegalArgumentException e) {
        return CompletableFuture.failedFuture(
            new TransportException(
                TransportException.Reason.UNSUPPORTED_URL, "Unsupported request: " + request, e));
      }
      return client.sendAsync(httpRequest, BodyHandlers.ofByteArray());
    }

    @Override
    public void suspend() {
      logger.log(
          Level.DEBUG, () -> "Ignoring suspension of task " + id + " as it's not supported");
    }

    @Override
    public void cancel() {
      CompletableFuture<HttpResponse<byte[]>> future;
      lock.lock();
      try {
        if (cancelled) {
          return;
        }
        cancelled = true;
        future = sendFuture;
      } finally {
        lock.unlock();
      }

      if (future != null) {
        future.cancel(true);
      } else {
        complete(null, new CancellationException("Task " + id + " was cancelled"));
      }
    }

    private void complete(@Nullable HttpResponse<byte[]> response, @Nullable Throwable exception) {
      if (!completed.compareAndSet(false, true)) {
        return;
      }

      if (exception != null) {
        callback.onFailure(Utils.getDeepCompletionCause(exception));
        return;
      }

      TransportResponse transportResponse;
      try {
        transportResponse = toTransportResponse(requireNonNull(response));
      } catch (IllegalArgumentException e) {
        callback.onFailure(
            new TransportException(
                TransportException.Reason.CANNOT_PARSE_RESPONSE, "Malformed response headers", e));
        return;
      }
      callback.onResponse(transportResponse);
    }

    @Override
    public String toString() {
      return Utils.toStringIdentityPrefix(this) + "[id=" + id + ", request=" + request + "]";
    }
  }
}
