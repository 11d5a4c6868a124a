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
import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.net.URI;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable HTTP request that is yet to be sent. {@link Adapter Adapters} produce new instances
 * through {@link #toBuilder()} rather than mutating a request in place.
 */
public final class OutgoingRequest {
  private final String method;
  private final URI uri;
  private final Headers headers;
  private final byte @Nullable [] body;

  private OutgoingRequest(Builder builder) {
    this.method = builder.method;
    this.uri = requireNonNull(builder.uri, "uri");
    this.headers = builder.headers.build();
    this.body = builder.body;
  }

  /** Returns the request method, which is always upper-case. */
  public String method() {
    return method;
  }

  public URI uri() {
    return uri;
  }

  public Headers headers() {
    return headers;
  }

  /** Returns a copy of the request body, if any. */
  public Optional<byte[]> body() {
    return body != null ? Optional.of(body.clone()) : Optional.empty();
  }

  public boolean hasBody() {
    return body != null;
  }

  /** Returns a builder that initially contains this request's state. */
  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof OutgoingRequest)) {
      return false;
    }
    var other = (OutgoingRequest) obj;
    return method.equals(other.method)
        && uri.equals(other.uri)
        && headers.equals(other.headers)
        && Arrays.equals(body, other.body);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(method, uri, headers) + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return uri + " " + method;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static OutgoingRequest GET(String uri) {
    return newBuilder().uri(uri).GET().build();
  }

  public static OutgoingRequest GET(URI uri) {
    return newBuilder().uri(uri).GET().build();
  }

  public static OutgoingRequest POST(String uri, byte[] body) {
    return newBuilder().uri(uri).method("POST", body).build();
  }

  public static OutgoingRequest POST(URI uri, byte[] body) {
    return newBuilder().uri(uri).method("POST", body).build();
  }

  /** A builder of {@code OutgoingRequest} instances. */
  public static final class Builder {
    private String method = "GET";
    private @MonotonicNonNull URI uri;
    private Headers.Builder headers = Headers.newBuilder();
    private byte @Nullable [] body;

    Builder() {}

    Builder(OutgoingRequest request) {
      this.method = request.method;
      this.uri = request.uri;
      this.headers = request.headers.toBuilder();
      this.body = request.body;
    }

    @CanIgnoreReturnValue
    public Builder uri(String uri) {
      return uri(URI.create(uri));
    }

    @CanIgnoreReturnValue
    public Builder uri(URI uri) {
      requireNonNull(uri);
      requireArgument(uri.getScheme() != null, "URI has no scheme: %s", uri);
      this.uri = uri;
      return this;
    }

    /** Sets the given header to the given value, replacing any previous values. */
    @CanIgnoreReturnValue
    public Builder header(String name, String value) {
      headers.set(name, value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addHeader(String name, String value) {
      headers.add(name, value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder headers(Headers headers) {
      this.headers = requireNonNull(headers).toBuilder();
      return this;
    }

    @CanIgnoreReturnValue
    public Builder removeHeader(String name) {
      headers.remove(name);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder GET() {
      return method("GET");
    }

    @CanIgnoreReturnValue
    public Builder HEAD() {
      return method("HEAD");
    }

    @CanIgnoreReturnValue
    public Builder DELETE() {
      return method("DELETE");
    }

    /** Sets the request method and removes any body. */
    @CanIgnoreReturnValue
    public Builder method(String method) {
      this.method = requireValidToken(method).toUpperCase(Locale.ROOT);
      this.body = null;
      return this;
    }

    /** Sets the request method along with the body to send. */
    @CanIgnoreReturnValue
    public Builder method(String method, byte[] body) {
      method(method);
      this.body = body.clone();
      return this;
    }

    public OutgoingRequest build() {
      return new OutgoingRequest(this);
    }
  }
}
