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
import java.nio.charset.Charset;

/** The successful outcome of a {@link Call}. */
public final class Response {
  private final OutgoingRequest request;
  private final ResponseInfo info;
  private final byte[] body;
  private final int retryCount;

  Response(OutgoingRequest request, ResponseInfo info, byte[] body, int retryCount) {
    this.request = requireNonNull(request);
    this.info = requireNonNull(info);
    this.body = requireNonNull(body);
    this.retryCount = retryCount;
  }

  /** Returns the request that produced this response, as sent after adaptation. */
  public OutgoingRequest request() {
    return request;
  }

  public int statusCode() {
    return info.statusCode();
  }

  public Headers headers() {
    return info.headers();
  }

  public ResponseInfo info() {
    return info;
  }

  /** Returns a copy of the response body. */
  public byte[] body() {
    return body.clone();
  }

  public String bodyAsString(Charset charset) {
    return new String(body, charset);
  }

  /** Returns how many times the request was retried before this response was received. */
  public int retryCount() {
    return retryCount;
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[request="
        + request
        + ", statusCode="
        + info.statusCode()
        + ", retryCount="
        + retryCount
        + ']';
  }
}
