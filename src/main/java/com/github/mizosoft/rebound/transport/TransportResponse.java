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
import com.github.mizosoft.rebound.ResponseInfo;

/** What a {@link Transport} produces for one attempt that received a response. */
public final class TransportResponse {
  private final ResponseInfo info;
  private final byte[] body;

  private TransportResponse(ResponseInfo info, byte[] body) {
    this.info = requireNonNull(info);
    this.body = requireNonNull(body);
  }

  public ResponseInfo info() {
    return info;
  }

  public int statusCode() {
    return info.statusCode();
  }

  /** Returns the response body. The returned array is not copied. */
  public byte[] body() {
    return body;
  }

  @Override
  public String toString() {
    return "TransportResponse[" + info + ", " + body.length + " bytes]";
  }

  public static TransportResponse of(ResponseInfo info, byte[] body) {
    return new TransportResponse(info, body);
  }

  public static TransportResponse of(int statusCode, Headers headers, byte[] body) {
    return new TransportResponse(ResponseInfo.of(statusCode, headers), body);
  }

  public static TransportResponse of(int statusCode) {
    return new TransportResponse(ResponseInfo.of(statusCode), new byte[0]);
  }
}
