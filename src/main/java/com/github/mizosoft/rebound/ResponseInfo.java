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

import java.util.Objects;

/** The status line and headers of a received response. */
public final class ResponseInfo {
  private final int statusCode;
  private final Headers headers;

  private ResponseInfo(int statusCode, Headers headers) {
    requireArgument(statusCode >= 100 && statusCode <= 999, "Invalid status code: %d", statusCode);
    this.statusCode = statusCode;
    this.headers = requireNonNull(headers);
  }

  public int statusCode() {
    return statusCode;
  }

  public Headers headers() {
    return headers;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof ResponseInfo)) {
      return false;
    }
    var other = (ResponseInfo) obj;
    return statusCode == other.statusCode && headers.equals(other.headers);
  }

  @Override
  public int hashCode() {
    return Objects.hash(statusCode, headers);
  }

  @Override
  public String toString() {
    return "ResponseInfo[statusCode=" + statusCode + ", headers=" + headers + "]";
  }

  public static ResponseInfo of(int statusCode) {
    return new ResponseInfo(statusCode, Headers.empty());
  }

  public static ResponseInfo of(int statusCode, Headers headers) {
    return new ResponseInfo(statusCode, headers);
  }
}
