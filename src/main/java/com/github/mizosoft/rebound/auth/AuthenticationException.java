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

import static java.util.Objects.requireNonNull;

import java.io.IOException;

/** Signals that an {@link AuthenticationInterceptor} couldn't authenticate a request. */
public class AuthenticationException extends IOException {
  private static final long serialVersionUID = 6412350749282417712L;

  private final Reason reason;

  public AuthenticationException(Reason reason, String message) {
    super(message);
    this.reason = requireNonNull(reason);
  }

  public Reason reason() {
    return reason;
  }

  /** Why authentication failed. */
  public enum Reason {
    /** There's no credential to authenticate with. */
    MISSING_CREDENTIAL,

    /** The credential was refreshed more often than its refresh window allows. */
    EXCESSIVE_REFRESH
  }
}
