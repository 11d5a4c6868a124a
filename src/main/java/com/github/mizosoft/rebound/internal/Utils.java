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

package com.github.mizosoft.rebound.internal;

import static com.github.mizosoft.rebound.internal.Validate.requireArgument;

import com.github.mizosoft.rebound.internal.text.HttpCharMatchers;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Miscellaneous utilities. */
public class Utils {
  private static final Clock SYSTEM_MILLIS_UTC = Clock.tickMillis(ZoneOffset.UTC);

  private static final double NANOS_PER_SECOND = 1e9;

  private Utils() {}

  public static boolean isValidToken(CharSequence token) {
    return HttpCharMatchers.isToken(token);
  }

  public static <S extends CharSequence> S requireValidToken(S token) {
    requireArgument(isValidToken(token), "illegal token: '%s'", token);
    return token;
  }

  public static String requireValidHeaderName(String name) {
    requireArgument(isValidToken(name), "illegal header name: '%s'", name);
    return name;
  }

  public static String requireValidHeaderValue(String value) {
    requireArgument(HttpCharMatchers.isFieldValue(value), "illegal header value: '%s'", value);
    return value;
  }

  /** Converts fractional seconds to a {@code Duration}, saturating at {@code Long.MAX_VALUE} ns. */
  public static Duration ofFractionalSeconds(double seconds) {
    requireArgument(
        !Double.isNaN(seconds) && seconds >= 0, "Expected non-negative seconds: %f", seconds);
    return Duration.ofNanos(Math.round(seconds * NANOS_PER_SECOND));
  }

  public static Clock systemMillisUtc() {
    return SYSTEM_MILLIS_UTC;
  }

  public static Throwable getDeepCompletionCause(Throwable t) {
    var cause = t;
    while (cause instanceof CompletionException || cause instanceof ExecutionException) {
      var deeperCause = cause.getCause();
      if (deeperCause == null) {
        break;
      }
      cause = deeperCause;
    }
    return cause;
  }

  public static String toStringIdentityPrefix(Object object) {
    return object.getClass().getSimpleName() + "@" + Integer.toHexString(object.hashCode());
  }

  public static String forwardingObjectToString(Object object, Object delegate) {
    return toStringIdentityPrefix(object) + "[delegate=" + delegate + "]";
  }
}
