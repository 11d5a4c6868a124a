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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;
import java.time.Duration;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Argument checks shared by builders and factories. */
public final class Validate {
  private Validate() {}

  public static void requireArgument(boolean valid, String message) {
    if (!valid) {
      throw new IllegalArgumentException(message);
    }
  }

  @FormatMethod
  public static void requireArgument(
      boolean valid, @FormatString String messageFormat, @Nullable Object... args) {
    if (!valid) {
      throw new IllegalArgumentException(String.format(messageFormat, args));
    }
  }

  @CanIgnoreReturnValue
  public static int requireNonNegative(int value, String name) {
    requireArgument(value >= 0, "%s must be non-negative: %d", name, value);
    return value;
  }

  /** Checks that a retry or scheduling delay isn't negative. A zero delay is allowed. */
  @CanIgnoreReturnValue
  public static Duration requireNonNegativeDelay(Duration delay) {
    requireArgument(!delay.isNegative(), "negative delay: %s", delay);
    return delay;
  }
}
