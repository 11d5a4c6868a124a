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

import java.io.IOException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Signals that an {@link Adapter} couldn't adapt a request. The request is never sent, and the
 * failure is never retried.
 */
public class AdaptationException extends IOException {
  private static final long serialVersionUID = 3473519447268312530L;

  public AdaptationException(String message) {
    super(message);
  }

  public AdaptationException(String message, @Nullable Throwable cause) {
    super(message, cause);
  }

  public AdaptationException(Throwable cause) {
    super(cause);
  }
}
