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

import java.nio.ByteBuffer;
import java.util.Optional;

/** A live task of one attempt, as created by a {@link Transport}. Tasks are created suspended. */
public interface TransportTask {

  /** Returns an identifier of the underlying task, used to correlate lifecycle events. */
  long id();

  /** Starts the task, or continues it if it was suspended. */
  void resume();

  /** Pauses the task. Transports that can't pause a task may ignore this. */
  void suspend();

  /**
   * Asks the task to cancel. Cancellation is cooperative, so the task may still complete
   * afterwards.
   */
  void cancel();

  /**
   * Cancels the task, returning data that can be used to resume the transfer later, if the
   * transport supports that. The default implementation cancels and returns an empty {@code
   * Optional}.
   */
  default Optional<ByteBuffer> cancelProducingResumeData() {
    cancel();
    return Optional.empty();
  }
}
