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

package com.github.mizosoft.rebound.task;

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rebound.transport.TransportTask;
import java.nio.ByteBuffer;
import java.util.function.Consumer;

/**
 * How a {@link BasicTaskStateController} cancels its task. The strategy runs before the {@code
 * task.didCancel} event is emitted.
 */
@FunctionalInterface
public interface CancelStrategy {

  void cancel(TransportTask task);

  /** Returns a strategy that simply cancels the task. */
  static CancelStrategy plain() {
    return TransportTask::cancel;
  }

  /**
   * Returns a strategy for downloads that cancels the task while capturing data for resuming the
   * transfer later. Captured data, if any, is passed to the given callback.
   */
  static CancelStrategy capturingResumeData(Consumer<ByteBuffer> resumeDataCallback) {
    requireNonNull(resumeDataCallback);
    return task -> task.cancelProducingResumeData().ifPresent(resumeDataCallback);
  }
}
