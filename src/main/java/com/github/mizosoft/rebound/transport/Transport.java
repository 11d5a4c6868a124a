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

import com.github.mizosoft.rebound.OutgoingRequest;

/**
 * Performs the network I/O of single attempts. A {@code Transport} is only asked to send a request
 * once. Retries dispatch a new task.
 */
@FunctionalInterface
public interface Transport {

  /**
   * Creates a task that sends the given request when {@link TransportTask#resume() resumed}. The
   * given callback is invoked at most once, with either the response or the failure of the task.
   */
  TransportTask dispatch(OutgoingRequest request, Callback callback);

  /** Receives the outcome of a {@link TransportTask}. */
  interface Callback {

    void onResponse(TransportResponse response);

    /**
     * Called when the task fails. A cancelled task may report its cancellation through this
     * method.
     */
    void onFailure(Throwable failure);
  }
}
