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

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.List;

/**
 * Receives {@link TaskEvent TaskEvents}. Sinks are given to controllers on construction, and are
 * called outside any lock the controller holds. Exceptions thrown by a sink are logged and
 * otherwise ignored.
 */
@FunctionalInterface
public interface EventSink {

  void onEvent(TaskEvent event);

  /** Returns an {@code EventSink} that ignores all events. */
  static EventSink none() {
    return NoopEventSink.INSTANCE;
  }

  /** Returns an {@code EventSink} that forwards each event to the given sinks in order. */
  static EventSink composite(EventSink... sinks) {
    return composite(List.of(sinks));
  }

  static EventSink composite(List<EventSink> sinks) {
    var sinksCopy = List.copyOf(sinks);
    return event -> {
      requireNonNull(event);
      for (var sink : sinksCopy) {
        EventSinks.notifySafely(sink, event);
      }
    };
  }
}

enum NoopEventSink implements EventSink {
  INSTANCE;

  @Override
  public void onEvent(TaskEvent event) {}
}

final class EventSinks {
  private static final Logger logger = System.getLogger(EventSinks.class.getName());

  private EventSinks() {}

  static void notifySafely(EventSink sink, TaskEvent event) {
    try {
      sink.onEvent(event);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by EventSink: " + sink, t);
    }
  }
}
