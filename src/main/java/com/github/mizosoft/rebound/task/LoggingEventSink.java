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

/** An {@link EventSink} that logs each event at a given level. */
public final class LoggingEventSink implements EventSink {
  private static final Logger logger = System.getLogger(LoggingEventSink.class.getName());

  private final Level level;

  private LoggingEventSink(Level level) {
    this.level = requireNonNull(level);
  }

  public Level level() {
    return level;
  }

  @Override
  public void onEvent(TaskEvent event) {
    requireNonNull(event);
    logger.log(level, () -> event.type().eventName() + " (task " + event.taskId() + ")");
  }

  /** Returns a {@code LoggingEventSink} that logs at {@link Level#DEBUG}. */
  public static LoggingEventSink create() {
    return new LoggingEventSink(Level.DEBUG);
  }

  public static LoggingEventSink create(Level level) {
    return new LoggingEventSink(level);
  }
}
