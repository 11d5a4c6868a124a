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

package com.github.mizosoft.rebound.testing;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Controls the JUL loggers backing {@code System.Logger} during tests. Loggers are held strongly
 * so their levels survive garbage collection.
 */
public final class Logging {
  private static final Set<Logger> retainedLoggers = new CopyOnWriteArraySet<>();

  private Logging() {}

  public static void disable(Class<?>... classes) {
    for (var cls : classes) {
      disable(cls.getName());
    }
  }

  public static void disable(String... loggerNames) {
    for (var name : loggerNames) {
      var logger = Logger.getLogger(name);
      logger.setLevel(Level.OFF);
      retainedLoggers.add(logger);
    }
  }

  /** Records everything the given class logs until the returned capture is closed. */
  public static LogCapture capture(Class<?> cls) {
    return new LogCapture(Logger.getLogger(cls.getName()));
  }

  public static final class LogCapture extends Handler implements AutoCloseable {
    private final Logger logger;
    private final Level previousLevel;
    private final List<LogRecord> records = new CopyOnWriteArrayList<>();

    LogCapture(Logger logger) {
      this.logger = logger;
      this.previousLevel = logger.getLevel();
      retainedLoggers.add(logger);
      logger.setLevel(Level.ALL);
      logger.addHandler(this);
    }

    public List<LogRecord> records() {
      return new ArrayList<>(records);
    }

    @Override
    public void publish(LogRecord record) {
      records.add(record);
    }

    @Override
    public void flush() {}

    @Override
    public void close() {
      logger.removeHandler(this);
      logger.setLevel(previousLevel);
    }
  }
}
