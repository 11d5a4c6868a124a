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

import static com.github.mizosoft.rebound.testing.TestUtils.TIMEOUT_SECONDS;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ExtensionContext.Namespace;
import org.junit.jupiter.api.extension.ExtensionContext.Store.CloseableResource;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolver;

/**
 * {@code Extension} that provides {@code Executor}, {@code ExecutorService} and {@code
 * ScheduledExecutorService} parameters, and terminates them after tests.
 */
public final class ExecutorExtension implements ParameterResolver {
  private static final Namespace EXTENSION_NAMESPACE = Namespace.create(ExecutorExtension.class);

  public ExecutorExtension() {}

  @Override
  public boolean supportsParameter(
      ParameterContext parameterContext, ExtensionContext extensionContext) {
    var type = parameterContext.getParameter().getType();
    return type == Executor.class
        || type == ExecutorService.class
        || type == ScheduledExecutorService.class;
  }

  @Override
  public Object resolveParameter(
      ParameterContext parameterContext, ExtensionContext extensionContext) {
    var executors =
        extensionContext
            .getStore(EXTENSION_NAMESPACE)
            .getOrComputeIfAbsent(ManagedExecutors.class);
    return parameterContext.getParameter().getType() == ScheduledExecutorService.class
        ? executors.add(Executors.newScheduledThreadPool(1, ManagedExecutors.threadFactory))
        : executors.add(Executors.newCachedThreadPool(ManagedExecutors.threadFactory));
  }

  private static final class ManagedExecutors implements CloseableResource {
    private static final Logger logger = System.getLogger(ManagedExecutors.class.getName());

    static final ThreadFactory threadFactory =
        r ->
            new Thread(
                () -> {
                  try {
                    r.run();
                  } catch (Throwable t) {
                    logger.log(Level.ERROR, "Uncaught exception during asynchronous execution", t);
                    throw t;
                  }
                });

    private final List<ExecutorService> executors = new ArrayList<>();

    ManagedExecutors() {}

    synchronized <E extends ExecutorService> E add(E executor) {
      executors.add(executor);
      return executor;
    }

    @Override
    public synchronized void close() throws Exception {
      for (var executor : executors) {
        executor.shutdownNow();
        if (!executor.awaitTermination(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
          throw new TimeoutException("Timed out while waiting for pool termination: " + executor);
        }
      }
      executors.clear();
    }
  }
}
