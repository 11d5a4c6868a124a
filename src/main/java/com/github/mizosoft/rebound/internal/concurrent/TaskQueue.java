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

package com.github.mizosoft.rebound.internal.concurrent;

import static java.util.Objects.requireNonNull;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;

/**
 * A queue that executes submitted tasks serially, and only while it isn't suspended. Tasks
 * submitted while suspended are held until {@link #resume()} is called. Suspending the queue while
 * it drains stops the drain before the next task.
 */
public final class TaskQueue implements Executor {
  /** Drain task started or about to start execution. Retained till drain exits. */
  private static final int RUNNING = 1;

  /** Drain task should keep running to recheck for incoming tasks it may have missed. */
  private static final int KEEP_ALIVE = 2;

  /** Tasks are held till the queue is resumed. */
  private static final int SUSPENDED = 4;

  private static final VarHandle SYNC;

  static {
    try {
      SYNC = MethodHandles.lookup().findVarHandle(TaskQueue.class, "sync", int.class);
    } catch (NoSuchFieldException | IllegalAccessException e) {
      throw new ExceptionInInitializerError(e);
    }
  }

  private final ConcurrentLinkedQueue<Runnable> taskQueue = new ConcurrentLinkedQueue<>();
  private final Executor delegate;

  @SuppressWarnings("unused") // VarHandle indirection.
  private volatile int sync;

  private TaskQueue(Executor delegate, boolean suspended) {
    this.delegate = requireNonNull(delegate);
    this.sync = suspended ? SUSPENDED : 0;
  }

  @Override
  public void execute(Runnable task) {
    taskQueue.add(requireNonNull(task));
    tryDrain();
  }

  /** Holds tasks until the next {@link #resume()}. */
  public void suspend() {
    SYNC.getAndBitwiseOr(this, SUSPENDED);
  }

  /** Marks this queue as not suspended, executing any held tasks. */
  public void resume() {
    SYNC.getAndBitwiseAnd(this, ~SUSPENDED);
    tryDrain();
  }

  public boolean isSuspended() {
    return (sync & SUSPENDED) != 0;
  }

  /** Returns the number of tasks waiting to be executed. */
  public int pendingTaskCount() {
    return taskQueue.size();
  }

  private void tryDrain() {
    while (true) {
      int s = sync;
      if ((s & (SUSPENDED | KEEP_ALIVE)) != 0) {
        return;
      }

      if ((s & RUNNING) == 0) {
        if (SYNC.compareAndSet(this, s, s | RUNNING)) {
          try {
            delegate.execute(this::drain);
          } catch (RuntimeException | Error e) {
            SYNC.getAndBitwiseAnd(this, ~(RUNNING | KEEP_ALIVE));
            throw e;
          }
          return;
        }
      } else if (SYNC.compareAndSet(this, s, s | KEEP_ALIVE)) {
        return;
      }
    }
  }

  private void drain() {
    while (true) {
      Runnable task;
      while (!isSuspended() && (task = taskQueue.poll()) != null) {
        try {
          task.run();
        } catch (Throwable t) {
          // Remaining tasks are executed on the next call to execute() or resume().
          SYNC.getAndBitwiseAnd(this, ~(RUNNING | KEEP_ALIVE));
          throw t;
        }
      }

      if (isSuspended()) {
        SYNC.getAndBitwiseAnd(this, ~(RUNNING | KEEP_ALIVE));

        // Recheck in case the queue was resumed before the running bit was cleared.
        if (!isSuspended() && !taskQueue.isEmpty()) {
          tryDrain();
        }
        return;
      }

      // Exit or consume KEEP_ALIVE bit.
      int s = sync;
      int unsetBit = (s & KEEP_ALIVE) != 0 ? KEEP_ALIVE : RUNNING;
      if (SYNC.weakCompareAndSet(this, s, s & ~unsetBit) && unsetBit == RUNNING) {
        return;
      }
    }
  }

  @Override
  public String toString() {
    int s = sync;
    return "TaskQueue@"
        + Integer.toHexString(hashCode())
        + "{delegate="
        + delegate
        + ", running="
        + ((s & RUNNING) != 0)
        + ", suspended="
        + ((s & SUSPENDED) != 0)
        + ", pending="
        + taskQueue.size()
        + "}";
  }

  /** Returns a suspended queue that executes its tasks on the thread that submits or resumes. */
  public static TaskQueue createSuspended() {
    return new TaskQueue(Runnable::run, true);
  }

  public static TaskQueue createSuspended(Executor delegate) {
    return new TaskQueue(delegate, true);
  }

  public static TaskQueue create(Executor delegate) {
    return new TaskQueue(delegate, false);
  }
}
