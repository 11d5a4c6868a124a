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

import com.github.mizosoft.rebound.internal.Utils;
import com.github.mizosoft.rebound.internal.concurrent.TaskQueue;
import com.github.mizosoft.rebound.transport.TransportTask;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The per-request {@link TaskStateController}. Each attempt's task is {@link
 * #attach(TransportTask) attached} to the controller, which then owns it till the next attempt.
 *
 * <p>The start of an attached task is submitted to the controller's {@link TaskQueue}, so it's
 * deferred till the queue is resumed. Resuming the controller before any task is attached resumes
 * the queue, so that the first task starts as soon as it's attached.
 *
 * <p>Events are emitted to the controller's {@link EventSink} after the state is updated, outside
 * the controller's lock. {@code task.didCancel} is emitted at most once.
 */
public final class BasicTaskStateController implements TaskStateController {
  private final ReentrantLock lock = new ReentrantLock();
  private final EventSink eventSink;
  private final CancelStrategy cancelStrategy;
  private final Clock clock;
  private final TaskQueue queue;

  @GuardedBy("lock")
  private @Nullable TransportTask task;

  @GuardedBy("lock")
  private TaskState state = TaskState.IDLE;

  @GuardedBy("lock")
  private @Nullable Instant startInstant;

  /** Set once the logical request has concluded, after which the controller can't be cancelled. */
  @GuardedBy("lock")
  private boolean finished;

  private BasicTaskStateController(Builder builder) {
    this.eventSink = builder.eventSink;
    this.cancelStrategy = builder.cancelStrategy;
    this.clock = builder.clock;
    this.queue = builder.queue != null ? builder.queue : TaskQueue.createSuspended();
  }

  /**
   * Installs the given task as the live task of a new attempt. If this controller is cancelled,
   * the task is cancelled right away and {@code false} is returned.
   */
  @CanIgnoreReturnValue
  public boolean attach(TransportTask newTask) {
    requireNonNull(newTask);
    boolean attached;
    lock.lock();
    try {
      attached = state != TaskState.CANCELLED;
      if (attached) {
        task = newTask;
        state = TaskState.IDLE;
      }
    } finally {
      lock.unlock();
    }

    if (!attached) {
      newTask.cancel();
      return false;
    }
    queue.execute(() -> start(newTask));
    return true;
  }

  private void start(TransportTask startedTask) {
    lock.lock();
    try {
      if (task != startedTask || state != TaskState.IDLE) {
        return;
      }
      state = TaskState.RUNNING;
      if (startInstant == null) {
        startInstant = clock.instant();
      }
    } finally {
      lock.unlock();
    }
    startedTask.resume();
    emit(TaskEvent.Type.DID_RESUME, startedTask);
  }

  @Override
  public void resume() {
    TransportTask resumedTask = null;
    lock.lock();
    try {
      if (state.isTerminal()) {
        return;
      }
      if (task != null && state == TaskState.SUSPENDED) {
        state = TaskState.RUNNING;
        if (startInstant == null) {
          startInstant = clock.instant();
        }
        resumedTask = task;
      }
    } finally {
      lock.unlock();
    }

    // Either starts a task waiting on the queue, or lets the next attached one start right away.
    queue.resume();
    if (resumedTask != null) {
      resumedTask.resume();
      emit(TaskEvent.Type.DID_RESUME, resumedTask);
    }
  }

  @Override
  public void suspend() {
    TransportTask suspendedTask;
    lock.lock();
    try {
      if (task == null || state.isTerminal() || state == TaskState.SUSPENDED) {
        return;
      }
      state = TaskState.SUSPENDED;
      suspendedTask = task;
    } finally {
      lock.unlock();
    }
    suspendedTask.suspend();
    emit(TaskEvent.Type.DID_SUSPEND, suspendedTask);
  }

  @Override
  public void cancel() {
    TransportTask cancelledTask;
    lock.lock();
    try {
      if (task == null || state == TaskState.CANCELLED || finished) {
        return;
      }
      state = TaskState.CANCELLED;
      cancelledTask = task;
    } finally {
      lock.unlock();
    }

    try {
      cancelStrategy.cancel(cancelledTask);
    } finally {
      emit(TaskEvent.Type.DID_CANCEL, cancelledTask);
    }
  }

  /**
   * Marks the attempt of the given task as completed, unless this controller is cancelled or the
   * task is no longer the live one. Returns whether the attempt was marked completed.
   */
  @CanIgnoreReturnValue
  public boolean complete(TransportTask completedTask) {
    requireNonNull(completedTask);
    lock.lock();
    try {
      if (task != completedTask || state.isTerminal()) {
        return false;
      }
      state = TaskState.COMPLETED;
    } finally {
      lock.unlock();
    }
    emit(TaskEvent.Type.DID_COMPLETE, completedTask);
    return true;
  }

  /**
   * Marks the request this controller drives as concluded, so later cancels are ignored. Returns
   * {@code false} if the controller was cancelled first, in which case the request is to conclude
   * as cancelled.
   */
  @CanIgnoreReturnValue
  public boolean finish() {
    lock.lock();
    try {
      if (state == TaskState.CANCELLED) {
        return false;
      }
      finished = true;
      return true;
    } finally {
      lock.unlock();
    }
  }

  public boolean isFinished() {
    lock.lock();
    try {
      return finished;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public TaskState state() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  public boolean isCancelled() {
    return state() == TaskState.CANCELLED;
  }

  /** Returns the instant the first task was started, if any. */
  public Optional<Instant> startInstant() {
    lock.lock();
    try {
      return Optional.ofNullable(startInstant);
    } finally {
      lock.unlock();
    }
  }

  public Optional<TransportTask> currentTask() {
    lock.lock();
    try {
      return Optional.ofNullable(task);
    } finally {
      lock.unlock();
    }
  }

  public OptionalLong currentTaskId() {
    var current = currentTask();
    return current.isPresent() ? OptionalLong.of(current.get().id()) : OptionalLong.empty();
  }

  public TaskQueue queue() {
    return queue;
  }

  private void emit(TaskEvent.Type type, TransportTask eventTask) {
    EventSinks.notifySafely(eventSink, TaskEvent.of(type, eventTask.id(), clock.instant()));
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this) + "[state=" + state() + ", queue=" + queue + "]";
  }

  public static BasicTaskStateController create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@code BasicTaskStateController} instances. */
  public static final class Builder {
    private EventSink eventSink = EventSink.none();
    private CancelStrategy cancelStrategy = CancelStrategy.plain();
    private Clock clock = Utils.systemMillisUtc();
    private @Nullable TaskQueue queue;

    Builder() {}

    @CanIgnoreReturnValue
    public Builder eventSink(EventSink eventSink) {
      this.eventSink = requireNonNull(eventSink);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder cancelStrategy(CancelStrategy cancelStrategy) {
      this.cancelStrategy = requireNonNull(cancelStrategy);
      return this;
    }

    /** Sets the clock used for timestamping events and the start instant. */
    @CanIgnoreReturnValue
    public Builder clock(Clock clock) {
      this.clock = requireNonNull(clock);
      return this;
    }

    /**
     * Sets the queue on which the start of attached tasks is submitted. By default, each
     * controller gets a suspended queue that runs its tasks on the thread resuming it.
     */
    @CanIgnoreReturnValue
    public Builder queue(TaskQueue queue) {
      this.queue = requireNonNull(queue);
      return this;
    }

    public BasicTaskStateController build() {
      return new BasicTaskStateController(this);
    }
  }
}
