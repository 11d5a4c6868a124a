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
import java.time.Instant;
import java.util.Objects;

/** A lifecycle event of a transport task. */
public final class TaskEvent {
  private final Type type;
  private final long taskId;
  private final Instant instant;

  private TaskEvent(Type type, long taskId, Instant instant) {
    this.type = requireNonNull(type);
    this.taskId = taskId;
    this.instant = requireNonNull(instant);
  }

  public Type type() {
    return type;
  }

  /** Returns the {@link TransportTask#id() id} of the task. */
  public long taskId() {
    return taskId;
  }

  public Instant instant() {
    return instant;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof TaskEvent)) {
      return false;
    }
    var other = (TaskEvent) obj;
    return type == other.type && taskId == other.taskId && instant.equals(other.instant);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, taskId, instant);
  }

  @Override
  public String toString() {
    return type.eventName() + "[taskId=" + taskId + ", instant=" + instant + "]";
  }

  public static TaskEvent of(Type type, long taskId, Instant instant) {
    return new TaskEvent(type, taskId, instant);
  }

  public enum Type {
    DID_RESUME("task.didResume"),
    DID_SUSPEND("task.didSuspend"),
    DID_CANCEL("task.didCancel"),
    DID_COMPLETE("task.didComplete");

    private final String eventName;

    Type(String eventName) {
      this.eventName = eventName;
    }

    public String eventName() {
      return eventName;
    }
  }
}
