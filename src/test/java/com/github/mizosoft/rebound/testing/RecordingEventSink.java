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

import static java.util.stream.Collectors.toUnmodifiableList;

import com.github.mizosoft.rebound.task.EventSink;
import com.github.mizosoft.rebound.task.TaskEvent;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** An {@link EventSink} that records received events. */
public final class RecordingEventSink implements EventSink {
  private final List<TaskEvent> events = new CopyOnWriteArrayList<>();

  public RecordingEventSink() {}

  @Override
  public void onEvent(TaskEvent event) {
    events.add(event);
  }

  public List<TaskEvent> events() {
    return List.copyOf(events);
  }

  public List<TaskEvent.Type> types() {
    return events.stream().map(TaskEvent::type).collect(toUnmodifiableList());
  }

  public long count(TaskEvent.Type type) {
    return events.stream().filter(event -> event.type() == type).count();
  }

  public void clear() {
    events.clear();
  }
}
