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

package com.github.mizosoft.rebound;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.entry;

import java.util.List;
import org.junit.jupiter.api.Test;

class HeadersTest {
  @Test
  void namesAreCaseInsensitive() {
    var headers = Headers.of("Content-Type", "text/plain");
    assertThat(headers.firstValue("content-type")).hasValue("text/plain");
    assertThat(headers.contains("CONTENT-TYPE")).isTrue();
    assertThat(headers).isEqualTo(Headers.of("content-type", "text/plain"));
    assertThat(headers).hasSameHashCodeAs(Headers.of("content-type", "text/plain"));
  }

  @Test
  void setReplacesPreviousValues() {
    var headers =
        Headers.newBuilder()
            .add("Accept", "text/plain")
            .add("accept", "text/html")
            .set("ACCEPT", "application/json")
            .build();
    assertThat(headers.allValues("Accept")).containsExactly("application/json");
  }

  @Test
  void addKeepsAllValues() {
    var headers = Headers.of("Accept", "text/plain", "Accept", "text/html");
    assertThat(headers.allValues("accept")).containsExactly("text/plain", "text/html");
    assertThat(headers.firstValue("Accept")).hasValue("text/plain");
    assertThat(headers.lastValue("Accept")).hasValue("text/html");
  }

  @Test
  void orderOfFirstOccurrenceIsKept() {
    var headers =
        Headers.newBuilder()
            .add("X-B", "1")
            .add("X-A", "2")
            .add("x-b", "3")
            .build();
    assertThat(headers.map())
        .containsExactly(entry("X-B", List.of("1", "3")), entry("X-A", List.of("2")));
  }

  @Test
  void remove() {
    var headers = Headers.of("X-A", "1", "X-B", "2").toBuilder().remove("x-a").build();
    assertThat(headers.contains("X-A")).isFalse();
    assertThat(headers.map()).containsOnlyKeys("X-B");
  }

  @Test
  void missingHeader() {
    var headers = Headers.empty();
    assertThat(headers.firstValue("X-A")).isEmpty();
    assertThat(headers.lastValue("X-A")).isEmpty();
    assertThat(headers.allValues("X-A")).isEmpty();
    assertThat(headers.isEmpty()).isTrue();
  }

  @Test
  void invalidHeaders() {
    assertThatIllegalArgumentException().isThrownBy(() -> Headers.of("X A", "1"));
    assertThatIllegalArgumentException().isThrownBy(() -> Headers.of("X-A", "1\r\n"));
    assertThatIllegalArgumentException().isThrownBy(() -> Headers.of("X-A"));
  }
}
