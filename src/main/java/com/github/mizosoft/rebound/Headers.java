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

import static com.github.mizosoft.rebound.internal.Utils.requireValidHeaderName;
import static com.github.mizosoft.rebound.internal.Utils.requireValidHeaderValue;
import static com.github.mizosoft.rebound.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable collection of HTTP header fields. Names are case-insensitive, and fields keep the
 * order in which their name was first added. {@link Builder#set(String, String) Setting} a field
 * replaces all of its previous values (last write wins).
 */
public final class Headers {
  private static final Headers EMPTY = new Headers(new LinkedHashMap<>());

  /** Maps lower-cased names to fields. */
  private final Map<String, Field> fields;

  private Headers(LinkedHashMap<String, Field> fields) {
    this.fields = Collections.unmodifiableMap(fields);
  }

  /** Returns the first value of the given header, if any. */
  public Optional<String> firstValue(String name) {
    var field = fields.get(key(name));
    return field != null ? Optional.of(field.values.get(0)) : Optional.empty();
  }

  /** Returns the last value of the given header, if any. */
  public Optional<String> lastValue(String name) {
    var field = fields.get(key(name));
    return field != null
        ? Optional.of(field.values.get(field.values.size() - 1))
        : Optional.empty();
  }

  /** Returns all values of the given header, or an empty list if there's no such header. */
  public List<String> allValues(String name) {
    var field = fields.get(key(name));
    return field != null ? field.values : List.of();
  }

  public boolean contains(String name) {
    return fields.containsKey(key(name));
  }

  public boolean isEmpty() {
    return fields.isEmpty();
  }

  /** Returns an ordered view of the headers, keyed by the name each field was first added with. */
  public Map<String, List<String>> map() {
    var map = new LinkedHashMap<String, List<String>>();
    fields.values().forEach(field -> map.put(field.name, field.values));
    return Collections.unmodifiableMap(map);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof Headers)) {
      return false;
    }

    var other = (Headers) obj;
    if (fields.size() != other.fields.size()) {
      return false;
    }
    for (var entry : fields.entrySet()) {
      var otherField = other.fields.get(entry.getKey());
      if (otherField == null || !entry.getValue().values.equals(otherField.values)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int hash = 0;
    for (var entry : fields.entrySet()) {
      hash += entry.getKey().hashCode() ^ entry.getValue().values.hashCode();
    }
    return hash;
  }

  @Override
  public String toString() {
    return map().toString();
  }

  public static Headers empty() {
    return EMPTY;
  }

  /**
   * Returns headers containing the given name-value pairs.
   *
   * @throws IllegalArgumentException if the array's length is odd or any name or value is invalid
   */
  public static Headers of(String... namesAndValues) {
    requireArgument(
        namesAndValues.length % 2 == 0,
        "Expected an even-numbered array length: %d",
        namesAndValues.length);
    var builder = newBuilder();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      builder.add(namesAndValues[i], namesAndValues[i + 1]);
    }
    return builder.build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  private static String key(String name) {
    return name.toLowerCase(Locale.ROOT);
  }

  private static final class Field {
    final String name;
    final List<String> values;

    Field(String name, List<String> values) {
      this.name = name;
      this.values = values;
    }
  }

  /** A builder of {@code Headers}. */
  public static final class Builder {
    private final LinkedHashMap<String, String> names = new LinkedHashMap<>();
    private final LinkedHashMap<String, List<String>> values = new LinkedHashMap<>();

    Builder() {}

    Builder(Headers headers) {
      headers.fields.forEach(
          (key, field) -> {
            names.put(key, field.name);
            values.put(key, new ArrayList<>(field.values));
          });
    }

    /** Adds the given value to the given header's values. */
    @CanIgnoreReturnValue
    public Builder add(String name, String value) {
      requireValidHeaderName(name);
      requireValidHeaderValue(value);
      var key = key(name);
      names.putIfAbsent(key, name);
      values.computeIfAbsent(key, __ -> new ArrayList<>()).add(value);
      return this;
    }

    /** Replaces all values of the given header with the given value. */
    @CanIgnoreReturnValue
    public Builder set(String name, String value) {
      requireValidHeaderName(name);
      requireValidHeaderValue(value);
      var key = key(name);
      names.putIfAbsent(key, name);
      var myValues = values.computeIfAbsent(key, __ -> new ArrayList<>());
      myValues.clear();
      myValues.add(value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addAll(Headers headers) {
      headers.map().forEach((name, headerValues) -> headerValues.forEach(v -> add(name, v)));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder remove(String name) {
      var key = key(requireNonNull(name));
      names.remove(key);
      values.remove(key);
      return this;
    }

    public Headers build() {
      if (values.isEmpty()) {
        return EMPTY;
      }

      var fields = new LinkedHashMap<String, Field>();
      values.forEach(
          (key, headerValues) ->
              fields.put(key, new Field(names.get(key), List.copyOf(headerValues))));
      return new Headers(fields);
    }
  }
}
