/*
 * Copyright (C) 2024 Square, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package okws;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;
import okws.internal.Util;

/**
 * Header fields of an upgrade request or of the 101 response that accepts it, in the order they
 * were added. Names keep their case but are matched case-insensitively. Values are trimmed and
 * otherwise uninterpreted; a line like {@code Connection: keep-alive, Upgrade} is one value whose
 * tokens are tested with {@link #containsToken}.
 *
 * <p>Instances are immutable.
 */
public final class Headers {
  public static final Headers EMPTY = new Headers(Util.EMPTY_STRING_ARRAY);

  /** Alternating names and values. */
  private final String[] fields;

  private Headers(String[] fields) {
    this.fields = fields;
  }

  /** Returns the last value of {@code name}, or null if it is absent. */
  public @Nullable String get(String name) {
    for (int i = size() - 1; i >= 0; i--) {
      if (name.equalsIgnoreCase(name(i))) return value(i);
    }
    return null;
  }

  public int size() {
    return fields.length / 2;
  }

  public String name(int index) {
    return fields[index * 2];
  }

  public String value(int index) {
    return fields[index * 2 + 1];
  }

  /** Returns every value of {@code name} in the order they were added. */
  public List<String> values(String name) {
    List<String> result = new ArrayList<>();
    for (int i = 0, size = size(); i < size; i++) {
      if (name.equalsIgnoreCase(name(i))) result.add(value(i));
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Returns true if some value of {@code name}, split on commas, holds {@code token}. Tokens are
   * trimmed and compared ignoring case.
   */
  public boolean containsToken(String name, String token) {
    for (String value : values(name)) {
      for (String candidate : value.split(",")) {
        if (candidate.trim().equalsIgnoreCase(token)) return true;
      }
    }
    return false;
  }

  /** Equal headers have the same names, with the same case, and values in the same order. */
  @Override public boolean equals(@Nullable Object other) {
    return other instanceof Headers && Arrays.equals(((Headers) other).fields, fields);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(fields);
  }

  @Override public String toString() {
    StringBuilder result = new StringBuilder();
    for (int i = 0, size = size(); i < size; i++) {
      result.append(name(i)).append(": ").append(value(i)).append("\n");
    }
    return result.toString();
  }

  /** Returns headers from alternating names and values, like {@code of("Target", "chat")}. */
  public static Headers of(String... namesAndValues) {
    if (namesAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected alternating header names and values");
    }
    Builder builder = new Builder();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      builder.add(namesAndValues[i], namesAndValues[i + 1]);
    }
    return builder.build();
  }

  public static final class Builder {
    private final List<String> fields = new ArrayList<>();

    /**
     * Adds a {@code name: value} line as read from the peer, without validation. A line without a
     * colon is kept with an empty name so that the upgrade can reject it later.
     */
    Builder addLenient(String line) {
      int colon = line.indexOf(':', 1);
      if (colon != -1) return addLenient(line.substring(0, colon), line.substring(colon + 1));
      return addLenient("", line.startsWith(":") ? line.substring(1) : line);
    }

    Builder addLenient(String name, String value) {
      fields.add(name.trim());
      fields.add(value.trim());
      return this;
    }

    /**
     * Adds a field to be sent to the peer.
     *
     * @throws IllegalArgumentException if {@code name} is not a token or {@code value} holds
     *     control characters.
     */
    public Builder add(String name, String value) {
      if (name.isEmpty()) throw new IllegalArgumentException("Empty header name");
      for (int i = 0; i < name.length(); i++) {
        char c = name.charAt(i);
        if (c <= ' ' || c >= '\u007f' || c == ':') {
          throw new IllegalArgumentException(
              Util.format("Header name %s has unexpected char %#04x at %d", name, (int) c, i));
        }
      }
      for (int i = 0; i < value.length(); i++) {
        char c = value.charAt(i);
        if ((c < ' ' && c != '\t') || c >= '\u007f') {
          throw new IllegalArgumentException(
              Util.format("Header %s has unexpected char %#04x at %d", name, (int) c, i));
        }
      }
      return addLenient(name, value);
    }

    /** Adds every field of {@code headers} after those already added. */
    public Builder addAll(Headers headers) {
      Collections.addAll(fields, headers.fields);
      return this;
    }

    public Headers build() {
      return new Headers(fields.toArray(Util.EMPTY_STRING_ARRAY));
    }
  }
}
