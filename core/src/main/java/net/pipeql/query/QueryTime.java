// This file is part of PipeQL.
// Copyright (C) 2018-2020  The PipeQL Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.pipeql.query;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import net.pipeql.utils.DateTime;

/**
 * A point in time that is either absolute or relative to the query's
 * evaluation instant. The zero time is absolute and unset; a relative
 * time of zero means "now" and is not zero.
 * <p>
 * Serialized as a string: a compound duration for relative times 
 * ({@code -1h}), {@code now} for a zero offset and RFC3339 for absolute
 * times. The zero time serializes as an empty string.
 * 
 * @since 1.0
 */
public class QueryTime {
  /** The unset absolute time, 0001-01-01T00:00:00Z. */
  public static final Instant ZERO_INSTANT = Instant.parse("0001-01-01T00:00:00Z");
  
  /** The unset time. */
  public static final QueryTime ZERO = new QueryTime(false, 0, ZERO_INSTANT);
  
  /** The evaluation instant. */
  public static final QueryTime NOW = new QueryTime(true, 0, ZERO_INSTANT);
  
  private final boolean is_relative;
  private final long relative;
  private final Instant absolute;
  
  private QueryTime(final boolean is_relative, 
                    final long relative, 
                    final Instant absolute) {
    this.is_relative = is_relative;
    this.relative = relative;
    this.absolute = absolute;
  }
  
  /**
   * @param nanos An offset from now in nanoseconds, usually negative.
   * @return A relative time.
   */
  public static QueryTime relative(final long nanos) {
    return new QueryTime(true, nanos, ZERO_INSTANT);
  }
  
  /**
   * @param instant A non-null instant.
   * @return An absolute time.
   */
  public static QueryTime absolute(final Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null.");
    }
    return new QueryTime(false, 0, instant);
  }
  
  public boolean isRelative() {
    return is_relative;
  }
  
  /** @return The offset in nanoseconds, zero for absolute times. */
  public long relativeNanos() {
    return relative;
  }
  
  /** @return The absolute instant, {@link #ZERO_INSTANT} for relative ones. */
  public Instant absoluteInstant() {
    return absolute;
  }
  
  /** @return True if neither relative nor set to an absolute instant. */
  public boolean isZero() {
    return !is_relative && absolute.equals(ZERO_INSTANT);
  }
  
  /**
   * Resolves the time against the evaluation instant.
   * @param now The non-null evaluation instant.
   * @return The instant.
   */
  public Instant time(final Instant now) {
    if (is_relative) {
      return now.plusNanos(relative);
    }
    return absolute;
  }
  
  @JsonValue
  @Override
  public String toString() {
    if (is_relative) {
      return relative == 0 ? "now" : DateTime.formatDuration(relative);
    }
    return isZero() ? "" : absolute.toString();
  }
  
  /**
   * Parses the string form.
   * @param value A string, may be null or empty for the zero time.
   * @return The time.
   * @throws IllegalArgumentException if the string did not parse.
   */
  @JsonCreator
  public static QueryTime parse(final String value) {
    if (value == null || value.isEmpty()) {
      return ZERO;
    }
    if (value.equals("now")) {
      return NOW;
    }
    final char first = value.charAt(0);
    if (first == '-' || first == '+') {
      final long nanos = DateTime.parseDuration(value.substring(1));
      return relative(first == '-' ? -nanos : nanos);
    }
    try {
      return absolute(Instant.parse(value));
    } catch (DateTimeParseException e) {
      return relative(DateTime.parseDuration(value));
    }
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QueryTime)) {
      return false;
    }
    final QueryTime other = (QueryTime) o;
    return is_relative == other.is_relative 
        && relative == other.relative 
        && absolute.equals(other.absolute);
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(is_relative, relative, absolute);
  }
}
