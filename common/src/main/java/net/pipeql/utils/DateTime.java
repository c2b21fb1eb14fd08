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
package net.pipeql.utils;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Time helpers. Durations are compound strings of integer and unit 
 * pairs, e.g. {@code 1h30m} or {@code 250ms}, and are held as 
 * nanoseconds.
 * 
 * @since 1.0
 */
public class DateTime {
  
  public static final long NANOS_PER_MICRO = 1000L;
  public static final long NANOS_PER_MILLI = 1000L * NANOS_PER_MICRO;
  public static final long NANOS_PER_SECOND = 1000L * NANOS_PER_MILLI;
  public static final long NANOS_PER_MINUTE = 60L * NANOS_PER_SECOND;
  public static final long NANOS_PER_HOUR = 60L * NANOS_PER_MINUTE;
  public static final long NANOS_PER_DAY = 24L * NANOS_PER_HOUR;
  public static final long NANOS_PER_WEEK = 7L * NANOS_PER_DAY;
  
  private static final String[] UNITS = 
      new String[] { "w", "d", "h", "m", "s", "ms", "us", "ns" };
  private static final long[] UNIT_NANOS = new long[] { NANOS_PER_WEEK, 
      NANOS_PER_DAY, NANOS_PER_HOUR, NANOS_PER_MINUTE, NANOS_PER_SECOND, 
      NANOS_PER_MILLI, NANOS_PER_MICRO, 1 };
  
  /**
   * Parses a compound duration (e.g, "10m", "1h30m", "3d") into 
   * nanoseconds.
   * <p>
   * Units supported: {@code ns}, {@code us} (or {@code µs}), {@code ms},
   * {@code s}, {@code m}, {@code h}, {@code d} and {@code w}.
   * 
   * @param duration The duration to parse.
   * @return A non-negative number of nanoseconds.
   * @throws IllegalArgumentException if the duration was malformed.
   */
  public static long parseDuration(final String duration) {
    if (duration == null || duration.isEmpty()) {
      throw new IllegalArgumentException("Duration cannot be null or empty.");
    }
    long total = 0;
    int i = 0;
    while (i < duration.length()) {
      final int start = i;
      while (i < duration.length() && Character.isDigit(duration.charAt(i))) {
        i++;
      }
      if (start == i) {
        throw new IllegalArgumentException("Invalid duration, expected an "
            + "integer at offset " + i + ": " + duration);
      }
      final long magnitude;
      try {
        magnitude = Long.parseLong(duration.substring(start, i));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid duration (number): " 
            + duration, e);
      }
      final int unit_start = i;
      while (i < duration.length() && !Character.isDigit(duration.charAt(i))) {
        i++;
      }
      final String unit = duration.substring(unit_start, i);
      final long multiplier = unitNanos(unit);
      if (multiplier < 0) {
        throw new IllegalArgumentException("Invalid duration (unit '" + unit 
            + "'): " + duration);
      }
      try {
        total = Math.addExact(total, Math.multiplyExact(magnitude, multiplier));
      } catch (ArithmeticException e) {
        throw new IllegalArgumentException("Duration overflows: " + duration, e);
      }
    }
    return total;
  }
  
  /**
   * Formats nanoseconds in the compound form, e.g. 5400s as {@code 1h30m}.
   * Negative values are prefixed with a minus.
   * @param nanos The duration in nanoseconds.
   * @return A non-null string.
   */
  public static String formatDuration(final long nanos) {
    if (nanos == 0) {
      return "0s";
    }
    final StringBuilder buf = new StringBuilder();
    long remaining = nanos;
    if (remaining < 0) {
      buf.append("-");
      remaining = -remaining;
    }
    for (int i = 0; i < UNITS.length; i++) {
      if (remaining >= UNIT_NANOS[i]) {
        buf.append(remaining / UNIT_NANOS[i]).append(UNITS[i]);
        remaining %= UNIT_NANOS[i];
      }
    }
    return buf.toString();
  }
  
  /**
   * Parses an RFC3339 timestamp.
   * @param datetime A non-null string like {@code 2018-05-22T19:53:26Z}.
   * @return Unix epoch nanoseconds.
   * @throws IllegalArgumentException if the string did not parse.
   */
  public static long parseDateTime(final String datetime) {
    try {
      return toNanos(Instant.parse(datetime));
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid date time: " + datetime, e);
    }
  }
  
  /**
   * @param instant A non-null instant.
   * @return Unix epoch nanoseconds.
   */
  public static long toNanos(final Instant instant) {
    return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 
        NANOS_PER_SECOND), instant.getNano());
  }
  
  /**
   * @param nanos Unix epoch nanoseconds.
   * @return The instant.
   */
  public static Instant fromNanos(final long nanos) {
    return Instant.ofEpochSecond(Math.floorDiv(nanos, NANOS_PER_SECOND), 
        Math.floorMod(nanos, NANOS_PER_SECOND));
  }
  
  /**
   * Pass through to {@link System#currentTimeMillis()} so tests can mock
   * the clock.
   * @return The current epoch time in milliseconds
   */
  public static long currentTimeMillis() {
    return System.currentTimeMillis();
  }

  /**
   * Pass through to {@link System#nanoTime()}.
   * @return A monotonic nanosecond reading.
   */
  public static long nanoTime() {
    return System.nanoTime();
  }
  
  /**
   * Calculates the difference between two values and returns the time in
   * milliseconds as a double.
   * @param end The end timestamp
   * @param start The start timestamp
   * @return The value in milliseconds
   * @throws IllegalArgumentException if end is less than start
   */
  public static double msFromNanoDiff(final long end, final long start) {
    if (end < start) {
      throw new IllegalArgumentException("End (" + end + ") cannot be less "
          + "than start (" + start + ")");
    }
    return ((double) end - (double) start) / 1000000;
  }
  
  private static long unitNanos(final String unit) {
    if (unit.equals("µs")) {
      return NANOS_PER_MICRO;
    }
    for (int i = 0; i < UNITS.length; i++) {
      if (UNITS[i].equals(unit)) {
        return UNIT_NANOS[i];
      }
    }
    return -1;
  }
}
