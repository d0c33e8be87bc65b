// This file is part of PromHA.
// Copyright (C) 2024  The PromHA Authors.
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
package net.promha.utils;

import com.google.common.base.Strings;

/**
 * Utility class for parsing durations and measuring elapsed time.
 *
 * @since 1.0
 */
public class DateTime {

  /**
   * Parses a human-readable duration (e.g, "10m", "3h", "14d") into
   * milliseconds.
   * <p>
   * Formats supported:<ul>
   * <li>{@code ms}: milliseconds</li>
   * <li>{@code s}: seconds</li>
   * <li>{@code m}: minutes</li>
   * <li>{@code h}: hours</li>
   * <li>{@code d}: days</li>
   * <li>{@code w}: weeks</li>
   * <li>{@code n}: month (30 days)</li>
   * <li>{@code y}: years (365 days)</li></ul>
   * @param duration The human-readable duration to parse.
   * @return A strictly positive number of milliseconds.
   * @throws IllegalArgumentException if the interval was malformed.
   */
  public static final long parseDuration(final String duration) {
    if (Strings.isNullOrEmpty(duration)) {
      throw new IllegalArgumentException("Duration cannot be null or empty.");
    }
    long interval;
    long multiplier;
    double temp;
    int unit = 0;
    while (Character.isDigit(duration.charAt(unit))) {
      unit++;
      if (unit >= duration.length()) {
        throw new IllegalArgumentException("Invalid duration, must have an "
            + "integer and unit: " + duration);
      }
    }
    try {
      interval = Long.parseLong(duration.substring(0, unit));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration (number): " + duration);
    }
    if (interval <= 0) {
      throw new IllegalArgumentException("Zero or negative duration: " + duration);
    }
    final String suffix = duration.substring(unit).toLowerCase();
    switch (suffix) {
      case "ms": return interval;
      case "s": multiplier = 1; break;                        // seconds
      case "m": multiplier = 60; break;                       // minutes
      case "h": multiplier = 3600; break;                     // hours
      case "d": multiplier = 3600 * 24; break;                // days
      case "w": multiplier = 3600 * 24 * 7; break;            // weeks
      case "n": multiplier = 3600 * 24 * 30; break;           // month (average)
      case "y": multiplier = 3600 * 24 * 365; break;          // years
      default: throw new IllegalArgumentException("Invalid duration (suffix): " + duration);
    }
    multiplier *= 1000;
    temp = (double) interval * multiplier;
    if (temp > Long.MAX_VALUE) {
      throw new IllegalArgumentException("Duration must be < Long.MAX_VALUE ms: " + duration);
    }
    return interval * multiplier;
  }

  /**
   * Parses a duration and truncates it to whole seconds.
   * @param duration The human-readable duration to parse.
   * @return The number of seconds, at least 1.
   * @throws IllegalArgumentException if the duration was malformed or
   * shorter than a second.
   */
  public static final long parseDurationSeconds(final String duration) {
    final long ms = parseDuration(duration);
    if (ms < 1000) {
      throw new IllegalArgumentException("Duration must be at least one "
          + "second: " + duration);
    }
    return ms / 1000;
  }

  /** @return The current Unix epoch timestamp in seconds. */
  public static long currentTimeSeconds() {
    return System.currentTimeMillis() / 1000;
  }

  /** @return The current system nano time. */
  public static long nanoTime() {
    return System.nanoTime();
  }

  /**
   * Calculates the difference between two values and returns the time in
   * milliseconds as a double.
   * @param end The end timestamp.
   * @param start The start timestamp.
   * @return The value in milliseconds.
   * @throws IllegalArgumentException if end is less than start.
   */
  public static double msFromNanoDiff(final long end, final long start) {
    if (end < start) {
      throw new IllegalArgumentException("End (" + end + ") cannot be less "
          + "than start (" + start + ")");
    }
    return ((double) end - (double) start) / 1000000;
  }
}
