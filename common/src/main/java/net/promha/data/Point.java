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
package net.promha.data;

/**
 * A single sample: a timestamp in Unix epoch seconds and a 64 bit float.
 * <p>
 * A series that stopped being reported is marked with the special
 * {@link #STALE_NAN} value. It must only ever be detected by comparing the
 * raw bits via {@link #isStaleNaN(double)} as any NaN compares unequal to
 * itself.
 *
 * @since 1.0
 */
public final class Point {

  /** The bit pattern of a regular NaN value. */
  public static final long NORMAL_NAN_BITS = 0x7ff8000000000001L;

  /** The bit pattern of the staleness marker. */
  public static final long STALE_NAN_BITS = 0x7ff0000000000002L;

  /** A regular NaN. */
  public static final double NORMAL_NAN = Double.longBitsToDouble(NORMAL_NAN_BITS);

  /** The staleness marker. */
  public static final double STALE_NAN = Double.longBitsToDouble(STALE_NAN_BITS);

  /** The timestamp in seconds. */
  private final long timestamp;

  /** The value. */
  private final double value;

  /**
   * Default ctor.
   * @param timestamp The timestamp in seconds.
   * @param value The value, may be NaN or the stale marker.
   */
  public Point(final long timestamp, final double value) {
    this.timestamp = timestamp;
    this.value = value;
  }

  /** @return The timestamp in Unix epoch seconds. */
  public long timestamp() {
    return timestamp;
  }

  /** @return The value. */
  public double value() {
    return value;
  }

  /** @return Whether or not the value is the staleness marker. */
  public boolean isStale() {
    return isStaleNaN(value);
  }

  /**
   * @param value A value to check.
   * @return True if the raw bits of the value match the stale marker.
   */
  public static boolean isStaleNaN(final double value) {
    return Double.doubleToRawLongBits(value) == STALE_NAN_BITS;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Point)) {
      return false;
    }
    final Point other = (Point) o;
    return timestamp == other.timestamp &&
        Double.doubleToRawLongBits(value) ==
          Double.doubleToRawLongBits(other.value);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(timestamp) * 31 +
        Long.hashCode(Double.doubleToRawLongBits(value));
  }

  @Override
  public String toString() {
    return value + " @" + timestamp;
  }
}
