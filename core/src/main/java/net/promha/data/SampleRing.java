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
 * A growable circular buffer of samples that only keeps samples within
 * {@code delta} seconds of the newest one added.
 *
 * @since 1.0
 */
public class SampleRing {
  /** The window in seconds. */
  private final long delta;

  private long[] timestamps;
  private double[] values;

  /** Index of the first sample. */
  private int first;

  /** Number of samples held. */
  private int size;

  /**
   * Default ctor.
   * @param delta The window in seconds.
   * @param capacity The initial capacity, at least 1.
   */
  public SampleRing(final long delta, final int capacity) {
    if (delta < 0) {
      throw new IllegalArgumentException("Delta cannot be negative.");
    }
    if (capacity < 1) {
      throw new IllegalArgumentException("Capacity must be at least 1.");
    }
    this.delta = delta;
    timestamps = new long[capacity];
    values = new double[capacity];
  }

  /** @return The window in seconds. */
  public long delta() {
    return delta;
  }

  /** @return The number of samples held. */
  public int size() {
    return size;
  }

  /** Drops all samples. */
  public void reset() {
    first = 0;
    size = 0;
  }

  /**
   * Appends a sample and drops every sample older than
   * {@code timestamp - delta}.
   * @param timestamp The timestamp in seconds, not older than the last.
   * @param value The value.
   */
  public void add(final long timestamp, final double value) {
    if (size == timestamps.length) {
      grow();
    }
    final int idx = (first + size) % timestamps.length;
    timestamps[idx] = timestamp;
    values[idx] = value;
    size++;

    final long min = timestamp - delta;
    while (size > 0 && timestamps[first] < min) {
      first = (first + 1) % timestamps.length;
      size--;
    }
  }

  /**
   * @param n 1 for the newest sample, 2 for the one before and so on.
   * @return The sample or null if fewer than n samples are held.
   */
  public Point nthLast(final int n) {
    if (n < 1 || n > size) {
      return null;
    }
    final int idx = (first + size - n) % timestamps.length;
    return new Point(timestamps[idx], values[idx]);
  }

  private void grow() {
    final int length = timestamps.length * 2;
    final long[] new_timestamps = new long[length];
    final double[] new_values = new double[length];
    for (int i = 0; i < size; i++) {
      final int idx = (first + i) % timestamps.length;
      new_timestamps[i] = timestamps[idx];
      new_values[i] = values[idx];
    }
    timestamps = new_timestamps;
    values = new_values;
    first = 0;
  }
}
