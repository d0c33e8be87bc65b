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

import java.util.Arrays;
import java.util.List;

/**
 * A series fully materialized in memory, e.g. as decoded from a backend
 * response.
 *
 * @since 1.0
 */
public class ConcreteTimeSeries implements TimeSeries {
  private final Labels labels;
  private final long[] timestamps;
  private final double[] values;

  /**
   * Default ctor.
   * @param labels The non-null labels.
   * @param points The points in strictly ascending timestamp order.
   * @throws IllegalArgumentException if an argument was null or the points
   * were out of order or repeated a timestamp.
   */
  public ConcreteTimeSeries(final Labels labels, final List<Point> points) {
    if (labels == null) {
      throw new IllegalArgumentException("Labels cannot be null.");
    }
    if (points == null) {
      throw new IllegalArgumentException("Points cannot be null.");
    }
    this.labels = labels;
    timestamps = new long[points.size()];
    values = new double[points.size()];
    for (int i = 0; i < points.size(); i++) {
      final Point point = points.get(i);
      if (i > 0 && point.timestamp() <= timestamps[i - 1]) {
        throw new IllegalArgumentException("Points for " + labels
            + " must be in strictly ascending order at index " + i);
      }
      timestamps[i] = point.timestamp();
      values[i] = point.value();
    }
  }

  @Override
  public Labels labels() {
    return labels;
  }

  /** @return The number of samples. */
  public int size() {
    return timestamps.length;
  }

  @Override
  public TimeSeriesIterator iterator() {
    return new LocalIterator();
  }

  @Override
  public String toString() {
    return labels + " (" + timestamps.length + " samples)";
  }

  class LocalIterator implements TimeSeriesIterator {
    private int idx = -1;

    @Override
    public boolean seek(final long timestamp) {
      int i = Arrays.binarySearch(timestamps, timestamp);
      if (i < 0) {
        i = -(i + 1);
      }
      idx = i;
      return idx < timestamps.length;
    }

    @Override
    public boolean next() {
      if (idx < timestamps.length) {
        idx++;
      }
      return idx < timestamps.length;
    }

    @Override
    public long timestamp() {
      return timestamps[idx];
    }

    @Override
    public double value() {
      return values[idx];
    }

    @Override
    public Exception error() {
      return null;
    }
  }
}
