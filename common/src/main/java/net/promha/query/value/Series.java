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
package net.promha.query.value;

import java.util.List;

import com.google.common.collect.Lists;

import net.promha.data.Labels;
import net.promha.data.Point;
import net.promha.pools.PooledPoints;

/**
 * A stream of points belonging to one series. The points live in pooled
 * storage that must be released exactly once via {@link #release()}.
 *
 * @since 1.0
 */
public class Series {
  private final Labels metric;
  private final PooledPoints points;

  /**
   * Default ctor.
   * @param metric The non-null labels of the series.
   * @param points The non-null pooled storage, now owned by this series.
   */
  public Series(final Labels metric, final PooledPoints points) {
    if (metric == null) {
      throw new IllegalArgumentException("Metric cannot be null.");
    }
    if (points == null) {
      throw new IllegalArgumentException("Points cannot be null.");
    }
    this.metric = metric;
    this.points = points;
  }

  /** @return The labels of the series. */
  public Labels metric() {
    return metric;
  }

  /** @return The underlying storage. */
  public PooledPoints pooledPoints() {
    return points;
  }

  /** @return The number of points. */
  public int size() {
    return points.size();
  }

  /**
   * @param index A zero based index.
   * @return A new point for the index.
   */
  public Point point(final int index) {
    return points.point(index);
  }

  /** @return A copy of the points as objects. */
  public List<Point> points() {
    final List<Point> copy = Lists.newArrayListWithCapacity(points.size());
    for (int i = 0; i < points.size(); i++) {
      copy.add(points.point(i));
    }
    return copy;
  }

  /**
   * Returns the storage to the pool.
   * @throws IllegalStateException if already released.
   */
  public void release() {
    points.release();
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append(metric)
        .append(" =>");
    if (!points.released()) {
      for (int i = 0; i < points.size(); i++) {
        buf.append("\n").append(points.point(i));
      }
    }
    return buf.toString();
  }
}
