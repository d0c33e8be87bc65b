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

import java.util.Objects;

import net.promha.data.Labels;
import net.promha.data.Point;

/**
 * A single point belonging to a series.
 *
 * @since 1.0
 */
public final class Sample {
  private final Labels metric;
  private final Point point;

  /**
   * Default ctor.
   * @param metric The non-null labels of the series.
   * @param point The non-null point.
   */
  public Sample(final Labels metric, final Point point) {
    if (metric == null) {
      throw new IllegalArgumentException("Metric cannot be null.");
    }
    if (point == null) {
      throw new IllegalArgumentException("Point cannot be null.");
    }
    this.metric = metric;
    this.point = point;
  }

  /** @return The labels of the series. */
  public Labels metric() {
    return metric;
  }

  /** @return The point. */
  public Point point() {
    return point;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Sample)) {
      return false;
    }
    final Sample other = (Sample) o;
    return metric.equals(other.metric) && point.equals(other.point);
  }

  @Override
  public int hashCode() {
    return Objects.hash(metric, point);
  }

  @Override
  public String toString() {
    return metric + " => " + point;
  }
}
