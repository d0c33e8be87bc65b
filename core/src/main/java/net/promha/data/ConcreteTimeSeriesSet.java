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

import java.util.Collections;
import java.util.List;

import com.google.common.collect.Lists;

/**
 * A set backed by a list of series.
 *
 * @since 1.0
 */
public class ConcreteTimeSeriesSet implements TimeSeriesSet {
  private final List<TimeSeries> series;
  private int idx = -1;

  /**
   * Default ctor.
   * @param series A non-null list of series, iterated in the given order.
   */
  public ConcreteTimeSeriesSet(final List<? extends TimeSeries> series) {
    if (series == null) {
      throw new IllegalArgumentException("Series cannot be null.");
    }
    this.series = Lists.newArrayList(series);
  }

  /** @return An empty set. */
  public static ConcreteTimeSeriesSet empty() {
    return new ConcreteTimeSeriesSet(Collections.<TimeSeries>emptyList());
  }

  @Override
  public boolean next() {
    if (idx < series.size()) {
      idx++;
    }
    return idx < series.size();
  }

  @Override
  public TimeSeries at() {
    return series.get(idx);
  }

  @Override
  public Exception error() {
    return null;
  }
}
