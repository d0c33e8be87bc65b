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
package net.promha.query.merge;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.Lists;

import net.promha.data.Labels;
import net.promha.data.TimeSeries;
import net.promha.data.TimeSeriesIterator;

/**
 * A series reported by more than one backend. Iteration walks the union of
 * every backend's timestamps. Where several backends have a sample at the
 * same timestamp the {@link SampleMergeStrategy} picks the value, so a gap
 * in one replica is filled by another.
 * <p>
 * Strategies that evaluate by backend order are resolved against
 * {@link #sources()} at each evaluation time instead.
 *
 * @since 1.0
 */
public class MergedTimeSeries implements TimeSeries {
  private final Labels labels;
  private final List<TimeSeries> sources;
  private final SampleMergeStrategy strategy;

  /**
   * Default ctor.
   * @param labels The non-null labels shared by every source.
   * @param sources Two or more sources in backend priority order.
   * @param strategy The non-null strategy.
   */
  public MergedTimeSeries(final Labels labels,
                          final List<TimeSeries> sources,
                          final SampleMergeStrategy strategy) {
    if (labels == null) {
      throw new IllegalArgumentException("Labels cannot be null.");
    }
    if (sources == null || sources.isEmpty()) {
      throw new IllegalArgumentException("Sources cannot be null or empty.");
    }
    if (strategy == null) {
      throw new IllegalArgumentException("Strategy cannot be null.");
    }
    this.labels = labels;
    this.sources = Lists.newArrayList(sources);
    this.strategy = strategy;
  }

  @Override
  public Labels labels() {
    return labels;
  }

  /** @return The number of backends contributing to this series. */
  public int sourceCount() {
    return sources.size();
  }

  /** @return The contributing series in backend priority order. */
  public List<TimeSeries> sources() {
    return Collections.unmodifiableList(sources);
  }

  /** @return The strategy resolving samples across backends. */
  public SampleMergeStrategy strategy() {
    return strategy;
  }

  @Override
  public TimeSeriesIterator iterator() {
    return new LocalIterator();
  }

  @Override
  public String toString() {
    return labels + " merged from " + sources.size() + " backends";
  }

  class LocalIterator implements TimeSeriesIterator {
    private final TimeSeriesIterator[] iterators;
    private final boolean[] ok;
    private final double[] candidates;
    private boolean started;
    private boolean positioned;
    private long timestamp;
    private double value;

    LocalIterator() {
      iterators = new TimeSeriesIterator[sources.size()];
      for (int i = 0; i < iterators.length; i++) {
        iterators[i] = sources.get(i).iterator();
      }
      ok = new boolean[iterators.length];
      candidates = new double[iterators.length];
    }

    @Override
    public boolean seek(final long t) {
      started = true;
      for (int i = 0; i < iterators.length; i++) {
        ok[i] = iterators[i].seek(t);
      }
      return update();
    }

    @Override
    public boolean next() {
      if (!started) {
        started = true;
        for (int i = 0; i < iterators.length; i++) {
          ok[i] = iterators[i].next();
        }
        return update();
      }
      if (!positioned) {
        return false;
      }
      for (int i = 0; i < iterators.length; i++) {
        if (ok[i] && iterators[i].timestamp() == timestamp) {
          ok[i] = iterators[i].next();
        }
      }
      return update();
    }

    @Override
    public long timestamp() {
      return timestamp;
    }

    @Override
    public double value() {
      return value;
    }

    @Override
    public Exception error() {
      for (final TimeSeriesIterator iterator : iterators) {
        if (iterator.error() != null) {
          return iterator.error();
        }
      }
      return null;
    }

    /** Moves to the smallest timestamp among the positioned sources. */
    private boolean update() {
      long min = Long.MAX_VALUE;
      boolean any = false;
      for (int i = 0; i < iterators.length; i++) {
        if (ok[i] && (!any || iterators[i].timestamp() < min)) {
          min = iterators[i].timestamp();
          any = true;
        }
      }
      if (!any) {
        positioned = false;
        return false;
      }
      int count = 0;
      for (int i = 0; i < iterators.length; i++) {
        if (ok[i] && iterators[i].timestamp() == min) {
          candidates[count++] = iterators[i].value();
        }
      }
      timestamp = min;
      value = strategy.merge(candidates, count);
      positioned = true;
      return true;
    }
  }
}
