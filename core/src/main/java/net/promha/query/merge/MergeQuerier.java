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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.promha.data.ConcreteTimeSeriesSet;
import net.promha.data.ErrorTimeSeriesSet;
import net.promha.data.LabelValidator;
import net.promha.data.Labels;
import net.promha.data.TimeSeries;
import net.promha.data.TimeSeriesSet;
import net.promha.exceptions.AllBackendsFailedException;
import net.promha.exceptions.QueryExecutionException;
import net.promha.query.Querier;
import net.promha.query.SelectParams;
import net.promha.stats.StatsCollector;

/**
 * Sends the same select to every backend concurrently and merges the
 * results into a single set without duplicate label sets.
 * <p>
 * Backends that fail are logged and skipped. Only if every backend fails
 * does the select fail, with an {@link AllBackendsFailedException} carrying
 * each backend's exception. Series with invalid labels are dropped unless
 * there is only one backend, in which case that backend fails.
 * <p>
 * The output is sorted by labels regardless of the order in which backends
 * respond.
 *
 * @since 1.0
 */
public class MergeQuerier implements Querier {
  private static final Logger LOG = LoggerFactory.getLogger(MergeQuerier.class);

  /** The backends in priority order. */
  private final List<Querier> queriers;

  /** Picks values for series reported by several backends. */
  private final SampleMergeStrategy strategy;

  /** Stats. */
  private final StatsCollector stats;

  /**
   * Default ctor.
   * @param queriers A non-empty list of queriers in priority order.
   * @param strategy The non-null merge strategy.
   * @param stats A non-null stats collector.
   * @throws IllegalArgumentException if an argument was null or empty.
   */
  public MergeQuerier(final List<Querier> queriers,
                      final SampleMergeStrategy strategy,
                      final StatsCollector stats) {
    if (queriers == null || queriers.isEmpty()) {
      throw new IllegalArgumentException("Queriers cannot be null or empty.");
    }
    if (strategy == null) {
      throw new IllegalArgumentException("Strategy cannot be null.");
    }
    if (stats == null) {
      throw new IllegalArgumentException("Stats cannot be null.");
    }
    this.queriers = Lists.newArrayList(queriers);
    this.strategy = strategy;
    this.stats = stats;
  }

  @Override
  public Deferred<TimeSeriesSet> select(final SelectParams params) {
    final Exception[] exceptions = new Exception[queriers.size()];

    /** Pulls the series out of a backend's set and validates them. */
    class ExpandCB implements Callback<List<TimeSeries>, TimeSeriesSet> {
      final int idx;
      ExpandCB(final int idx) {
        this.idx = idx;
      }
      @Override
      public List<TimeSeries> call(final TimeSeriesSet set) throws Exception {
        if (set == null) {
          throw new QueryExecutionException("Backend " + idx
              + " returned a null series set.", 500);
        }
        final List<TimeSeries> series = Lists.newArrayList();
        while (set.next()) {
          final TimeSeries ts = set.at();
          try {
            LabelValidator.validate(ts.labels());
          } catch (IllegalArgumentException e) {
            stats.incrementCounter("merge.series.invalid",
                "backend", Integer.toString(idx));
            if (queriers.size() == 1) {
              throw new QueryExecutionException("Invalid series from backend "
                  + idx + ": " + e.getMessage(), 500, e);
            }
            LOG.warn("Dropping invalid series from backend " + idx + ": "
                + e.getMessage());
            continue;
          }
          series.add(ts);
        }
        if (set.error() != null) {
          throw set.error();
        }
        return series;
      }
    }

    /** Records a failed backend and turns it into a null result. */
    class ErrCB implements Callback<Object, Exception> {
      final int idx;
      ErrCB(final int idx) {
        this.idx = idx;
      }
      @Override
      public Object call(final Exception e) throws Exception {
        exceptions[idx] = e;
        stats.incrementCounter("merge.backend.failed",
            "backend", Integer.toString(idx));
        LOG.warn("Backend " + idx + " failed for " + params + ": " + e);
        return null;
      }
    }

    /** Merges the surviving backends or fails if none survived. */
    class GroupCB implements Callback<TimeSeriesSet, ArrayList<List<TimeSeries>>> {
      @Override
      public TimeSeriesSet call(final ArrayList<List<TimeSeries>> results)
          throws Exception {
        int valid = 0;
        for (final List<TimeSeries> result : results) {
          if (result != null) {
            valid++;
          }
        }
        if (valid == 0) {
          final List<Exception> failures =
              Lists.newArrayListWithCapacity(exceptions.length);
          for (final Exception e : exceptions) {
            if (e != null) {
              failures.add(e);
            }
          }
          throw new AllBackendsFailedException(failures);
        }
        return merge(results);
      }
    }

    final List<Deferred<List<TimeSeries>>> deferreds =
        Lists.newArrayListWithCapacity(queriers.size());
    for (int i = 0; i < queriers.size(); i++) {
      Deferred<TimeSeriesSet> deferred;
      try {
        deferred = queriers.get(i).select(params);
      } catch (Exception e) {
        deferred = Deferred.<TimeSeriesSet>fromResult(
            new ErrorTimeSeriesSet(e));
      }
      deferreds.add(deferred
          .addCallback(new ExpandCB(i))
          .addErrback(new ErrCB(i)));
    }
    return Deferred.group(deferreds).addCallback(new GroupCB());
  }

  @Override
  public void close() {
    for (final Querier querier : queriers) {
      try {
        querier.close();
      } catch (Exception e) {
        LOG.warn("Failed to close querier " + querier, e);
      }
    }
  }

  /**
   * Groups series by labels across backends. Labels seen once pass through,
   * labels seen in several backends are merged.
   * @param results The per-backend series in priority order, null for
   * failed backends.
   * @return The sorted, de-duplicated set.
   */
  TimeSeriesSet merge(final List<List<TimeSeries>> results) {
    final Map<Labels, List<TimeSeries>> grouped = Maps.newTreeMap();
    for (int i = 0; i < results.size(); i++) {
      final List<TimeSeries> result = results.get(i);
      if (result == null) {
        continue;
      }
      final Set<Labels> seen = Sets.newHashSetWithExpectedSize(result.size());
      for (final TimeSeries series : result) {
        if (!seen.add(series.labels())) {
          LOG.warn("Backend " + i + " returned duplicate series "
              + series.labels() + ", keeping the first.");
          continue;
        }
        List<TimeSeries> sources = grouped.get(series.labels());
        if (sources == null) {
          sources = Lists.newArrayListWithCapacity(results.size());
          grouped.put(series.labels(), sources);
        }
        sources.add(series);
      }
    }

    final List<TimeSeries> merged = Lists.newArrayListWithCapacity(grouped.size());
    for (final Entry<Labels, List<TimeSeries>> entry : grouped.entrySet()) {
      if (entry.getValue().size() == 1) {
        merged.add(entry.getValue().get(0));
      } else {
        merged.add(new MergedTimeSeries(entry.getKey(), entry.getValue(),
            strategy));
      }
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Merged " + merged.size() + " series from "
          + results.size() + " backends");
    }
    return new ConcreteTimeSeriesSet(merged);
  }
}
