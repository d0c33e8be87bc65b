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
package net.promha.query.engine;

import java.util.List;

import net.promha.data.BufferedTimeSeriesIterator;
import net.promha.data.Point;
import net.promha.data.TimeSeries;
import net.promha.exceptions.QueryExecutionException;
import net.promha.exceptions.QueryPhase;
import net.promha.exceptions.TooManySamplesException;
import net.promha.pools.PointArrayPool;
import net.promha.pools.PooledPoints;
import net.promha.query.QueryContext;
import net.promha.query.merge.MergedTimeSeries;
import net.promha.query.value.Matrix;
import net.promha.query.value.Series;

/**
 * Samples series on a fixed grid of timestamps with lookback semantics.
 * At each grid time T the value is the latest sample at or before T, as
 * long as it is no older than T minus the lookback window. Stale markers
 * mean there is no value. Nothing is interpolated.
 * <p>
 * Series merged from several backends by a strategy that evaluates by
 * backend order take, at each T, the first backend with a usable sample.
 * <p>
 * Every recorded point counts against a sample budget. Exceeding it
 * throws a {@link TooManySamplesException}. The caller owns the output
 * matrix and must release it, including when evaluation throws.
 *
 * @since 1.0
 */
public class Evaluator {
  static final String ENV = "query execution";

  private final QueryContext context;
  private final long start;
  private final long end;
  private final long interval;
  private final long lookback_delta;
  private final int max_samples;
  private final PointArrayPool pool;

  /** Points recorded so far. */
  private int current_samples;

  /**
   * Default ctor.
   * @param context The non-null query context.
   * @param start The first grid time in seconds.
   * @param end The last grid time in seconds, inclusive.
   * @param interval The grid step in seconds, at least 1.
   * @param lookback_delta The lookback window in seconds.
   * @param max_samples The sample budget.
   * @param pool The pool to claim point storage from.
   */
  public Evaluator(final QueryContext context,
                   final long start,
                   final long end,
                   final long interval,
                   final long lookback_delta,
                   final int max_samples,
                   final PointArrayPool pool) {
    if (interval < 1) {
      throw new IllegalArgumentException("Interval must be at least 1: "
          + interval);
    }
    if (end < start) {
      throw new IllegalArgumentException("End cannot be before start.");
    }
    if (end - start < 0 || end - start == Long.MAX_VALUE) {
      throw new IllegalArgumentException("Range is too wide: " + start
          + " to " + end);
    }
    this.context = context;
    this.start = start;
    this.end = end;
    this.interval = interval;
    this.lookback_delta = lookback_delta;
    this.max_samples = max_samples;
    this.pool = pool;
  }

  /**
   * Samples every series and appends those with at least one point to the
   * matrix.
   * @param series The non-null series to sample.
   * @param matrix The non-null output matrix.
   * @throws TooManySamplesException if the budget was exceeded.
   * @throws net.promha.exceptions.QueryTimeoutException if the query timed
   * out.
   * @throws net.promha.exceptions.QueryExecutionCanceled if the query was
   * canceled.
   */
  public void eval(final List<TimeSeries> series, final Matrix matrix) {
    final long steps = (end - start) / interval + 1;
    final SeriesSampler single = new SeriesSampler(
        new BufferedTimeSeriesIterator(lookback_delta));
    for (final TimeSeries ts : series) {
      context.check(QueryPhase.EVALUATION);
      final Sampler sampler = sampler(ts, single);
      // storage grows on demand, the budget caps what can be written
      final PooledPoints points = pool.claim((int) Math.max(1, Math.min(
          Math.min(steps, (long) max_samples - current_samples),
          pool.arrayLength())));
      boolean kept = false;
      try {
        long i = 0;
        while (i < steps) {
          final long t = start + i * interval;
          final Point point = sampler.sample(t);
          if (point != null) {
            if (current_samples >= max_samples) {
              throw new TooManySamplesException(ENV, max_samples);
            }
            points.add(t, point.value());
            current_samples++;
            i++;
            continue;
          }
          // nothing changes until the grid reaches the next sample
          final long next = sampler.next(t);
          if (next == Long.MAX_VALUE) {
            break;
          }
          i = next > t ? Math.max(i + 1, (next - start - 1) / interval + 1)
              : i + 1;
        }
        if (points.size() > 0) {
          matrix.add(new Series(ts.labels(), points));
          kept = true;
        }
      } finally {
        if (!kept) {
          points.release();
        }
      }
    }
  }

  /**
   * Merged series whose strategy evaluates by backend order are sampled per
   * backend, everything else through its own iterator.
   */
  private Sampler sampler(final TimeSeries ts, final SeriesSampler single) {
    if (ts instanceof MergedTimeSeries
        && ((MergedTimeSeries) ts).strategy().byBackendOrder()) {
      final List<TimeSeries> sources = ((MergedTimeSeries) ts).sources();
      final SeriesSampler[] samplers = new SeriesSampler[sources.size()];
      for (int i = 0; i < samplers.length; i++) {
        samplers[i] = new SeriesSampler(
            new BufferedTimeSeriesIterator(lookback_delta));
        samplers[i].reset(sources.get(i));
      }
      return new BackendOrderSampler(samplers);
    }
    single.reset(ts);
    return single;
  }

  /**
   * Finds the sample to use for time T.
   * @param it The iterator of the series.
   * @param t The grid time in seconds.
   * @return The sample or null if there is none within the window.
   */
  Point sample(final BufferedTimeSeriesIterator it, final long t) {
    boolean ok = it.seek(t);
    if (!ok && it.error() != null) {
      final Exception e = it.error();
      if (e instanceof RuntimeException) {
        throw (RuntimeException) e;
      }
      throw new QueryExecutionException("Failed to read series: "
          + e.getMessage(), 500, e);
    }

    Point point = ok ? it.values() : null;
    if (!ok || point.timestamp() > t) {
      point = it.peekBack(1);
      if (point == null || point.timestamp() < t - lookback_delta) {
        return null;
      }
    }
    if (point.isStale()) {
      return null;
    }
    return point;
  }

  /** @return The number of points recorded so far. */
  public int currentSamples() {
    return current_samples;
  }

  /** Yields the value of one series at ascending grid times. */
  interface Sampler {
    /**
     * @param t The grid time in seconds, not less than the previous one.
     * @return The sample or null if there is none within the window.
     */
    Point sample(long t);

    /**
     * Only valid right after {@link #sample(long)} returned null.
     * @param t The time last sampled.
     * @return The earliest time a sample may appear, at most t if unknown,
     * {@link Long#MAX_VALUE} if none ever will.
     */
    long next(long t);
  }

  /** Samples a single series. */
  class SeriesSampler implements Sampler {
    private final BufferedTimeSeriesIterator it;

    SeriesSampler(final BufferedTimeSeriesIterator it) {
      this.it = it;
    }

    void reset(final TimeSeries ts) {
      it.reset(ts.iterator());
    }

    @Override
    public Point sample(final long t) {
      return Evaluator.this.sample(it, t);
    }

    @Override
    public long next(final long t) {
      if (it.exhausted()) {
        return Long.MAX_VALUE;
      }
      return it.timestamp();
    }
  }

  /**
   * Takes the first backend, in configured order, with a usable sample at
   * each time.
   */
  class BackendOrderSampler implements Sampler {
    private final SeriesSampler[] samplers;

    BackendOrderSampler(final SeriesSampler[] samplers) {
      this.samplers = samplers;
    }

    @Override
    public Point sample(final long t) {
      for (final SeriesSampler sampler : samplers) {
        final Point point = sampler.sample(t);
        if (point != null) {
          return point;
        }
      }
      return null;
    }

    @Override
    public long next(final long t) {
      long next = Long.MAX_VALUE;
      for (final SeriesSampler sampler : samplers) {
        next = Math.min(next, sampler.next(t));
      }
      return next;
    }
  }
}
