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

import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.promha.data.Point;
import net.promha.data.TimeSeries;
import net.promha.data.TimeSeriesSet;
import net.promha.exceptions.QueryExecutionCanceled;
import net.promha.exceptions.QueryExecutionException;
import net.promha.exceptions.QueryPhase;
import net.promha.exceptions.QueryTimeoutException;
import net.promha.exceptions.TooManySamplesException;
import net.promha.query.Querier;
import net.promha.query.QueryContext;
import net.promha.query.Queryable;
import net.promha.query.SelectParams;
import net.promha.query.value.Matrix;
import net.promha.query.value.Result;
import net.promha.query.value.Sample;
import net.promha.query.value.Series;
import net.promha.query.value.Vector;
import net.promha.utils.DateTime;

/**
 * The {@link Query} implementation. {@link #exec()} is the single place
 * where failures of any stage are turned into an error {@link Result}.
 *
 * @since 1.0
 */
public class EngineQuery implements Query {
  private static final Logger LOG = LoggerFactory.getLogger(EngineQuery.class);

  private final QueryEngine engine;
  private final Queryable queryable;
  private final SelectParams params;
  private final QueryContext context;
  private final AtomicBoolean executed;
  private final AtomicBoolean closed;

  private volatile QueryState state;

  /** The sampled series, kept until close. */
  private Matrix matrix;

  /**
   * Default ctor.
   * @param engine The non-null engine.
   * @param queryable The non-null source of series.
   * @param params The non-null parameters.
   * @param context The non-null query context.
   */
  EngineQuery(final QueryEngine engine,
              final Queryable queryable,
              final SelectParams params,
              final QueryContext context) {
    this.engine = engine;
    this.queryable = queryable;
    this.params = params;
    this.context = context;
    executed = new AtomicBoolean();
    closed = new AtomicBoolean();
    state = QueryState.QUEUED;
  }

  @Override
  public Result exec() {
    if (!executed.compareAndSet(false, true)) {
      throw new IllegalStateException("Query was already executed: " + params);
    }
    final long start = DateTime.nanoTime();
    boolean admitted = false;
    Querier querier = null;
    try {
      engine.gate().start(context).join();
      admitted = true;
      state = QueryState.ADMITTED;
      engine.stats().addTime("query.gate.wait",
          (long) DateTime.msFromNanoDiff(DateTime.nanoTime(), start),
          ChronoUnit.MILLIS);

      state = QueryState.FETCHING;
      querier = queryable.querier(context);
      final List<TimeSeries> series = expand(
          await(querier.select(params), QueryPhase.EVALUATION));

      state = QueryState.SAMPLING;
      matrix = new Matrix();
      final long interval = params.isInstant() ? 1 : params.step();
      final Evaluator evaluator = new Evaluator(context,
          params.start(),
          params.end(),
          interval,
          engine.config().getLookbackDelta(),
          engine.config().getMaxSamples(),
          engine.pool());
      evaluator.eval(series, matrix);
      context.check(QueryPhase.EVALUATION);

      final Result result;
      if (params.isInstant()) {
        // pin to the evaluation time, the sample may be older.
        final Vector vector = new Vector();
        for (final Series s : matrix) {
          vector.add(new Sample(s.metric(),
              new Point(params.start(), s.pooledPoints().value(0))));
        }
        result = Result.ofValue(vector);
      } else {
        matrix.sort();
        result = Result.ofValue(matrix);
      }
      state = QueryState.DONE;
      engine.stats().incrementCounter("query.success");
      if (LOG.isDebugEnabled()) {
        LOG.debug("Finished query [" + params + "] with "
            + evaluator.currentSamples() + " samples in "
            + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms");
      }
      return result;
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      state = QueryState.FAILED;
      if (matrix != null) {
        final Matrix partial = matrix;
        matrix = null;
        partial.release();
      }
      countFailure(e);
      return Result.ofError(e);
    } finally {
      if (admitted) {
        engine.gate().done();
      }
      if (querier != null) {
        querier.close();
      }
      context.close();
    }
  }

  @Override
  public void cancel() {
    context.cancel();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      throw new IllegalStateException("Query was already closed: " + params);
    }
    if (matrix != null) {
      final Matrix to_release = matrix;
      matrix = null;
      to_release.release();
    }
  }

  @Override
  public QueryState state() {
    return state;
  }

  @Override
  public SelectParams params() {
    return params;
  }

  /** @return The query context. */
  public QueryContext context() {
    return context;
  }

  @Override
  public String toString() {
    return "EngineQuery{" + params + ", state=" + state + "}";
  }

  /**
   * Waits for the deferred or the query context, whichever comes first.
   * @param deferred The deferred to wait on.
   * @param phase The phase used to describe a timeout or cancellation.
   * @return The value of the deferred.
   * @throws Exception the exception of the deferred or the context.
   */
  <T> T await(final Deferred<T> deferred, final QueryPhase phase)
      throws Exception {
    final AtomicBoolean fired = new AtomicBoolean();
    final Deferred<Object> waiter = new Deferred<Object>();
    final Runnable listener = new Runnable() {
      @Override
      public void run() {
        if (fired.compareAndSet(false, true)) {
          waiter.callback(context.exception(phase));
        }
      }
    };

    class ResultCB implements Callback<Object, T> {
      @Override
      public Object call(final T result) throws Exception {
        if (fired.compareAndSet(false, true)) {
          waiter.callback(result);
        }
        return result;
      }
    }

    class ErrorCB implements Callback<Object, Exception> {
      @Override
      public Object call(final Exception e) throws Exception {
        if (fired.compareAndSet(false, true)) {
          waiter.callback(e);
        }
        return e;
      }
    }

    deferred.addCallbacks(new ResultCB(), new ErrorCB());
    context.addListener(listener);
    try {
      @SuppressWarnings("unchecked")
      final T result = (T) waiter.join();
      return result;
    } finally {
      context.removeListener(listener);
    }
  }

  private static List<TimeSeries> expand(final TimeSeriesSet set)
      throws Exception {
    final List<TimeSeries> series = Lists.newArrayList();
    while (set.next()) {
      series.add(set.at());
    }
    if (set.error() != null) {
      throw set.error();
    }
    return series;
  }

  private void countFailure(final Exception e) {
    if (e instanceof QueryTimeoutException) {
      engine.stats().incrementCounter("query.timeout",
          "phase", ((QueryTimeoutException) e).getPhase().name());
    } else if (e instanceof QueryExecutionCanceled) {
      engine.stats().incrementCounter("query.canceled",
          "phase", ((QueryExecutionCanceled) e).getPhase().name());
    } else if (e instanceof TooManySamplesException) {
      engine.stats().incrementCounter("query.samples.exceeded");
    } else {
      engine.stats().incrementCounter("query.failed");
    }
    if (e instanceof QueryExecutionException) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Query [" + params + "] failed: " + e.getMessage());
      }
    } else {
      LOG.warn("Unexpected exception executing query [" + params + "]", e);
    }
  }
}
