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

import static net.promha.query.MockQueryable.series;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.Lists;

import net.promha.data.BufferedTimeSeriesIterator;
import net.promha.data.ConcreteTimeSeries;
import net.promha.data.Labels;
import net.promha.data.Point;
import net.promha.data.TimeSeries;
import net.promha.exceptions.QueryExecutionCanceled;
import net.promha.exceptions.QueryPhase;
import net.promha.exceptions.TooManySamplesException;
import net.promha.pools.PointArrayPool;
import net.promha.query.QueryContext;
import net.promha.query.merge.MergedTimeSeries;
import net.promha.query.merge.PriorityMergeStrategy;
import net.promha.query.value.Matrix;
import net.promha.query.value.Series;
import net.promha.stats.BlackholeStatsCollector;

public class TestEvaluator {
  private static final Labels UP_A = Labels.of("__name__", "up", "job", "a");
  private static final Labels UP_B = Labels.of("__name__", "up", "job", "b");

  private PointArrayPool pool;
  private QueryContext context;

  @Before
  public void before() throws Exception {
    pool = new PointArrayPool(4, 16, new BlackholeStatsCollector());
    context = new QueryContext();
  }

  @Test
  public void ctor() throws Exception {
    try {
      new Evaluator(context, 0, 100, 0, 300, 100, pool);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new Evaluator(context, 100, 0, 10, 300, 100, pool);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new Evaluator(context, Long.MIN_VALUE, 1, 10, 300, 100, pool);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new Evaluator(context, 0, Long.MAX_VALUE, 1, 300, 100, pool);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void lookbackBoundary() throws Exception {
    final TimeSeries ts = series(UP_A, 1000, 42);
    final Evaluator evaluator = new Evaluator(context, 0, 0, 1, 300, 100, pool);
    final BufferedTimeSeriesIterator it = new BufferedTimeSeriesIterator(300);

    it.reset(ts.iterator());
    assertEquals(new Point(1000, 42), evaluator.sample(it, 1000));
    it.reset(ts.iterator());
    assertEquals(new Point(1000, 42), evaluator.sample(it, 1300));
    it.reset(ts.iterator());
    assertNull(evaluator.sample(it, 1301));
    it.reset(ts.iterator());
    assertNull(evaluator.sample(it, 999));
  }

  @Test
  public void staleMarkerHidesValue() throws Exception {
    final TimeSeries ts = series(UP_A, 900, 1, 1000, Point.STALE_NAN);
    final Evaluator evaluator = new Evaluator(context, 0, 0, 1, 300, 100, pool);
    final BufferedTimeSeriesIterator it = new BufferedTimeSeriesIterator(300);
    it.reset(ts.iterator());
    assertEquals(new Point(900, 1), evaluator.sample(it, 950));
    assertNull(evaluator.sample(it, 1000));
    assertNull(evaluator.sample(it, 1100));
  }

  @Test
  public void regularNaNIsAValue() throws Exception {
    final TimeSeries ts = series(UP_A, 1000, Double.NaN);
    final Evaluator evaluator = new Evaluator(context, 0, 0, 1, 300, 100, pool);
    final BufferedTimeSeriesIterator it = new BufferedTimeSeriesIterator(300);
    it.reset(ts.iterator());
    final Point point = evaluator.sample(it, 1010);
    assertTrue(Double.isNaN(point.value()));
    assertEquals(1000, point.timestamp());
  }

  @Test
  public void evalGrid() throws Exception {
    final List<TimeSeries> series = Lists.<TimeSeries>newArrayList(
        series(UP_A, 0, 1, 60, 2, 120, 3),
        // only one sample, visible at 60 and 120 via lookback.
        series(UP_B, 30, 7));
    final Evaluator evaluator = new Evaluator(context, 0, 120, 60, 300, 100,
        pool);
    final Matrix matrix = new Matrix();
    try {
      evaluator.eval(series, matrix);
      assertEquals(2, matrix.size());
      assertEquals(5, evaluator.currentSamples());
      assertEquals(5, matrix.totalSamples());

      final Series a = matrix.series().get(0);
      assertEquals(UP_A, a.metric());
      assertEquals(Lists.newArrayList(new Point(0, 1), new Point(60, 2),
          new Point(120, 3)), a.points());

      final Series b = matrix.series().get(1);
      assertEquals(Lists.newArrayList(new Point(60, 7), new Point(120, 7)),
          b.points());
    } finally {
      matrix.release();
    }
    assertEquals(4, pool.available());
  }

  @Test
  public void emptySeriesNotAdded() throws Exception {
    final List<TimeSeries> series = Lists.<TimeSeries>newArrayList(
        series(UP_A, 5000, 1));
    final Evaluator evaluator = new Evaluator(context, 0, 120, 60, 300, 100,
        pool);
    final Matrix matrix = new Matrix();
    evaluator.eval(series, matrix);
    assertEquals(0, matrix.size());
    assertEquals(4, pool.available());
  }

  @Test
  public void budgetExact() throws Exception {
    final List<TimeSeries> series = Lists.<TimeSeries>newArrayList(
        series(UP_A, 0, 1, 60, 2, 120, 3));
    final Evaluator evaluator = new Evaluator(context, 0, 120, 60, 300, 3,
        pool);
    final Matrix matrix = new Matrix();
    evaluator.eval(series, matrix);
    assertEquals(3, matrix.totalSamples());
    matrix.release();
  }

  @Test
  public void budgetExceeded() throws Exception {
    final List<TimeSeries> series = Lists.<TimeSeries>newArrayList(
        series(UP_A, 0, 1, 60, 2),
        series(UP_B, 0, 1, 60, 2));
    final Evaluator evaluator = new Evaluator(context, 0, 60, 60, 300, 3,
        pool);
    final Matrix matrix = new Matrix();
    try {
      evaluator.eval(series, matrix);
      fail("Expected TooManySamplesException");
    } catch (TooManySamplesException e) {
      assertEquals(422, e.getStatusCode());
      assertEquals(3, e.getMaxSamples());
      assertTrue(e.getMessage().contains("query execution"));
    }
    assertEquals(3, evaluator.currentSamples());
    // the partial series was released, the caller releases the rest.
    assertEquals(3, pool.available());
    matrix.release();
    assertEquals(4, pool.available());
  }

  @Test
  public void wideGridSmallBudget() throws Exception {
    final List<TimeSeries> series = Lists.<TimeSeries>newArrayList(
        series(UP_A, 0, 1));
    final Evaluator evaluator = new Evaluator(context, 0, 4_000_000_000L, 2,
        300, 1000, pool);
    final Matrix matrix = new Matrix();
    try {
      evaluator.eval(series, matrix);
      assertEquals(1, matrix.size());
      // visible from 0 through 300 only.
      assertEquals(151, matrix.totalSamples());
      final List<Point> points = matrix.series().get(0).points();
      assertEquals(new Point(0, 1), points.get(0));
      assertEquals(new Point(300, 1), points.get(150));
    } finally {
      matrix.release();
    }
    assertEquals(4, pool.available());
  }

  @Test
  public void wideGridBudgetExceeded() throws Exception {
    final List<TimeSeries> series = Lists.<TimeSeries>newArrayList(
        series(UP_A, 0, 1));
    final Evaluator evaluator = new Evaluator(context, 0, 4_000_000_000L, 2,
        300, 10, pool);
    final Matrix matrix = new Matrix();
    try {
      evaluator.eval(series, matrix);
      fail("Expected TooManySamplesException");
    } catch (TooManySamplesException e) {
      assertEquals(10, e.getMaxSamples());
    }
    assertEquals(0, matrix.size());
    assertEquals(4, pool.available());
  }

  @Test
  public void sparseSeriesSkipsGaps() throws Exception {
    final List<TimeSeries> series = Lists.<TimeSeries>newArrayList(
        series(UP_A, 0, 1, 10000, 2, 10001, Point.STALE_NAN, 10500, 3));
    final Evaluator evaluator = new Evaluator(context, 0, 20000, 1, 300,
        1000, pool);
    final Matrix matrix = new Matrix();
    try {
      evaluator.eval(series, matrix);
      final List<Point> points = matrix.series().get(0).points();
      assertEquals(301 + 1 + 301, points.size());
      assertEquals(new Point(300, 1), points.get(300));
      assertEquals(new Point(10000, 2), points.get(301));
      assertEquals(new Point(10500, 3), points.get(302));
      assertEquals(new Point(10800, 3), points.get(602));
    } finally {
      matrix.release();
    }
  }

  @Test
  public void gridEndingNearMaxTimestamp() throws Exception {
    final long last = Long.MAX_VALUE - 1000;
    final List<TimeSeries> series = Lists.<TimeSeries>newArrayList(
        new ConcreteTimeSeries(UP_A, Lists.newArrayList(new Point(last, 5))));
    final Evaluator evaluator = new Evaluator(context, last,
        Long.MAX_VALUE - 1, 600, 600, 100, pool);
    final Matrix matrix = new Matrix();
    try {
      evaluator.eval(series, matrix);
      assertEquals(Lists.newArrayList(new Point(last, 5),
          new Point(last + 600, 5)), matrix.series().get(0).points());
    } finally {
      matrix.release();
    }
  }

  @Test
  public void mergedByBackendOrder() throws Exception {
    final List<TimeSeries> series = Lists.<TimeSeries>newArrayList(
        new MergedTimeSeries(UP_A, Lists.<TimeSeries>newArrayList(
            series(UP_A, 0, 1, 120, Point.STALE_NAN, 5040, 3),
            series(UP_A, 30, 2, 60, 2, 180, 2)),
            new PriorityMergeStrategy()));
    final Evaluator evaluator = new Evaluator(context, 0, 5040, 60, 300, 100,
        pool);
    final Matrix matrix = new Matrix();
    try {
      evaluator.eval(series, matrix);
      // the second backend only covers the stale marker of the first.
      assertEquals(Lists.newArrayList(new Point(0, 1), new Point(60, 1),
          new Point(120, 2), new Point(180, 2), new Point(240, 2),
          new Point(300, 2), new Point(360, 2), new Point(420, 2),
          new Point(480, 2), new Point(5040, 3)),
          matrix.series().get(0).points());
    } finally {
      matrix.release();
    }
    assertEquals(4, pool.available());
  }

  @Test
  public void canceled() throws Exception {
    context.cancel();
    final Evaluator evaluator = new Evaluator(context, 0, 60, 60, 300, 100,
        pool);
    final Matrix matrix = new Matrix();
    try {
      evaluator.eval(Lists.<TimeSeries>newArrayList(series(UP_A, 0, 1)),
          matrix);
      fail("Expected QueryExecutionCanceled");
    } catch (QueryExecutionCanceled e) {
      assertEquals(QueryPhase.EVALUATION, e.getPhase());
      assertEquals("query was canceled in expression evaluation",
          e.getMessage());
    }
    assertEquals(0, matrix.size());
    assertEquals(4, pool.available());
  }
}
