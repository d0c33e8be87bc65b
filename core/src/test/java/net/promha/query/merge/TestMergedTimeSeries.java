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

import static net.promha.query.MockQueryable.series;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.Lists;

import net.promha.data.Labels;
import net.promha.data.Point;
import net.promha.data.TimeSeries;
import net.promha.data.TimeSeriesIterator;

public class TestMergedTimeSeries {
  private static final Labels LABELS = Labels.of("__name__", "up", "job", "api");

  @Test
  public void ctor() throws Exception {
    final List<TimeSeries> sources = Lists.<TimeSeries>newArrayList(
        series(LABELS, 0, 1));
    try {
      new MergedTimeSeries(null, sources, new PriorityMergeStrategy());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new MergedTimeSeries(LABELS, Collections.<TimeSeries>emptyList(),
          new PriorityMergeStrategy());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new MergedTimeSeries(LABELS, sources, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    final MergedTimeSeries merged = new MergedTimeSeries(LABELS, sources,
        new PriorityMergeStrategy());
    assertEquals(LABELS, merged.labels());
    assertEquals(1, merged.sourceCount());
  }

  @Test
  public void fillsGapsFromOtherBackend() throws Exception {
    // the first backend missed the scrape at 60.
    final MergedTimeSeries merged = new MergedTimeSeries(LABELS,
        Lists.<TimeSeries>newArrayList(
            series(LABELS, 0, 1, 120, 3),
            series(LABELS, 0, 10, 60, 20, 120, 30)),
        new PriorityMergeStrategy());
    final TimeSeriesIterator it = merged.iterator();
    assertTrue(it.next());
    assertEquals(0, it.timestamp());
    assertEquals(1, it.value(), 0.0001);
    assertTrue(it.next());
    assertEquals(60, it.timestamp());
    assertEquals(20, it.value(), 0.0001);
    assertTrue(it.next());
    assertEquals(120, it.timestamp());
    assertEquals(3, it.value(), 0.0001);
    assertFalse(it.next());
    assertFalse(it.next());
    assertNull(it.error());
  }

  @Test
  public void seek() throws Exception {
    final MergedTimeSeries merged = new MergedTimeSeries(LABELS,
        Lists.<TimeSeries>newArrayList(
            series(LABELS, 0, 1, 120, 3),
            series(LABELS, 30, 10, 60, 20)),
        new PriorityMergeStrategy());
    final TimeSeriesIterator it = merged.iterator();
    assertTrue(it.seek(50));
    assertEquals(60, it.timestamp());
    assertEquals(20, it.value(), 0.0001);
    assertTrue(it.next());
    assertEquals(120, it.timestamp());

    // back again.
    assertTrue(it.seek(0));
    assertEquals(0, it.timestamp());
    assertTrue(it.next());
    assertEquals(30, it.timestamp());
    assertEquals(10, it.value(), 0.0001);

    assertFalse(it.seek(121));
    assertFalse(it.next());
  }

  @Test
  public void staleInPrimaryFallsBack() throws Exception {
    final MergedTimeSeries merged = new MergedTimeSeries(LABELS,
        Lists.<TimeSeries>newArrayList(
            series(LABELS, 60, Point.STALE_NAN),
            series(LABELS, 60, 42)),
        new PriorityMergeStrategy());
    final TimeSeriesIterator it = merged.iterator();
    assertTrue(it.next());
    assertEquals(42, it.value(), 0.0001);

    final MergedTimeSeries strict = new MergedTimeSeries(LABELS,
        Lists.<TimeSeries>newArrayList(
            series(LABELS, 60, Point.STALE_NAN),
            series(LABELS, 60, 42)),
        new StrictMergeStrategy());
    final TimeSeriesIterator it2 = strict.iterator();
    assertTrue(it2.next());
    assertTrue(Point.isStaleNaN(it2.value()));
  }

  @Test
  public void largest() throws Exception {
    final MergedTimeSeries merged = new MergedTimeSeries(LABELS,
        Lists.<TimeSeries>newArrayList(
            series(LABELS, 60, 5, 120, 9),
            series(LABELS, 60, 7, 120, 8)),
        new LargestMergeStrategy());
    final TimeSeriesIterator it = merged.iterator();
    assertTrue(it.next());
    assertEquals(7, it.value(), 0.0001);
    assertTrue(it.next());
    assertEquals(9, it.value(), 0.0001);
  }

  @Test
  public void error() throws Exception {
    final Exception ex = new IllegalStateException("Boo!");
    final TimeSeriesIterator failing = mock(TimeSeriesIterator.class);
    when(failing.error()).thenReturn(ex);
    final TimeSeries source = mock(TimeSeries.class);
    when(source.labels()).thenReturn(LABELS);
    when(source.iterator()).thenReturn(failing);

    final MergedTimeSeries merged = new MergedTimeSeries(LABELS,
        Lists.<TimeSeries>newArrayList(series(LABELS, 0, 1), source),
        new PriorityMergeStrategy());
    final TimeSeriesIterator it = merged.iterator();
    assertTrue(it.next());
    assertEquals(1, it.value(), 0.0001);
    assertSame(ex, it.error());
  }
}
