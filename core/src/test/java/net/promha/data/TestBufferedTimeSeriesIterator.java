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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.Test;

import com.google.common.collect.Lists;

public class TestBufferedTimeSeriesIterator {
  private static final Labels LABELS = Labels.of("__name__", "up");

  private static ConcreteTimeSeries series(final long... timestamps) {
    final List<Point> points = Lists.newArrayList();
    for (final long ts : timestamps) {
      points.add(new Point(ts, ts / 10));
    }
    return new ConcreteTimeSeries(LABELS, points);
  }

  @Test
  public void seekExact() throws Exception {
    final BufferedTimeSeriesIterator it = new BufferedTimeSeriesIterator(
        series(10, 20, 30, 40).iterator(), 300);
    assertTrue(it.seek(20));
    assertEquals(20, it.timestamp());
    assertEquals(2, it.value(), 0.0001);
    assertEquals(new Point(20, 2), it.values());
    assertEquals(new Point(10, 1), it.peekBack(1));
    assertNull(it.peekBack(2));
  }

  @Test
  public void seekBetween() throws Exception {
    final BufferedTimeSeriesIterator it = new BufferedTimeSeriesIterator(
        series(10, 20, 30, 40).iterator(), 300);
    assertTrue(it.seek(25));
    assertEquals(30, it.timestamp());
    // the latest sample before the target.
    assertEquals(new Point(20, 2), it.peekBack(1));
    assertEquals(new Point(10, 1), it.peekBack(2));
  }

  @Test
  public void seekPastEnd() throws Exception {
    final BufferedTimeSeriesIterator it = new BufferedTimeSeriesIterator(
        series(10, 20, 30, 40).iterator(), 300);
    assertFalse(it.seek(100));
    assertEquals(new Point(40, 4), it.peekBack(1));
  }

  @Test
  public void lookbackWindow() throws Exception {
    final BufferedTimeSeriesIterator it = new BufferedTimeSeriesIterator(
        series(1000, 2000).iterator(), 300);
    // nothing within 300s before 1400.
    assertTrue(it.seek(1400));
    assertEquals(2000, it.timestamp());
    assertNull(it.peekBack(1));

    final BufferedTimeSeriesIterator it2 = new BufferedTimeSeriesIterator(
        series(1000, 2000).iterator(), 300);
    assertTrue(it2.seek(1300));
    assertEquals(new Point(1000, 100), it2.peekBack(1));
  }

  @Test
  public void ascendingSeeksWalkForward() throws Exception {
    final BufferedTimeSeriesIterator it = new BufferedTimeSeriesIterator(
        series(0, 60, 120, 180, 240).iterator(), 300);
    assertTrue(it.seek(0));
    assertEquals(0, it.timestamp());
    assertTrue(it.seek(90));
    assertEquals(120, it.timestamp());
    assertEquals(new Point(60, 6), it.peekBack(1));
    assertTrue(it.seek(180));
    assertEquals(180, it.timestamp());
    assertEquals(new Point(120, 12), it.peekBack(1));
    assertFalse(it.seek(300));
    assertEquals(new Point(240, 24), it.peekBack(1));
  }

  @Test
  public void seekBackwardsRescans() throws Exception {
    final BufferedTimeSeriesIterator it = new BufferedTimeSeriesIterator(
        series(0, 60, 120, 180, 240).iterator(), 300);
    assertTrue(it.seek(200));
    assertEquals(240, it.timestamp());
    assertEquals(new Point(180, 18), it.peekBack(1));

    assertTrue(it.seek(70));
    assertEquals(120, it.timestamp());
    assertEquals(new Point(60, 6), it.peekBack(1));
    assertEquals(new Point(0, 0), it.peekBack(2));
  }

  @Test
  public void reset() throws Exception {
    final BufferedTimeSeriesIterator it = new BufferedTimeSeriesIterator(300);
    it.reset(series(10, 20).iterator());
    assertTrue(it.seek(15));
    assertEquals(new Point(10, 1), it.peekBack(1));

    it.reset(series(500, 600).iterator());
    assertNull(it.peekBack(1));
    assertTrue(it.seek(550));
    assertEquals(600, it.timestamp());
    assertEquals(new Point(500, 50), it.peekBack(1));
  }

  @Test
  public void error() throws Exception {
    final TimeSeriesIterator source = mock(TimeSeriesIterator.class);
    final Exception ex = new IllegalStateException("Boo!");
    when(source.seek(700)).thenReturn(false);
    when(source.error()).thenReturn(ex);
    final BufferedTimeSeriesIterator it =
        new BufferedTimeSeriesIterator(source, 300);
    assertFalse(it.seek(1000));
    assertSame(ex, it.error());
    assertFalse(it.next());
  }
}
