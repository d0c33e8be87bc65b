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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.Lists;

public class TestConcreteTimeSeries {
  private static final Labels LABELS = Labels.of("__name__", "up", "job", "api");

  @Test
  public void iterate() throws Exception {
    final ConcreteTimeSeries series = new ConcreteTimeSeries(LABELS,
        Lists.newArrayList(new Point(10, 1), new Point(20, 2), new Point(30, 3)));
    assertEquals(LABELS, series.labels());
    assertEquals(3, series.size());

    final TimeSeriesIterator it = series.iterator();
    assertTrue(it.next());
    assertEquals(10, it.timestamp());
    assertEquals(1, it.value(), 0.0001);
    assertTrue(it.next());
    assertEquals(20, it.timestamp());
    assertTrue(it.next());
    assertEquals(30, it.timestamp());
    assertEquals(3, it.value(), 0.0001);
    assertFalse(it.next());
    assertFalse(it.next());
    assertNull(it.error());
  }

  @Test
  public void seek() throws Exception {
    final ConcreteTimeSeries series = new ConcreteTimeSeries(LABELS,
        Lists.newArrayList(new Point(10, 1), new Point(20, 2), new Point(30, 3)));
    final TimeSeriesIterator it = series.iterator();
    assertTrue(it.seek(20));
    assertEquals(20, it.timestamp());
    assertTrue(it.seek(21));
    assertEquals(30, it.timestamp());

    // seeks are absolute so going back works.
    assertTrue(it.seek(0));
    assertEquals(10, it.timestamp());
    assertTrue(it.next());
    assertEquals(20, it.timestamp());

    assertFalse(it.seek(31));
    assertFalse(it.next());
  }

  @Test
  public void empty() throws Exception {
    final ConcreteTimeSeries series = new ConcreteTimeSeries(LABELS,
        Collections.<Point>emptyList());
    assertEquals(0, series.size());
    assertFalse(series.iterator().next());
    assertFalse(series.iterator().seek(0));
  }

  @Test
  public void ctorValidation() throws Exception {
    try {
      new ConcreteTimeSeries(null, Collections.<Point>emptyList());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new ConcreteTimeSeries(LABELS, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    final List<Point> out_of_order = Lists.newArrayList(
        new Point(20, 1), new Point(10, 2));
    try {
      new ConcreteTimeSeries(LABELS, out_of_order);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    final List<Point> repeated = Lists.newArrayList(
        new Point(10, 1), new Point(10, 2));
    try {
      new ConcreteTimeSeries(LABELS, repeated);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void sets() throws Exception {
    final ConcreteTimeSeries series = new ConcreteTimeSeries(LABELS,
        Lists.newArrayList(new Point(10, 1)));
    final TimeSeriesSet set = new ConcreteTimeSeriesSet(
        Lists.newArrayList(series));
    assertTrue(set.next());
    assertEquals(LABELS, set.at().labels());
    assertFalse(set.next());
    assertNull(set.error());

    assertFalse(ConcreteTimeSeriesSet.empty().next());

    final Exception ex = new IllegalStateException("Boo!");
    final TimeSeriesSet error = new ErrorTimeSeriesSet(ex);
    assertFalse(error.next());
    assertEquals(ex, error.error());
    try {
      error.at();
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
  }
}
