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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.promha.data.Point;

public class TestMergeStrategies {

  @Test
  public void forName() throws Exception {
    assertTrue(MergeStrategies.forName(null) instanceof PriorityMergeStrategy);
    assertTrue(MergeStrategies.forName("") instanceof PriorityMergeStrategy);
    assertTrue(MergeStrategies.forName("priority") instanceof PriorityMergeStrategy);
    assertTrue(MergeStrategies.forName("STRICT") instanceof StrictMergeStrategy);
    assertTrue(MergeStrategies.forName("largest") instanceof LargestMergeStrategy);
    assertTrue(MergeStrategies.forName("newest") instanceof NewestMergeStrategy);
    assertEquals(4, MergeStrategies.names().size());
    try {
      MergeStrategies.forName("smallest");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void priority() throws Exception {
    final SampleMergeStrategy strategy = new PriorityMergeStrategy();
    assertEquals("priority", strategy.name());
    assertTrue(strategy.byBackendOrder());
    assertEquals(1, strategy.merge(new double[] { 1, 2 }, 2), 0.0001);
    assertEquals(2, strategy.merge(
        new double[] { Point.STALE_NAN, 2 }, 2), 0.0001);
    // a regular NaN is a value.
    assertTrue(Double.isNaN(strategy.merge(
        new double[] { Double.NaN, 2 }, 2)));
    assertTrue(Point.isStaleNaN(strategy.merge(
        new double[] { Point.STALE_NAN, Point.STALE_NAN }, 2)));
    // only count entries are considered.
    assertTrue(Point.isStaleNaN(strategy.merge(
        new double[] { Point.STALE_NAN, 42 }, 1)));
  }

  @Test
  public void newest() throws Exception {
    final SampleMergeStrategy strategy = new NewestMergeStrategy();
    assertEquals("newest", strategy.name());
    assertFalse(strategy.byBackendOrder());
    assertEquals(2, strategy.merge(
        new double[] { Point.STALE_NAN, 2 }, 2), 0.0001);
  }

  @Test
  public void strict() throws Exception {
    final SampleMergeStrategy strategy = new StrictMergeStrategy();
    assertEquals("strict", strategy.name());
    assertFalse(strategy.byBackendOrder());
    assertEquals(1, strategy.merge(new double[] { 1, 2 }, 2), 0.0001);
    assertTrue(Point.isStaleNaN(strategy.merge(
        new double[] { Point.STALE_NAN, 2 }, 2)));
  }

  @Test
  public void largest() throws Exception {
    final SampleMergeStrategy strategy = new LargestMergeStrategy();
    assertEquals("largest", strategy.name());
    assertFalse(strategy.byBackendOrder());
    assertEquals(5, strategy.merge(new double[] { 1, 5, 3 }, 3), 0.0001);
    assertEquals(3, strategy.merge(
        new double[] { Point.STALE_NAN, 3 }, 2), 0.0001);
    assertEquals(3, strategy.merge(new double[] { Double.NaN, 3 }, 2), 0.0001);
    assertEquals(3, strategy.merge(new double[] { 3, Double.NaN }, 2), 0.0001);
    assertEquals(Double.POSITIVE_INFINITY, strategy.merge(
        new double[] { 3, Double.POSITIVE_INFINITY }, 2), 0.0001);
    assertTrue(Point.isStaleNaN(strategy.merge(
        new double[] { Point.STALE_NAN, Point.STALE_NAN }, 2)));
  }
}
