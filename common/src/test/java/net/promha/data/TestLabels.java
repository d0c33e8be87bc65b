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
import static org.junit.Assert.fail;

import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;

public class TestLabels {

  @Test
  public void builderSorts() throws Exception {
    final Labels labels = Labels.newBuilder()
        .addLabel("job", "node")
        .addLabel("__name__", "up")
        .addLabel("instance", "host1:9100")
        .build();
    assertEquals(3, labels.size());
    assertEquals("__name__", labels.get(0).name());
    assertEquals("instance", labels.get(1).name());
    assertEquals("job", labels.get(2).name());
    assertEquals("up", labels.metricName());
    assertEquals("node", labels.value("job"));
    assertNull(labels.value("nope"));
    assertEquals("{__name__=\"up\", instance=\"host1:9100\", job=\"node\"}",
        labels.toString());
  }

  @Test
  public void duplicateNames() throws Exception {
    try {
      Labels.of("a", "1", "b", "2", "a", "3");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      Labels.of("a", "1", "b");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      Labels.of("a", null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void empty() throws Exception {
    assertSame(Labels.EMPTY, Labels.of());
    assertTrue(Labels.EMPTY.isEmpty());
    assertNull(Labels.EMPTY.metricName());
    assertEquals("{}", Labels.EMPTY.toString());
  }

  @Test
  public void equalsAndHash() throws Exception {
    final Labels a = Labels.of("job", "node", "__name__", "up");
    final Labels b = Labels.fromMap(ImmutableMap.of(
        "__name__", "up", "job", "node"));
    assertEquals(a, b);
    assertEquals(a.hash(), b.hash());
    assertEquals(a.hashCode(), b.hashCode());

    final Labels c = Labels.of("job", "node", "__name__", "down");
    assertFalse(a.equals(c));
    assertTrue(a.hash() != c.hash());

    // separator keeps name and value boundaries distinct.
    assertTrue(Labels.of("ab", "c").hash() != Labels.of("a", "bc").hash());
  }

  @Test
  public void compareTo() throws Exception {
    final Labels a = Labels.of("__name__", "up", "job", "a");
    final Labels b = Labels.of("__name__", "up", "job", "b");
    final Labels prefix = Labels.of("__name__", "up");
    final Labels name = Labels.of("__name__", "up", "instance", "z");

    assertTrue(a.compareTo(b) < 0);
    assertTrue(b.compareTo(a) > 0);
    assertEquals(0, a.compareTo(Labels.of("job", "a", "__name__", "up")));
    assertTrue(prefix.compareTo(a) < 0);
    assertTrue(a.compareTo(prefix) > 0);
    // name is compared before value.
    assertTrue(name.compareTo(a) < 0);
  }

  @Test
  public void toMap() throws Exception {
    final Map<String, String> map = Labels.of("b", "2", "a", "1").toMap();
    assertEquals(2, map.size());
    assertEquals("a", map.keySet().iterator().next());
    assertEquals("2", map.get("b"));
  }
}
