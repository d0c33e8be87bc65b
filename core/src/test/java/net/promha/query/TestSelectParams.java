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
package net.promha.query;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class TestSelectParams {

  @Test
  public void instant() throws Exception {
    final SelectParams params = SelectParams.instant("up", 1000);
    assertEquals("up", params.query());
    assertEquals(1000, params.start());
    assertEquals(1000, params.end());
    assertEquals(0, params.step());
    assertTrue(params.isInstant());
  }

  @Test
  public void range() throws Exception {
    final SelectParams params = SelectParams.newBuilder()
        .setQuery("rate(http_requests_total[5m])")
        .setStart(1000)
        .setEnd(2000)
        .setStep(15)
        .build();
    assertFalse(params.isInstant());
    assertEquals(15, params.step());
    assertEquals(params, SelectParams.newBuilder()
        .setQuery("rate(http_requests_total[5m])")
        .setStart(1000)
        .setEnd(2000)
        .setStep(15)
        .build());
    assertNotEquals(params, SelectParams.instant("up", 1000));
  }

  @Test
  public void validation() throws Exception {
    try {
      SelectParams.instant(null, 1000);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      SelectParams.instant("", 1000);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      SelectParams.newBuilder()
          .setQuery("up")
          .setStart(2000)
          .setEnd(1000)
          .setStep(15)
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      SelectParams.newBuilder()
          .setQuery("up")
          .setStart(1000)
          .setEnd(2000)
          .setStep(-1)
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    // no step means instant, which needs a single time.
    try {
      SelectParams.newBuilder()
          .setQuery("up")
          .setStart(1000)
          .setEnd(2000)
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
