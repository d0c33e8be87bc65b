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

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class TestLabelValidator {

  @Test
  public void metricNames() throws Exception {
    assertTrue(LabelValidator.isValidMetricName("up"));
    assertTrue(LabelValidator.isValidMetricName("node:cpu_seconds:rate5m"));
    assertTrue(LabelValidator.isValidMetricName("_hidden"));
    assertFalse(LabelValidator.isValidMetricName("1up"));
    assertFalse(LabelValidator.isValidMetricName("sys.cpu"));
    assertFalse(LabelValidator.isValidMetricName(""));
    assertFalse(LabelValidator.isValidMetricName(null));
  }

  @Test
  public void labelNames() throws Exception {
    assertTrue(LabelValidator.isValidLabelName("instance"));
    assertTrue(LabelValidator.isValidLabelName("__name__"));
    assertFalse(LabelValidator.isValidLabelName("has:colon"));
    assertFalse(LabelValidator.isValidLabelName("0day"));
    assertFalse(LabelValidator.isValidLabelName(""));
  }

  @Test
  public void labelValues() throws Exception {
    assertTrue(LabelValidator.isValidLabelValue(""));
    assertTrue(LabelValidator.isValidLabelValue("héllo 世界"));
    assertFalse(LabelValidator.isValidLabelValue("bad\ud800"));
    assertFalse(LabelValidator.isValidLabelValue(null));
  }

  @Test
  public void validate() throws Exception {
    LabelValidator.validate(Labels.of("__name__", "up", "job", "node"));
    LabelValidator.validate(Labels.EMPTY);

    try {
      LabelValidator.validate(Labels.of("__name__", "sys.cpu"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      LabelValidator.validate(Labels.of("__name__", "up", "bad-name", "v"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      LabelValidator.validate(Labels.of("__name__", "up", "job", "\udc00"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
