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

import net.promha.data.Point;

/**
 * At each evaluation time, takes the sample of the first backend in
 * configured order that has a non-stale sample within the lookback window.
 * Later backends only fill gaps and stale markers of earlier ones, even when
 * their samples are newer. This is the default.
 * <p>
 * Samples at the same timestamp merge to the first non-stale one. The
 * result is stale only if every candidate is stale.
 *
 * @since 1.0
 */
public class PriorityMergeStrategy implements SampleMergeStrategy {
  public static final String NAME = "priority";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public double merge(final double[] candidates, final int count) {
    for (int i = 0; i < count; i++) {
      if (!Point.isStaleNaN(candidates[i])) {
        return candidates[i];
      }
    }
    return candidates[0];
  }

  @Override
  public boolean byBackendOrder() {
    return true;
  }
}
