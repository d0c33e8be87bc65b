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
 * Takes the largest non-stale value. Useful for counters where a replica
 * that missed scrapes reports a lower value. NaNs lose against any number.
 *
 * @since 1.0
 */
public class LargestMergeStrategy implements SampleMergeStrategy {
  public static final String NAME = "largest";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public double merge(final double[] candidates, final int count) {
    int best = -1;
    for (int i = 0; i < count; i++) {
      final double value = candidates[i];
      if (Point.isStaleNaN(value)) {
        continue;
      }
      if (best < 0 ||
          (Double.isNaN(candidates[best]) && !Double.isNaN(value)) ||
          value > candidates[best]) {
        best = i;
      }
    }
    return best < 0 ? candidates[0] : candidates[best];
  }

  @Override
  public boolean byBackendOrder() {
    return false;
  }
}
