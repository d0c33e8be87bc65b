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

/**
 * Always takes the sample of the highest priority backend that has one,
 * even if it is a stale marker.
 *
 * @since 1.0
 */
public class StrictMergeStrategy implements SampleMergeStrategy {
  public static final String NAME = "strict";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public double merge(final double[] candidates, final int count) {
    return candidates[0];
  }

  @Override
  public boolean byBackendOrder() {
    return false;
  }
}
