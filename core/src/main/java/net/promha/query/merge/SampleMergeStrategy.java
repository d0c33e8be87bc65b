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
 * Picks the value to emit when several backends have a sample for the same
 * series at the same timestamp. Strategies that evaluate by backend order
 * are instead resolved per evaluation time by the grid evaluator, with
 * {@link #merge(double[], int)} only applying when the merged series is
 * walked directly.
 *
 * @since 1.0
 */
public interface SampleMergeStrategy {

  /** @return The name used to select the strategy in configs. */
  public String name();

  /**
   * Picks a value.
   * @param candidates The candidate values in configured backend order.
   * Only the first {@code count} entries are valid.
   * @param count The number of candidates, at least 1.
   * @return The merged value, possibly the stale marker.
   */
  public double merge(final double[] candidates, final int count);

  /**
   * @return True if each evaluation time takes the first backend, in
   * configured order, with a non-stale sample in the lookback window.
   * False to walk the union of every backend's timestamps.
   */
  public boolean byBackendOrder();

}
