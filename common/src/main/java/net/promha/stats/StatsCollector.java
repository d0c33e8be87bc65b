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
package net.promha.stats;

import java.time.temporal.ChronoUnit;

/**
 * A collector for internal metrics about the query path: gate waits,
 * timeouts, sample budget overflows, backend failures and pool misses.
 * Implementations must be thread safe.
 *
 * @since 1.0
 */
public interface StatsCollector {

  /**
   * Increments the counter by 1.
   * @param metric A non-null metric name.
   * @param tags An optional list of tag key, value pairs.
   */
  public void incrementCounter(final String metric,
                               final String... tags);

  /**
   * Increments the counter by the given amount.
   * @param metric A non-null metric name.
   * @param amount The amount to increment by.
   * @param tags An optional list of tag key, value pairs.
   */
  public void incrementCounter(final String metric,
                               final long amount,
                               final String... tags);

  /**
   * Sets a gauge to the given value.
   * @param metric A non-null metric name.
   * @param value The value to set.
   * @param tags An optional list of tag key, value pairs.
   */
  public void setGauge(final String metric,
                       final long value,
                       final String... tags);

  /**
   * Records a latency measurement.
   * @param metric A non-null metric name.
   * @param duration The duration in the given units.
   * @param units The units of the duration.
   * @param tags An optional list of tag key, value pairs.
   */
  public void addTime(final String metric,
                      final long duration,
                      final ChronoUnit units,
                      final String... tags);

}
