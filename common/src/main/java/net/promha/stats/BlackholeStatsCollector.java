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
 * A default implementation of the stats collector that simply ignores
 * the measurements. Used whenever the caller doesn't supply a collector so
 * components never have to null check.
 *
 * @since 1.0
 */
public class BlackholeStatsCollector implements StatsCollector {

  @Override
  public void incrementCounter(final String metric, final String... tags) {
    // Muahaha!
  }

  @Override
  public void incrementCounter(final String metric,
                               final long amount,
                               final String... tags) {
    // Muahaha!
  }

  @Override
  public void setGauge(final String metric,
                       final long value,
                       final String... tags) {
    // Muahaha!
  }

  @Override
  public void addTime(final String metric,
                      final long duration,
                      final ChronoUnit units,
                      final String... tags) {
    // Muahaha!
  }

}
