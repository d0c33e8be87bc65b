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

import java.util.List;

import com.google.common.collect.Lists;

import net.promha.query.Querier;
import net.promha.query.QueryContext;
import net.promha.query.Queryable;
import net.promha.stats.BlackholeStatsCollector;
import net.promha.stats.StatsCollector;

/**
 * Presents several redundant backends as one. The order of the backends is
 * their priority when the merge strategy needs a tie break.
 *
 * @since 1.0
 */
public class MergeQueryable implements Queryable {
  private final List<Queryable> backends;
  private final SampleMergeStrategy strategy;
  private final StatsCollector stats;

  /**
   * Ctor using the default strategy and no stats.
   * @param backends A non-empty list of backends in priority order.
   */
  public MergeQueryable(final List<? extends Queryable> backends) {
    this(backends, MergeStrategies.forName(MergeStrategies.DEFAULT),
        new BlackholeStatsCollector());
  }

  /**
   * Default ctor.
   * @param backends A non-empty list of backends in priority order.
   * @param strategy The non-null merge strategy.
   * @param stats A non-null stats collector.
   * @throws IllegalArgumentException if an argument was null or empty.
   */
  public MergeQueryable(final List<? extends Queryable> backends,
                        final SampleMergeStrategy strategy,
                        final StatsCollector stats) {
    if (backends == null || backends.isEmpty()) {
      throw new IllegalArgumentException("Backends cannot be null or empty.");
    }
    if (strategy == null) {
      throw new IllegalArgumentException("Strategy cannot be null.");
    }
    if (stats == null) {
      throw new IllegalArgumentException("Stats cannot be null.");
    }
    this.backends = Lists.newArrayList(backends);
    this.strategy = strategy;
    this.stats = stats;
  }

  @Override
  public Querier querier(final QueryContext context) {
    final List<Querier> queriers = Lists.newArrayListWithCapacity(backends.size());
    for (final Queryable backend : backends) {
      queriers.add(backend.querier(context));
    }
    return new MergeQuerier(queriers, strategy, stats);
  }

  /** @return The number of backends. */
  public int backendCount() {
    return backends.size();
  }

  /** @return The merge strategy. */
  public SampleMergeStrategy strategy() {
    return strategy;
  }
}
