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
package net.promha.query.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.util.Timer;
import net.promha.query.QueryContext;
import net.promha.query.Queryable;
import net.promha.query.SelectParams;
import net.promha.query.gate.QueryGate;
import net.promha.pools.PointArrayPool;
import net.promha.stats.StatsCollector;

/**
 * Creates instant and range queries and shares the admission gate, the
 * point pool and the deadline timer between them. Build one per process
 * from an {@link EngineConfig}.
 *
 * @since 1.0
 */
public class QueryEngine {
  private static final Logger LOG = LoggerFactory.getLogger(QueryEngine.class);

  private final EngineConfig config;
  private final QueryGate gate;
  private final PointArrayPool pool;
  private final Timer timer;
  private final StatsCollector stats;

  /**
   * Default ctor.
   * @param config The non-null config.
   * @param pool The non-null pool for result storage.
   * @param timer The timer used for query deadlines. May be null only if
   * the config disables the timeout.
   * @param stats The non-null stats collector.
   * @throws IllegalArgumentException if a required argument was null.
   */
  public QueryEngine(final EngineConfig config,
                     final PointArrayPool pool,
                     final Timer timer,
                     final StatsCollector stats) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (pool == null) {
      throw new IllegalArgumentException("Pool cannot be null.");
    }
    if (timer == null && config.getTimeout() > 0) {
      throw new IllegalArgumentException("Timer cannot be null when a "
          + "timeout is configured.");
    }
    if (stats == null) {
      throw new IllegalArgumentException("Stats cannot be null.");
    }
    this.config = config;
    this.pool = pool;
    this.timer = timer;
    this.stats = stats;
    gate = new QueryGate(config.getMaxConcurrent(), stats);
    LOG.info("Instantiated query engine with " + config);
  }

  /**
   * Creates an instant query. The deadline starts now.
   * @param queryable The non-null source of series.
   * @param query The non-null and non-empty query text.
   * @param timestamp The evaluation time in seconds.
   * @return A new query.
   */
  public Query newInstantQuery(final Queryable queryable,
                               final String query,
                               final long timestamp) {
    return newQuery(queryable, SelectParams.instant(query, timestamp));
  }

  /**
   * Creates a range query. The deadline starts now.
   * @param queryable The non-null source of series.
   * @param query The non-null and non-empty query text.
   * @param start The first evaluation time in seconds.
   * @param end The last evaluation time in seconds, inclusive.
   * @param step The step in seconds, at least 1.
   * @return A new query.
   * @throws IllegalArgumentException if the step was less than 1 or the
   * end was before the start.
   */
  public Query newRangeQuery(final Queryable queryable,
                             final String query,
                             final long start,
                             final long end,
                             final long step) {
    if (step < 1) {
      throw new IllegalArgumentException("Range query step must be at "
          + "least 1 second: " + step);
    }
    return newQuery(queryable, SelectParams.newBuilder()
        .setQuery(query)
        .setStart(start)
        .setEnd(end)
        .setStep(step)
        .build());
  }

  /**
   * Creates a query for the given parameters.
   * @param queryable The non-null source of series.
   * @param params The non-null parameters.
   * @return A new query.
   */
  public Query newQuery(final Queryable queryable, final SelectParams params) {
    if (queryable == null) {
      throw new IllegalArgumentException("Queryable cannot be null.");
    }
    if (params == null) {
      throw new IllegalArgumentException("Params cannot be null.");
    }
    return new EngineQuery(this, queryable, params,
        new QueryContext(timer, config.getTimeout()));
  }

  /** @return The config. */
  public EngineConfig config() {
    return config;
  }

  /** @return The admission gate. */
  public QueryGate gate() {
    return gate;
  }

  /** @return The point pool. */
  public PointArrayPool pool() {
    return pool;
  }

  /** @return The stats collector. */
  public StatsCollector stats() {
    return stats;
  }
}
