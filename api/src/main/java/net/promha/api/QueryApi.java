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
package net.promha.api;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;

import io.netty.util.Timer;
import net.promha.pools.PointArrayPool;
import net.promha.query.Queryable;
import net.promha.query.engine.Query;
import net.promha.query.engine.QueryEngine;
import net.promha.query.execution.HttpQueryable;
import net.promha.query.merge.MergeQueryable;
import net.promha.stats.BlackholeStatsCollector;
import net.promha.stats.StatsCollector;
import net.promha.utils.DateTime;
import net.promha.utils.DefaultSharedHttpClient;
import net.promha.utils.SharedHttpClient;
import net.promha.utils.Threads;

/**
 * Instant and range queries over a set of redundant Prometheus backends.
 * Everything the queries share (the engine, the pool, the HTTP client and
 * the timer) is owned by the instance and released by {@link #close()}.
 * <p>
 * Invalid arguments throw an {@link IllegalArgumentException}. Failures
 * while executing come back as an error {@link QueryResponse}.
 *
 * @since 1.0
 */
public class QueryApi implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(QueryApi.class);

  private final PromHaConfig config;
  private final Timer timer;
  private final SharedHttpClient client;
  private final MergeQueryable queryable;
  private final QueryEngine engine;
  private final AtomicBoolean closed;

  /**
   * Ctor without stats.
   * @param config The non-null config.
   */
  public QueryApi(final PromHaConfig config) {
    this(config, new BlackholeStatsCollector());
  }

  /**
   * Default ctor. Starts the HTTP client.
   * @param config The non-null config.
   * @param stats The non-null stats collector.
   * @throws IllegalArgumentException if an argument was null or invalid.
   */
  public QueryApi(final PromHaConfig config, final StatsCollector stats) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (stats == null) {
      throw new IllegalArgumentException("Stats cannot be null.");
    }
    this.config = config;
    closed = new AtomicBoolean();
    timer = Threads.newTimer("PromHaTimer");
    client = new DefaultSharedHttpClient();
    try {
      final List<Queryable> backends = Lists.newArrayList();
      for (final BackendConfig backend : config.getBackends()) {
        backends.add(new HttpQueryable(backend.getEndpoint(),
            backend.timeoutMs(), client, timer, stats));
      }
      queryable = new MergeQueryable(backends, config.mergeStrategy(), stats);
      engine = newEngine(config, timer, stats);
    } catch (RuntimeException e) {
      timer.stop();
      closeClient();
      throw e;
    }
    LOG.info("Instantiated query API with " + config);
  }

  /**
   * Ctor for custom backends. The instance takes ownership of the timer.
   * @param config The non-null config. Its backends are ignored.
   * @param backends The non-empty backends in priority order.
   * @param timer The non-null timer.
   * @param stats The non-null stats collector.
   */
  @VisibleForTesting
  QueryApi(final PromHaConfig config,
           final List<? extends Queryable> backends,
           final Timer timer,
           final StatsCollector stats) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (timer == null) {
      throw new IllegalArgumentException("Timer cannot be null.");
    }
    if (stats == null) {
      throw new IllegalArgumentException("Stats cannot be null.");
    }
    this.config = config;
    this.timer = timer;
    client = null;
    closed = new AtomicBoolean();
    queryable = new MergeQueryable(backends, config.mergeStrategy(), stats);
    engine = newEngine(config, timer, stats);
  }

  /**
   * Runs an instant query at the current time.
   * @param query The non-null and non-empty query text.
   * @return The response. Close it when done.
   * @throws IllegalStateException if the API was closed.
   */
  public QueryResponse query(final String query) {
    return query(query, DateTime.currentTimeSeconds());
  }

  /**
   * Runs an instant query.
   * @param query The non-null and non-empty query text.
   * @param timestamp The evaluation time in seconds.
   * @return The response. Close it when done.
   * @throws IllegalStateException if the API was closed.
   */
  public QueryResponse query(final String query, final long timestamp) {
    checkOpen();
    return execute(engine.newInstantQuery(queryable, query, timestamp));
  }

  /**
   * Runs a range query.
   * @param query The non-null and non-empty query text.
   * @param start The first evaluation time in seconds.
   * @param end The last evaluation time in seconds, inclusive.
   * @param step The step in seconds, at least 1.
   * @return The response. Close it when done.
   * @throws IllegalArgumentException if the range was invalid.
   * @throws IllegalStateException if the API was closed.
   */
  public QueryResponse queryRange(final String query,
                                  final long start,
                                  final long end,
                                  final long step) {
    checkOpen();
    return execute(engine.newRangeQuery(queryable, query, start, end, step));
  }

  /** @return The config this instance was built from. */
  public PromHaConfig config() {
    return config;
  }

  @VisibleForTesting
  QueryEngine engine() {
    return engine;
  }

  /** Stops the timer and closes the HTTP client. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    timer.stop();
    closeClient();
    LOG.info("Closed query API.");
  }

  private QueryResponse execute(final Query query) {
    return new QueryResponse(query, query.exec());
  }

  private void checkOpen() {
    if (closed.get()) {
      throw new IllegalStateException("Query API was already closed.");
    }
  }

  private void closeClient() {
    if (client == null) {
      return;
    }
    try {
      client.close();
    } catch (IOException e) {
      LOG.warn("Failed to close the HTTP client", e);
    }
  }

  private static QueryEngine newEngine(final PromHaConfig config,
                                       final Timer timer,
                                       final StatsCollector stats) {
    final PointArrayPool pool = new PointArrayPool(
        config.getPool().getSize(),
        config.getPool().getArrayLength(),
        stats);
    return new QueryEngine(config.toEngineConfig(), pool, timer, stats);
  }
}
