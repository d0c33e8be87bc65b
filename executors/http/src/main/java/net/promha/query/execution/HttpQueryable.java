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
package net.promha.query.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;

import io.netty.util.Timer;
import net.promha.query.Querier;
import net.promha.query.QueryContext;
import net.promha.query.Queryable;
import net.promha.stats.StatsCollector;
import net.promha.utils.SharedHttpClient;

/**
 * A single Prometheus compatible backend reached over HTTP. Each querier
 * issues GET requests against the backend's query API with a per request
 * timeout.
 *
 * @since 1.0
 */
public class HttpQueryable implements Queryable {
  private static final Logger LOG = LoggerFactory.getLogger(HttpQueryable.class);

  /** Header sent with every request. */
  public static final String VERSION_HEADER = "X-Prometheus-Instant-Query-Version";
  public static final String VERSION = "0.1.0";

  private final String endpoint;
  private final long timeout_ms;
  private final SharedHttpClient client;
  private final Timer timer;
  private final StatsCollector stats;

  /**
   * Default ctor.
   * @param endpoint The non-empty base URL, e.g. {@code http://host:9090}.
   * @param timeout_ms The per request timeout in milliseconds. 0 or less
   * disables it.
   * @param client The non-null shared client.
   * @param timer The timer for request timeouts, required if timeout_ms is
   * positive.
   * @param stats The non-null stats collector.
   * @throws IllegalArgumentException if an argument was invalid.
   */
  public HttpQueryable(final String endpoint,
                       final long timeout_ms,
                       final SharedHttpClient client,
                       final Timer timer,
                       final StatsCollector stats) {
    if (Strings.isNullOrEmpty(endpoint)) {
      throw new IllegalArgumentException("Endpoint cannot be null or empty.");
    }
    if (!endpoint.startsWith("http://") && !endpoint.startsWith("https://")) {
      throw new IllegalArgumentException("Endpoint must be an HTTP(s) URL: "
          + endpoint);
    }
    if (client == null) {
      throw new IllegalArgumentException("Client cannot be null.");
    }
    if (timeout_ms > 0 && timer == null) {
      throw new IllegalArgumentException("Timer cannot be null when a "
          + "timeout is set.");
    }
    if (stats == null) {
      throw new IllegalArgumentException("Stats cannot be null.");
    }
    this.endpoint = endpoint.endsWith("/") ?
        endpoint.substring(0, endpoint.length() - 1) : endpoint;
    this.timeout_ms = timeout_ms;
    this.client = client;
    this.timer = timer;
    this.stats = stats;
    if (LOG.isDebugEnabled()) {
      LOG.debug("Instantiated HTTP backend for " + this.endpoint
          + " with a timeout of " + timeout_ms + "ms");
    }
  }

  @Override
  public Querier querier(final QueryContext context) {
    return new HttpQuerier(this, context);
  }

  /** @return The base URL without a trailing slash. */
  public String endpoint() {
    return endpoint;
  }

  /** @return The per request timeout in milliseconds. */
  public long timeout() {
    return timeout_ms;
  }

  SharedHttpClient client() {
    return client;
  }

  Timer timer() {
    return timer;
  }

  StatsCollector stats() {
    return stats;
  }

  @Override
  public String toString() {
    return "HttpQueryable{" + endpoint + "}";
  }
}
