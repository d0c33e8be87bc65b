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

import java.io.IOException;
import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.core.JsonGenerator;

import net.promha.common.Const;
import net.promha.query.engine.Query;
import net.promha.query.serdes.PrometheusJsonSerdes;
import net.promha.query.value.Result;
import net.promha.utils.JSON;

/**
 * The result of one query. Matrix results hold pooled storage until the
 * response is closed, so serialize first and close after.
 *
 * @since 1.0
 */
public class QueryResponse implements AutoCloseable {
  private final Query query;
  private final Result result;
  private final AtomicBoolean closed;

  QueryResponse(final Query query, final Result result) {
    this.query = query;
    this.result = result;
    closed = new AtomicBoolean();
  }

  /** @return True if the query produced a value. */
  public boolean isSuccess() {
    return result.error() == null;
  }

  /** @return The result, either a value or an error. */
  public Result result() {
    return result;
  }

  /** @return The error if the query failed, null otherwise. */
  public Exception error() {
    return result.error();
  }

  /**
   * @return The Prometheus API JSON for the result.
   * @throws IllegalStateException if the response was closed.
   */
  public String toJson() {
    return new String(serialize(), Const.UTF8_CHARSET);
  }

  /**
   * @return The UTF-8 Prometheus API JSON for the result.
   * @throws IllegalStateException if the response was closed.
   */
  public byte[] serialize() {
    checkOpen();
    return PrometheusJsonSerdes.serialize(result);
  }

  /**
   * Streams the Prometheus API JSON to the output. The stream is flushed but
   * not closed.
   * @param stream A non-null stream.
   * @throws IOException if writing failed.
   * @throws IllegalStateException if the response was closed.
   */
  public void serialize(final OutputStream stream) throws IOException {
    checkOpen();
    final JsonGenerator json = JSON.getFactory().createGenerator(stream);
    json.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    PrometheusJsonSerdes.serialize(result, json);
    json.close();
  }

  /** Releases the result storage. Safe to call more than once. */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      query.close();
    }
  }

  @Override
  public String toString() {
    return "QueryResponse[" + query.params() + ", " + result + "]";
  }

  private void checkOpen() {
    if (closed.get()) {
      throw new IllegalStateException("Response was already closed: "
          + query.params());
    }
  }
}
