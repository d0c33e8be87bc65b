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
package net.promha.utils;

import java.io.IOException;

import org.apache.http.HttpResponse;
import org.apache.http.ParseException;
import org.apache.http.client.entity.DeflateDecompressingEntity;
import org.apache.http.client.entity.GzipDecompressingEntity;
import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.apache.http.impl.nio.client.HttpAsyncClients;
import org.apache.http.impl.nio.reactor.IOReactorConfig;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;

import net.promha.common.Const;
import net.promha.exceptions.RemoteQueryExecutionException;

/**
 * A shared asynchronous HTTP client for making remote calls to the
 * backends.
 *
 * @since 1.0
 */
public class DefaultSharedHttpClient implements SharedHttpClient {
  private static final Logger LOG = LoggerFactory.getLogger(
      DefaultSharedHttpClient.class);

  public static final int DEFAULT_IO_THREADS = 8;
  public static final int DEFAULT_MAX_CONNECTIONS = 200;
  public static final int DEFAULT_MAX_CONNECTIONS_PER_ROUTE = 25;

  /** The client. */
  protected final CloseableHttpAsyncClient client;

  /**
   * Ctor with the default thread and connection limits.
   */
  public DefaultSharedHttpClient() {
    this(DEFAULT_IO_THREADS, DEFAULT_MAX_CONNECTIONS,
        DEFAULT_MAX_CONNECTIONS_PER_ROUTE);
  }

  /**
   * Default ctor. Builds and starts the client.
   * @param io_threads The number of IO reactor threads, at least 1.
   * @param max_connections The total connection limit, at least 1.
   * @param max_per_route The per backend connection limit, at least 1.
   * @throws IllegalArgumentException if a limit was less than 1.
   */
  public DefaultSharedHttpClient(final int io_threads,
                                 final int max_connections,
                                 final int max_per_route) {
    if (io_threads < 1 || max_connections < 1 || max_per_route < 1) {
      throw new IllegalArgumentException("Thread and connection limits "
          + "must be at least 1.");
    }
    client = HttpAsyncClients.custom()
        .setDefaultIOReactorConfig(IOReactorConfig.custom()
            .setIoThreadCount(io_threads).build())
        .setMaxConnTotal(max_connections)
        .setMaxConnPerRoute(max_per_route)
        .build();
    client.start();
    LOG.info("Initialized shared HTTP client with " + io_threads
        + " IO threads and " + max_connections + " connections.");
  }

  /**
   * Ctor wrapping an existing client. It will be started if it isn't
   * running yet.
   * @param client The non-null client.
   */
  @VisibleForTesting
  DefaultSharedHttpClient(final CloseableHttpAsyncClient client) {
    if (client == null) {
      throw new IllegalArgumentException("Client cannot be null.");
    }
    this.client = client;
    if (!client.isRunning()) {
      client.start();
    }
  }

  @Override
  public CloseableHttpAsyncClient getClient() {
    return client;
  }

  @Override
  public void close() {
    try {
      client.close();
    } catch (IOException e) {
      LOG.error("Failed to close HTTPClient", e);
    }
  }

  /**
   * Helper that handles decompressing the result and parses the entity
   * to a string. If the status is not a 2xx we throw a
   * {@link RemoteQueryExecutionException} carrying the status and the
   * backend's error message when it sent one.
   * @param response The non-null response to parse.
   * @param remote_host The remote host name.
   * @return A string if successful.
   * @throws RemoteQueryExecutionException if the body couldn't be read or
   * the status was not a 2xx.
   */
  public static String parseResponse(final HttpResponse response,
                                     final String remote_host) {
    final String content;
    if (response.getEntity() == null) {
      throw new RemoteQueryExecutionException("Content for http response "
          + "was null: " + response, remote_host, 500);
    }

    try {
      final String encoding = (response.getEntity().getContentEncoding() != null &&
          response.getEntity().getContentEncoding().getValue() != null ?
              response.getEntity().getContentEncoding().getValue().toLowerCase() :
                "");
      if (encoding.equals("gzip") || encoding.equals("x-gzip")) {
        content = EntityUtils.toString(
            new GzipDecompressingEntity(response.getEntity()),
            Const.UTF8_CHARSET);
      } else if (encoding.equals("deflate")) {
        content = EntityUtils.toString(
            new DeflateDecompressingEntity(response.getEntity()),
            Const.UTF8_CHARSET);
      } else if (encoding.equals("")) {
        content = EntityUtils.toString(response.getEntity(),
            Const.UTF8_CHARSET);
      } else {
        throw new RemoteQueryExecutionException("Unhandled content encoding ["
            + encoding + "] : " + response, remote_host, 500);
      }
    } catch (ParseException e) {
      LOG.error("Failed to parse content from HTTP response: " + response, e);
      throw new RemoteQueryExecutionException("Content parsing failure for: "
          + response, remote_host, 500, e);
    } catch (IOException e) {
      LOG.error("Failed to parse content from HTTP response: " + response, e);
      throw new RemoteQueryExecutionException("Content parsing failure for: "
          + response, remote_host, 500, e);
    }

    final int status = response.getStatusLine().getStatusCode();
    if (status / 100 == 2) {
      return content;
    }

    final StringBuilder buf = new StringBuilder()
        .append("server returned HTTP status ")
        .append(status);
    if (response.getStatusLine().getReasonPhrase() != null) {
      buf.append(" ")
         .append(response.getStatusLine().getReasonPhrase());
    }
    // Prometheus style errors
    if (content.startsWith("{")) {
      try {
        final JsonNode root = JSON.getMapper().readTree(content);
        final JsonNode node = root.get("error");
        if (node != null && !node.isNull()) {
          buf.append(": ")
             .append(node.asText());
        }
      } catch (IOException e) {
        LOG.warn("Failed to parse the JSON error: " + content, e);
      }
    }
    throw new RemoteQueryExecutionException(buf.toString(), remote_host,
        status);
  }
}
