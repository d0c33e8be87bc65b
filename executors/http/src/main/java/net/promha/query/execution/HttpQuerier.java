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

import java.net.URI;
import java.net.URISyntaxException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.http.HttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.concurrent.FutureCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import com.stumbleupon.async.Deferred;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;
import net.promha.data.TimeSeriesSet;
import net.promha.exceptions.QueryExecutionCanceled;
import net.promha.exceptions.RemoteQueryExecutionException;
import net.promha.query.Querier;
import net.promha.query.QueryContext;
import net.promha.query.SelectParams;
import net.promha.utils.DateTime;
import net.promha.utils.DefaultSharedHttpClient;
import net.promha.utils.JSON;

/**
 * Runs selects against one HTTP backend for one query. Instant selects go
 * to {@code /api/v1/query}, range selects to {@code /api/v1/query_range}.
 * A request is aborted when its timeout fires, when the query context
 * finishes or when the querier is closed.
 *
 * @since 1.0
 */
public class HttpQuerier implements Querier {
  private static final Logger LOG = LoggerFactory.getLogger(HttpQuerier.class);

  private final HttpQueryable backend;
  private final QueryContext context;

  /** Requests still outstanding. Guarded by this. */
  private final List<Request> requests;

  /** Set once closed. Guarded by this. */
  private boolean closed;

  /**
   * Default ctor.
   * @param backend The non-null backend.
   * @param context The non-null query context.
   */
  public HttpQuerier(final HttpQueryable backend, final QueryContext context) {
    if (backend == null) {
      throw new IllegalArgumentException("Backend cannot be null.");
    }
    if (context == null) {
      throw new IllegalArgumentException("Context cannot be null.");
    }
    this.backend = backend;
    this.context = context;
    requests = Lists.newArrayList();
  }

  @Override
  public Deferred<TimeSeriesSet> select(final SelectParams params) {
    synchronized (this) {
      if (closed) {
        throw new IllegalStateException("Querier for " + backend.endpoint()
            + " was already closed.");
      }
    }
    final URI uri;
    try {
      uri = buildUri(backend.endpoint(), params);
    } catch (URISyntaxException e) {
      return Deferred.fromError(new RemoteQueryExecutionException(
          "Unable to create request: " + e.getMessage(), backend.endpoint(),
          400, e));
    }
    final HttpGet get = new HttpGet(uri);
    get.setHeader(HttpQueryable.VERSION_HEADER, HttpQueryable.VERSION);

    final Request request = new Request(get);
    synchronized (this) {
      requests.add(request);
    }
    if (backend.timeout() > 0) {
      request.timeout = backend.timer().newTimeout(request, backend.timeout(),
          TimeUnit.MILLISECONDS);
    }
    context.addListener(request);
    if (request.done.get()) {
      // context was already finished.
      return request.deferred;
    }
    try {
      request.future = backend.client().getClient().execute(get, request);
    } catch (Exception e) {
      request.complete(new RemoteQueryExecutionException("Error sending "
          + "request: " + e.getMessage(), backend.endpoint(), 500, e));
    }
    return request.deferred;
  }

  /** Aborts any outstanding request. */
  @Override
  public void close() {
    final List<Request> outstanding;
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
      outstanding = Lists.newArrayList(requests);
      requests.clear();
    }
    for (final Request request : outstanding) {
      request.abort();
    }
  }

  /** @return The number of requests that haven't completed. */
  @VisibleForTesting
  synchronized int outstanding() {
    return requests.size();
  }

  /**
   * @param endpoint The base URL.
   * @param params The select.
   * @return The query API URI for the select.
   * @throws URISyntaxException if the endpoint was malformed.
   */
  static URI buildUri(final String endpoint, final SelectParams params)
      throws URISyntaxException {
    final URIBuilder builder;
    if (params.isInstant()) {
      builder = new URIBuilder(endpoint + "/api/v1/query")
          .addParameter("query", params.query())
          .addParameter("time", Long.toString(params.start()));
    } else {
      builder = new URIBuilder(endpoint + "/api/v1/query_range")
          .addParameter("query", params.query())
          .addParameter("start", Long.toString(params.start()))
          .addParameter("end", Long.toString(params.end()))
          .addParameter("step", Long.toString(params.step()));
    }
    return builder.build();
  }

  /**
   * One outstanding request. Whichever of the response, the timeout or an
   * abort comes first resolves the deferred, the others are ignored.
   */
  class Request implements FutureCallback<HttpResponse>, TimerTask, Runnable {
    final HttpGet get;
    final Deferred<TimeSeriesSet> deferred;
    final AtomicBoolean done;
    final long start;
    volatile Timeout timeout;
    volatile Future<HttpResponse> future;

    Request(final HttpGet get) {
      this.get = get;
      deferred = new Deferred<TimeSeriesSet>();
      done = new AtomicBoolean();
      start = DateTime.nanoTime();
    }

    @Override
    public void completed(final HttpResponse response) {
      final Object result;
      try {
        final String json = DefaultSharedHttpClient.parseResponse(response,
            backend.endpoint());
        result = PrometheusResponseCodec.decode(JSON.parseToTree(json),
            backend.endpoint());
      } catch (RemoteQueryExecutionException e) {
        complete(e);
        return;
      } catch (Exception e) {
        complete(new RemoteQueryExecutionException("Unable to decode "
            + "response: " + e.getMessage(), backend.endpoint(), 500, e));
        return;
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("Successful response from [" + get.getURI() + "] after "
            + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms");
      }
      complete(result);
    }

    @Override
    public void failed(final Exception ex) {
      complete(new RemoteQueryExecutionException("Error sending request: "
          + ex.getMessage(), backend.endpoint(), 502, ex));
    }

    @Override
    public void cancelled() {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Http request was canceled: " + get.getURI());
      }
      complete(new QueryExecutionCanceled("Request to "
          + backend.endpoint() + " was canceled", 400));
    }

    /** Fired by the timer. */
    @Override
    public void run(final Timeout ignored) {
      if (complete(new RemoteQueryExecutionException("Request timed out "
          + "after " + backend.timeout() + "ms", backend.endpoint(), 504))) {
        backend.stats().incrementCounter("http.request.timeout",
            "endpoint", backend.endpoint());
        cancelFuture();
      }
    }

    /** Fired when the query context finishes. */
    @Override
    public void run() {
      abort();
    }

    void abort() {
      if (complete(new QueryExecutionCanceled("Request to "
          + backend.endpoint() + " was canceled", 400))) {
        cancelFuture();
      }
    }

    private void cancelFuture() {
      final Future<HttpResponse> f = future;
      if (f != null) {
        f.cancel(true);
      } else {
        get.abort();
      }
    }

    /**
     * Resolves the deferred once.
     * @param result A series set or an exception.
     * @return True if this call resolved it.
     */
    boolean complete(final Object result) {
      if (!done.compareAndSet(false, true)) {
        return false;
      }
      final Timeout t = timeout;
      if (t != null) {
        t.cancel();
      }
      context.removeListener(this);
      synchronized (HttpQuerier.this) {
        requests.remove(this);
      }
      backend.stats().addTime("http.request.latency",
          (long) DateTime.msFromNanoDiff(DateTime.nanoTime(), start),
          ChronoUnit.MILLIS, "endpoint", backend.endpoint());
      if (result instanceof Exception) {
        backend.stats().incrementCounter("http.request.failed",
            "endpoint", backend.endpoint());
        if (LOG.isDebugEnabled()) {
          LOG.debug("Request [" + get.getURI() + "] failed: " + result);
        }
      } else {
        backend.stats().incrementCounter("http.request.success",
            "endpoint", backend.endpoint());
      }
      try {
        deferred.callback(result);
      } catch (Exception e) {
        LOG.warn("Exception thrown when calling deferred for "
            + get.getURI(), e);
      }
      return true;
    }
  }
}
