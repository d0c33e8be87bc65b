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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.apache.http.HttpResponse;
import org.apache.http.StatusLine;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.concurrent.FutureCallback;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.Lists;
import com.stumbleupon.async.Deferred;

import io.netty.util.Timeout;
import io.netty.util.Timer;
import io.netty.util.TimerTask;
import net.promha.data.Labels;
import net.promha.data.TimeSeriesSet;
import net.promha.exceptions.QueryExecutionCanceled;
import net.promha.exceptions.RemoteQueryExecutionException;
import net.promha.query.Querier;
import net.promha.query.QueryContext;
import net.promha.query.SelectParams;
import net.promha.stats.StatsCollector;
import net.promha.utils.SharedHttpClient;

public class TestHttpQuerier {
  private static final String ENDPOINT = "http://localhost:9090";
  private static final String VECTOR = "{\"status\":\"success\",\"data\":"
      + "{\"resultType\":\"vector\",\"result\":[{\"metric\":{\"__name__\":"
      + "\"up\",\"job\":\"node\"},\"value\":[1000,\"1\"]}]}}";

  private CloseableHttpAsyncClient client;
  private SharedHttpClient shared;
  private Timer timer;
  private Timeout timeout;
  private StatsCollector stats;
  private Future<HttpResponse> future;
  private List<HttpUriRequest> requests;
  private List<FutureCallback<HttpResponse>> callbacks;
  private List<TimerTask> tasks;

  @SuppressWarnings("unchecked")
  @Before
  public void before() throws Exception {
    client = mock(CloseableHttpAsyncClient.class);
    shared = mock(SharedHttpClient.class);
    when(shared.getClient()).thenReturn(client);
    timer = mock(Timer.class);
    timeout = mock(Timeout.class);
    stats = mock(StatsCollector.class);
    future = mock(Future.class);
    requests = Lists.newArrayList();
    callbacks = Lists.newArrayList();
    tasks = Lists.newArrayList();

    when(client.execute(any(HttpUriRequest.class), any()))
      .thenAnswer(invocation -> {
        requests.add((HttpUriRequest) invocation.getArguments()[0]);
        callbacks.add((FutureCallback<HttpResponse>) invocation.getArguments()[1]);
        return future;
      });
    when(timer.newTimeout(any(TimerTask.class), anyLong(), any(TimeUnit.class)))
      .thenAnswer(invocation -> {
        tasks.add((TimerTask) invocation.getArguments()[0]);
        return timeout;
      });
  }

  @Test
  public void queryableCtor() throws Exception {
    final HttpQueryable queryable = new HttpQueryable(ENDPOINT + "/", 30000,
        shared, timer, stats);
    assertEquals(ENDPOINT, queryable.endpoint());
    assertEquals(30000, queryable.timeout());

    try {
      new HttpQueryable(null, 30000, shared, timer, stats);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new HttpQueryable("localhost:9090", 30000, shared, timer, stats);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new HttpQueryable(ENDPOINT, 30000, null, timer, stats);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new HttpQueryable(ENDPOINT, 30000, shared, null, stats);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    // no timeout, no timer.
    new HttpQueryable(ENDPOINT, 0, shared, null, stats);
  }

  @Test
  public void buildUri() throws Exception {
    URI uri = HttpQuerier.buildUri(ENDPOINT, SelectParams.instant("up", 1000));
    assertEquals("http://localhost:9090/api/v1/query?query=up&time=1000",
        uri.toString());

    uri = HttpQuerier.buildUri(ENDPOINT, SelectParams.newBuilder()
        .setQuery("up")
        .setStart(0)
        .setEnd(120)
        .setStep(60)
        .build());
    assertEquals("http://localhost:9090/api/v1/query_range?query=up&start=0"
        + "&end=120&step=60", uri.toString());

    uri = HttpQuerier.buildUri(ENDPOINT,
        SelectParams.instant("sum(rate(http_requests_total{job=\"api\"}[5m]))",
            1000));
    assertEquals("/api/v1/query", uri.getPath());
    assertEquals("query=sum(rate(http_requests_total{job=\"api\"}[5m]))"
        + "&time=1000", uri.getQuery());
    assertTrue(!uri.getRawQuery().contains("{"));
  }

  @Test
  public void success() throws Exception {
    final Querier querier = querier(new QueryContext());
    final Deferred<TimeSeriesSet> deferred =
        querier.select(SelectParams.instant("up", 1000));
    assertEquals(1, requests.size());
    assertEquals("GET", requests.get(0).getMethod());
    assertEquals("0.1.0", requests.get(0)
        .getFirstHeader("X-Prometheus-Instant-Query-Version").getValue());
    verify(timer).newTimeout(any(TimerTask.class), eq(30000L),
        eq(TimeUnit.MILLISECONDS));

    callbacks.get(0).completed(response(200, VECTOR));
    final TimeSeriesSet set = deferred.join(1000);
    assertTrue(set.next());
    assertEquals(Labels.of("__name__", "up", "job", "node"),
        set.at().labels());
    verify(timeout).cancel();
    verify(stats).incrementCounter("http.request.success", "endpoint", ENDPOINT);
    assertEquals(0, ((HttpQuerier) querier).outstanding());
    querier.close();
    verify(future, never()).cancel(true);
  }

  @Test
  public void httpError() throws Exception {
    final Querier querier = querier(new QueryContext());
    final Deferred<TimeSeriesSet> deferred =
        querier.select(SelectParams.instant("up", 1000));
    callbacks.get(0).completed(response(503, "Unavailable"));
    try {
      deferred.join(1000);
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertEquals(503, e.getStatusCode());
      assertTrue(e.getMessage().startsWith("server returned HTTP status 503"));
    }
    verify(stats).incrementCounter("http.request.failed", "endpoint", ENDPOINT);
  }

  @Test
  public void badBody() throws Exception {
    final Querier querier = querier(new QueryContext());
    final Deferred<TimeSeriesSet> deferred =
        querier.select(SelectParams.instant("up", 1000));
    callbacks.get(0).completed(response(200, "not json"));
    try {
      deferred.join(1000);
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertEquals(500, e.getStatusCode());
    }
  }

  @Test
  public void failed() throws Exception {
    final Querier querier = querier(new QueryContext());
    final Deferred<TimeSeriesSet> deferred =
        querier.select(SelectParams.instant("up", 1000));
    callbacks.get(0).failed(new IOException("Connection refused"));
    try {
      deferred.join(1000);
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertEquals(502, e.getStatusCode());
      assertEquals("Error sending request: Connection refused", e.getMessage());
    }
  }

  @Test
  public void timedOut() throws Exception {
    final Querier querier = querier(new QueryContext());
    final Deferred<TimeSeriesSet> deferred =
        querier.select(SelectParams.instant("up", 1000));
    tasks.get(0).run(timeout);
    try {
      deferred.join(1000);
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertEquals(504, e.getStatusCode());
      assertEquals(ENDPOINT, e.getRemoteEndpoint());
    }
    verify(future).cancel(true);
    verify(stats).incrementCounter("http.request.timeout", "endpoint", ENDPOINT);

    // late responses are ignored.
    callbacks.get(0).completed(response(200, VECTOR));
    callbacks.get(0).cancelled();
  }

  @Test
  public void contextCanceled() throws Exception {
    final QueryContext context = new QueryContext();
    final Querier querier = querier(context);
    final Deferred<TimeSeriesSet> deferred =
        querier.select(SelectParams.instant("up", 1000));
    context.cancel();
    try {
      deferred.join(1000);
      fail("Expected QueryExecutionCanceled");
    } catch (QueryExecutionCanceled e) { }
    verify(future).cancel(true);
    verify(timeout).cancel();
  }

  @Test
  public void contextAlreadyDone() throws Exception {
    final QueryContext context = new QueryContext();
    context.cancel();
    final Querier querier = querier(context);
    final Deferred<TimeSeriesSet> deferred =
        querier.select(SelectParams.instant("up", 1000));
    try {
      deferred.join(1000);
      fail("Expected QueryExecutionCanceled");
    } catch (QueryExecutionCanceled e) { }
    assertTrue(requests.isEmpty());
  }

  @Test
  public void closeAborts() throws Exception {
    final Querier querier = querier(new QueryContext());
    final Deferred<TimeSeriesSet> deferred =
        querier.select(SelectParams.instant("up", 1000));
    assertEquals(1, ((HttpQuerier) querier).outstanding());
    querier.close();
    assertEquals(0, ((HttpQuerier) querier).outstanding());
    try {
      deferred.join(1000);
      fail("Expected QueryExecutionCanceled");
    } catch (QueryExecutionCanceled e) { }
    verify(future).cancel(true);

    // idempotent
    querier.close();
    try {
      querier.select(SelectParams.instant("up", 1000));
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
  }

  @Test
  public void executeThrows() throws Exception {
    when(client.execute(any(HttpUriRequest.class), any()))
      .thenThrow(new IllegalStateException("Request cannot be executed; "
          + "I/O reactor status: STOPPED"));
    final Querier querier = querier(new QueryContext());
    try {
      querier.select(SelectParams.instant("up", 1000)).join(1000);
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertEquals(500, e.getStatusCode());
    }
  }

  private Querier querier(final QueryContext context) {
    return new HttpQueryable(ENDPOINT, 30000, shared, timer, stats)
        .querier(context);
  }

  private static HttpResponse response(final int code, final String body)
      throws Exception {
    final HttpResponse response = mock(HttpResponse.class);
    final StatusLine status = mock(StatusLine.class);
    when(status.getStatusCode()).thenReturn(code);
    when(response.getStatusLine()).thenReturn(status);
    when(response.getEntity()).thenReturn(new StringEntity(body));
    return response;
  }
}
