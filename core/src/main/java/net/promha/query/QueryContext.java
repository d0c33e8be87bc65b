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
package net.promha.query;

import java.io.Closeable;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import io.netty.util.Timeout;
import io.netty.util.Timer;
import io.netty.util.TimerTask;
import net.promha.exceptions.QueryExecutionCanceled;
import net.promha.exceptions.QueryExecutionException;
import net.promha.exceptions.QueryPhase;
import net.promha.exceptions.QueryTimeoutException;

/**
 * The deadline and cancellation state shared by every stage of one query.
 * The deadline is scheduled on a {@link Timer} when the context is created.
 * Once the context is done, either by timing out or by an explicit
 * {@link #cancel()}, it stays done and each registered listener is run
 * exactly once.
 *
 * @since 1.0
 */
public class QueryContext implements TimerTask, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(QueryContext.class);

  /** The states of a context. */
  public static enum State {
    RUNNING,
    CANCELED,
    TIMED_OUT
  }

  /** The deadline timer task, null if the context has no deadline. */
  private final Timeout timeout;

  /** When the deadline expires, in {@link System#nanoTime()} units. */
  private final long deadline_nanos;

  /** Listeners to run when done. Guarded by this. */
  private final List<Runnable> listeners;

  /** The current state. Guarded by this. */
  private State state;

  /**
   * Ctor for a context without a deadline.
   */
  public QueryContext() {
    this(null, 0);
  }

  /**
   * Default ctor.
   * @param timer The timer used to schedule the deadline. May be null only
   * if the timeout is 0 or less.
   * @param timeout_ms The deadline in milliseconds from now. 0 or less means
   * the context only finishes when canceled.
   * @throws IllegalArgumentException if a timeout was given without a timer.
   */
  public QueryContext(final Timer timer, final long timeout_ms) {
    listeners = Lists.newArrayList();
    state = State.RUNNING;
    if (timeout_ms > 0) {
      if (timer == null) {
        throw new IllegalArgumentException("A timer is required for a "
            + "query deadline.");
      }
      deadline_nanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeout_ms);
      timeout = timer.newTimeout(this, timeout_ms, TimeUnit.MILLISECONDS);
    } else {
      deadline_nanos = Long.MAX_VALUE;
      timeout = null;
    }
  }

  /** Cancels the query. A no-op if the context is already done. */
  public void cancel() {
    finish(State.CANCELED);
  }

  @Override
  public void run(final Timeout ignored) {
    finish(State.TIMED_OUT);
  }

  /** @return The current state. */
  public synchronized State state() {
    return state;
  }

  /** @return True if the query timed out or was canceled. */
  public synchronized boolean isDone() {
    return state != State.RUNNING;
  }

  /**
   * Throws if the context is done.
   * @param phase The phase the caller is in.
   * @throws QueryTimeoutException if the deadline passed.
   * @throws QueryExecutionCanceled if the query was canceled.
   */
  public void check(final QueryPhase phase) {
    final QueryExecutionException e = exception(phase);
    if (e != null) {
      throw e;
    }
  }

  /**
   * @param phase The phase the caller is in.
   * @return The exception describing why the context is done, or null if
   * it is still running.
   */
  public QueryExecutionException exception(final QueryPhase phase) {
    switch (state()) {
    case TIMED_OUT:
      return new QueryTimeoutException(phase);
    case CANCELED:
      return new QueryExecutionCanceled(phase);
    default:
      return null;
    }
  }

  /**
   * Registers a listener run once when the context is done. If it is already
   * done the listener runs immediately on the calling thread.
   * @param listener A non-null listener.
   */
  public void addListener(final Runnable listener) {
    synchronized (this) {
      if (state == State.RUNNING) {
        listeners.add(listener);
        return;
      }
    }
    listener.run();
  }

  /**
   * @param listener A listener to drop, e.g. once the caller stopped waiting.
   */
  public synchronized void removeListener(final Runnable listener) {
    listeners.remove(listener);
  }

  /** @return Milliseconds until the deadline, 0 if passed or
   * {@link Long#MAX_VALUE} if there is no deadline. */
  public long remainingMillis() {
    if (deadline_nanos == Long.MAX_VALUE) {
      return Long.MAX_VALUE;
    }
    return Math.max(0, TimeUnit.NANOSECONDS.toMillis(
        deadline_nanos - System.nanoTime()));
  }

  /** Cancels the deadline timer. Does not change the state. */
  @Override
  public void close() {
    if (timeout != null) {
      timeout.cancel();
    }
  }

  private void finish(final State new_state) {
    final List<Runnable> to_run;
    synchronized (this) {
      if (state != State.RUNNING) {
        return;
      }
      state = new_state;
      to_run = Lists.newArrayList(listeners);
      listeners.clear();
    }
    if (timeout != null && new_state == State.CANCELED) {
      timeout.cancel();
    }
    for (final Runnable listener : to_run) {
      try {
        listener.run();
      } catch (Exception e) {
        LOG.error("Unexpected exception running query context listener", e);
      }
    }
  }

  @Override
  public String toString() {
    return "QueryContext{state=" + state() + "}";
  }
}
