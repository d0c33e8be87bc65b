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
package net.promha.query.gate;

import java.util.ArrayDeque;
import java.util.Deque;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stumbleupon.async.Deferred;

import net.promha.exceptions.QueryPhase;
import net.promha.query.QueryContext;
import net.promha.stats.BlackholeStatsCollector;
import net.promha.stats.StatsCollector;

/**
 * Bounds the number of queries executing at once. Callers obtain a slot
 * with {@link #start(QueryContext)} and must return it with {@link #done()}
 * exactly once. Waiters are served in arrival order. A waiter whose context
 * times out or is canceled before it gets a slot leaves the queue with a
 * timeout or cancellation exception for the {@link QueryPhase#QUEUE} phase.
 *
 * @since 1.0
 */
public class QueryGate {
  private static final Logger LOG = LoggerFactory.getLogger(QueryGate.class);

  /** The maximum number of slots. */
  private final int max_concurrent;

  /** Stats. */
  private final StatsCollector stats;

  /** Waiters in arrival order. Guarded by this. */
  private final Deque<Waiter> waiters;

  /** Slots handed out. Guarded by this. */
  private int in_flight;

  /**
   * Ctor without stats.
   * @param max_concurrent The number of slots, at least 1.
   */
  public QueryGate(final int max_concurrent) {
    this(max_concurrent, new BlackholeStatsCollector());
  }

  /**
   * Default ctor.
   * @param max_concurrent The number of slots, at least 1.
   * @param stats A non-null stats collector.
   * @throws IllegalArgumentException if max_concurrent was less than 1 or
   * stats was null.
   */
  public QueryGate(final int max_concurrent, final StatsCollector stats) {
    if (max_concurrent < 1) {
      throw new IllegalArgumentException("Max concurrent must be at least 1.");
    }
    if (stats == null) {
      throw new IllegalArgumentException("Stats cannot be null.");
    }
    this.max_concurrent = max_concurrent;
    this.stats = stats;
    waiters = new ArrayDeque<Waiter>();
  }

  /**
   * Requests a slot.
   * @param context The non-null context of the query.
   * @return A deferred called back with null once the slot is assigned or
   * with an exception if the context finished first.
   */
  public Deferred<Object> start(final QueryContext context) {
    final Waiter waiter = new Waiter(context);
    synchronized (this) {
      if (in_flight < max_concurrent && waiters.isEmpty()) {
        in_flight++;
        waiter.admitted = true;
      } else {
        waiters.addLast(waiter);
      }
    }
    if (waiter.admitted) {
      stats.incrementCounter("query.gate.admitted");
      waiter.deferred.callback(null);
      return waiter.deferred;
    }

    stats.incrementCounter("query.gate.queued");
    if (LOG.isDebugEnabled()) {
      LOG.debug("Query queued, " + waiting() + " waiting for " + max_concurrent
          + " slots");
    }
    context.addListener(waiter);
    return waiter.deferred;
  }

  /**
   * Returns a slot, handing it to the oldest waiter if there is one.
   * @throws IllegalStateException if no slot was held.
   */
  public void done() {
    final Waiter next;
    synchronized (this) {
      if (in_flight <= 0) {
        throw new IllegalStateException("Gate done() called without a slot "
            + "in flight.");
      }
      next = waiters.pollFirst();
      if (next == null) {
        in_flight--;
        return;
      }
      next.admitted = true;
    }
    next.context.removeListener(next);
    stats.incrementCounter("query.gate.admitted");
    next.deferred.callback(null);
  }

  /** @return The number of slots handed out. */
  public synchronized int inFlight() {
    return in_flight;
  }

  /** @return The number of queries waiting for a slot. */
  public synchronized int waiting() {
    return waiters.size();
  }

  /** @return The maximum number of slots. */
  public int maxConcurrent() {
    return max_concurrent;
  }

  /** A queued request, run as a context listener to leave the queue. */
  private class Waiter implements Runnable {
    final QueryContext context;
    final Deferred<Object> deferred;
    boolean admitted;

    Waiter(final QueryContext context) {
      this.context = context;
      deferred = new Deferred<Object>();
    }

    @Override
    public void run() {
      synchronized (QueryGate.this) {
        if (admitted || !waiters.remove(this)) {
          return;
        }
      }
      stats.incrementCounter("query.gate.abandoned");
      deferred.callback(context.exception(QueryPhase.QUEUE));
    }
  }
}
