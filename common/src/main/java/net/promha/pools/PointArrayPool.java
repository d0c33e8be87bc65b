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
package net.promha.pools;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.promha.stats.BlackholeStatsCollector;
import net.promha.stats.StatsCollector;

/**
 * A {@link BlockingQueue} backed pool of primitive timestamp and value
 * arrays used to store series points. Each claim hands out a fresh
 * {@link PooledPoints} handle so a stale reference to a released handle can
 * never observe storage that was handed to another holder.
 * <p>
 * The pool is safe for concurrent claims and releases. When the free list
 * is empty or a caller needs more capacity than the pooled length, a new
 * array pair is allocated and counted as a miss. Only arrays of exactly the
 * pooled length are returned to the free list.
 *
 * @since 1.0
 */
public class PointArrayPool {
  private static final Logger LOG = LoggerFactory.getLogger(
      PointArrayPool.class);

  /** The default number of pooled array pairs. */
  public static final int DEFAULT_SIZE = 1024;

  /** The default length of each pooled array. */
  public static final int DEFAULT_ARRAY_LENGTH = 128;

  /** The queue we'll circulate arrays through. */
  private final BlockingQueue<PointArrays> pool;

  /** The length of each pooled array. */
  private final int array_length;

  /** Where we report misses. */
  private final StatsCollector stats;

  /**
   * Ctor with the default sizes and no stats.
   */
  public PointArrayPool() {
    this(DEFAULT_SIZE, DEFAULT_ARRAY_LENGTH, new BlackholeStatsCollector());
  }

  /**
   * Default ctor.
   * @param size The number of array pairs to pre-allocate, at least 1.
   * @param array_length The length of each pooled array, at least 1.
   * @param stats A non-null stats collector.
   * @throws IllegalArgumentException if a size was less than 1 or stats
   * was null.
   */
  public PointArrayPool(final int size,
                        final int array_length,
                        final StatsCollector stats) {
    if (size < 1) {
      throw new IllegalArgumentException("Pool size must be at least 1.");
    }
    if (array_length < 1) {
      throw new IllegalArgumentException("Array length must be at least 1.");
    }
    if (stats == null) {
      throw new IllegalArgumentException("Stats collector cannot be null.");
    }
    this.array_length = array_length;
    this.stats = stats;
    pool = new ArrayBlockingQueue<PointArrays>(size);
    for (int i = 0; i < size; i++) {
      pool.offer(new PointArrays(array_length));
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Instantiated point pool with " + size
          + " entries with an array length of " + array_length);
    }
  }

  /**
   * Claims storage for at least the pooled array length.
   * @return A fresh, empty handle.
   */
  public PooledPoints claim() {
    return claim(array_length);
  }

  /**
   * Claims storage with room for at least the given number of points.
   * @param capacity The expected number of points.
   * @return A fresh, empty handle.
   */
  public PooledPoints claim(final int capacity) {
    if (capacity > array_length) {
      stats.incrementCounter("pointpool.claim.largeArray");
      return new PooledPoints(this, new PointArrays(capacity));
    }
    final PointArrays arrays = pool.poll();
    if (arrays == null) {
      stats.incrementCounter("pointpool.claim.miss");
      return new PooledPoints(this, new PointArrays(array_length));
    }
    stats.incrementCounter("pointpool.claim.success");
    return new PooledPoints(this, arrays);
  }

  /** @return The number of array pairs currently available. */
  public int available() {
    return pool.size();
  }

  /** @return The length of each pooled array. */
  public int arrayLength() {
    return array_length;
  }

  /**
   * Returns storage to the free list. Arrays of another length are replaced
   * with pool sized ones when there is room for them.
   * @param arrays The non-null arrays to return.
   */
  void offer(final PointArrays arrays) {
    if (arrays.timestamps.length != array_length) {
      if (pool.remainingCapacity() == 0) {
        return;
      }
      arrays.timestamps = new long[array_length];
      arrays.values = new double[array_length];
    }
    if (!pool.offer(arrays)) {
      stats.incrementCounter("pointpool.offer.failure");
      if (LOG.isTraceEnabled()) {
        LOG.trace("Pool was full, dropping returned arrays.");
      }
    }
  }

  /**
   * A pair of timestamp and value arrays. Contents are not cleared between
   * uses, the owning handle tracks how many entries are valid.
   */
  static final class PointArrays {
    long[] timestamps;
    double[] values;

    PointArrays(final int length) {
      timestamps = new long[length];
      values = new double[length];
    }
  }
}
