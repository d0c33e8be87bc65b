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

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;

import net.promha.data.Point;

/**
 * An append-only list of points backed by arrays claimed from a
 * {@link PointArrayPool}. Points must be appended in ascending timestamp
 * order. The handle grows its arrays as needed, in which case the storage
 * is no longer pool sized and is simply dropped on release.
 *
 * @since 1.0
 */
public class PooledPoints implements PooledObject {

  /** The pool we came from. */
  private final PointArrayPool pool;

  /** Set exactly once on release. */
  private final AtomicBoolean released;

  /** The storage, null after release. */
  private volatile PointArrayPool.PointArrays arrays;

  /** The number of valid entries. */
  private int size;

  PooledPoints(final PointArrayPool pool,
               final PointArrayPool.PointArrays arrays) {
    this.pool = pool;
    this.arrays = arrays;
    released = new AtomicBoolean();
  }

  /**
   * Appends a point.
   * @param timestamp The timestamp in seconds, greater than the last.
   * @param value The value.
   * @throws IllegalStateException if the handle was released.
   * @throws IllegalArgumentException if the timestamp was not greater than
   * the last appended timestamp.
   */
  public void add(final long timestamp, final double value) {
    final PointArrayPool.PointArrays storage = storage();
    if (size > 0 && timestamp <= storage.timestamps[size - 1]) {
      throw new IllegalArgumentException("Timestamp " + timestamp
          + " must be greater than the last timestamp "
          + storage.timestamps[size - 1]);
    }
    if (size >= storage.timestamps.length) {
      final int length = storage.timestamps.length * 2;
      storage.timestamps = Arrays.copyOf(storage.timestamps, length);
      storage.values = Arrays.copyOf(storage.values, length);
    }
    storage.timestamps[size] = timestamp;
    storage.values[size] = value;
    size++;
  }

  /** @return The number of points stored. */
  public int size() {
    storage();
    return size;
  }

  /**
   * @param index A zero based index less than {@link #size()}.
   * @return The timestamp at the index in seconds.
   */
  public long timestamp(final int index) {
    checkIndex(index);
    return arrays.timestamps[index];
  }

  /**
   * @param index A zero based index less than {@link #size()}.
   * @return The value at the index.
   */
  public double value(final int index) {
    checkIndex(index);
    return arrays.values[index];
  }

  /**
   * @param index A zero based index less than {@link #size()}.
   * @return A new point for the index.
   */
  public Point point(final int index) {
    checkIndex(index);
    return new Point(arrays.timestamps[index], arrays.values[index]);
  }

  @Override
  public Object object() {
    return storage();
  }

  @Override
  public void release() {
    if (!released.compareAndSet(false, true)) {
      throw new IllegalStateException("Points were already released.");
    }
    final PointArrayPool.PointArrays storage = arrays;
    arrays = null;
    size = 0;
    pool.offer(storage);
  }

  @Override
  public boolean released() {
    return released.get();
  }

  private PointArrayPool.PointArrays storage() {
    final PointArrayPool.PointArrays storage = arrays;
    if (storage == null) {
      throw new IllegalStateException("Points were already released.");
    }
    return storage;
  }

  private void checkIndex(final int index) {
    storage();
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException("Index " + index
          + " out of bounds for size " + size);
    }
  }

  @Override
  public String toString() {
    return "PooledPoints{size=" + size + ", released=" + released.get() + "}";
  }
}
