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
package net.promha.data;

/**
 * Wraps a {@link TimeSeriesIterator} and remembers the samples passed on
 * the way to the current position, as long as they fall within the
 * lookback window. This allows finding the most recent sample at or before
 * a time with a single forward pass when seeking in ascending order.
 * <p>
 * Seeking to a time before the previous seek target rewinds the underlying
 * iterator and rebuilds the buffer.
 * <p>
 * Not thread safe. Instances may be reused across series via
 * {@link #reset(TimeSeriesIterator)}.
 *
 * @since 1.0
 */
public class BufferedTimeSeriesIterator {
  private final SampleRing buffer;
  private TimeSeriesIterator iterator;

  /** Whether the underlying iterator is positioned on a sample. */
  private boolean ok;

  /** The timestamp of the current sample. */
  private long last_time;

  /** The target of the previous seek. */
  private long last_seek;

  /**
   * Ctor without an iterator. Call {@link #reset(TimeSeriesIterator)}
   * before use.
   * @param delta The lookback window in seconds.
   */
  public BufferedTimeSeriesIterator(final long delta) {
    this(null, delta);
  }

  /**
   * Default ctor.
   * @param iterator The iterator to wrap, may be null.
   * @param delta The lookback window in seconds.
   */
  public BufferedTimeSeriesIterator(final TimeSeriesIterator iterator,
                                    final long delta) {
    buffer = new SampleRing(delta, 16);
    reset(iterator);
  }

  /**
   * Binds a new iterator and clears the buffer.
   * @param iterator The iterator to wrap.
   */
  public void reset(final TimeSeriesIterator iterator) {
    this.iterator = iterator;
    ok = true;
    last_time = Long.MIN_VALUE;
    last_seek = Long.MIN_VALUE;
    buffer.reset();
  }

  /**
   * Advances to the first sample at or after the given time.
   * @param timestamp The time in seconds.
   * @return True if such a sample exists.
   */
  public boolean seek(final long timestamp) {
    final long t0 = timestamp - buffer.delta();
    if (t0 > last_time || timestamp < last_seek) {
      buffer.reset();
      ok = iterator.seek(t0);
      if (!ok) {
        last_seek = timestamp;
        return false;
      }
      last_time = iterator.timestamp();
    }
    last_seek = timestamp;

    if (last_time >= timestamp) {
      return true;
    }
    while (next()) {
      if (last_time >= timestamp) {
        return true;
      }
    }
    return false;
  }

  /**
   * Advances by one sample, buffering the current one.
   * @return True if positioned on a sample.
   */
  public boolean next() {
    if (!ok) {
      return false;
    }
    buffer.add(iterator.timestamp(), iterator.value());
    ok = iterator.next();
    if (ok) {
      last_time = iterator.timestamp();
    }
    return ok;
  }

  /** @return True once the underlying iterator ran past its last sample. */
  public boolean exhausted() {
    return !ok;
  }

  /** @return The timestamp of the current sample. */
  public long timestamp() {
    return iterator.timestamp();
  }

  /** @return The value of the current sample. */
  public double value() {
    return iterator.value();
  }

  /** @return The current sample. */
  public Point values() {
    return new Point(iterator.timestamp(), iterator.value());
  }

  /**
   * @param n 1 for the sample right before the current position, 2 for the
   * one before that and so on.
   * @return The buffered sample or null if not available.
   */
  public Point peekBack(final int n) {
    return buffer.nthLast(n);
  }

  /** @return The error of the underlying iterator, if any. */
  public Exception error() {
    return iterator.error();
  }
}
