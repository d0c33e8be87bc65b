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
 * Iterates over the samples of one series in ascending timestamp order.
 * Before the first successful {@link #seek(long)} or {@link #next()} the
 * iterator is not positioned and {@link #timestamp()} and {@link #value()}
 * are undefined.
 *
 * @since 1.0
 */
public interface TimeSeriesIterator {

  /**
   * Positions the iterator on the first sample with a timestamp at or after
   * the given time. Positioning is absolute, i.e. a seek to an earlier time
   * rewinds.
   * @param timestamp The time in seconds.
   * @return True if such a sample exists.
   */
  public boolean seek(final long timestamp);

  /**
   * Advances by one sample.
   * @return True if the iterator is positioned on a sample.
   */
  public boolean next();

  /** @return The timestamp of the current sample in seconds. */
  public long timestamp();

  /** @return The value of the current sample. */
  public double value();

  /** @return An error that stopped iteration or null. */
  public Exception error();

}
