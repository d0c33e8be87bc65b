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
package net.promha.query.value;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import net.promha.data.Labels;

/**
 * A list of series sorted by their labels. A matrix never holds two series
 * with the same labels. Since series own pooled storage, the matrix must be
 * released once the caller is finished with it.
 *
 * @since 1.0
 */
public class Matrix implements Value, Iterable<Series> {
  private final List<Series> series;

  /** Ctor for an empty matrix. */
  public Matrix() {
    series = Lists.newArrayList();
  }

  @Override
  public ValueType type() {
    return ValueType.MATRIX;
  }

  /** @param s A non-null series to append. */
  public void add(final Series s) {
    series.add(s);
  }

  /** Sorts the series by labels. */
  public void sort() {
    Collections.sort(series, (a, b) -> a.metric().compareTo(b.metric()));
  }

  /** @return An unmodifiable view of the series. */
  public List<Series> series() {
    return Collections.unmodifiableList(series);
  }

  /** @return The number of series. */
  public int size() {
    return series.size();
  }

  /** @return The total number of points across all series. */
  public int totalSamples() {
    int total = 0;
    for (final Series s : series) {
      total += s.size();
    }
    return total;
  }

  /** @return True if two or more series carry the same labels. */
  public boolean containsSameLabelset() {
    final Set<Labels> seen = Sets.newHashSetWithExpectedSize(series.size());
    for (final Series s : series) {
      if (!seen.add(s.metric())) {
        return true;
      }
    }
    return false;
  }

  /**
   * Releases the storage of every series.
   * @throws IllegalStateException if any series was already released.
   */
  public void release() {
    IllegalStateException error = null;
    for (final Series s : series) {
      try {
        s.release();
      } catch (IllegalStateException e) {
        error = e;
      }
    }
    if (error != null) {
      throw error;
    }
  }

  @Override
  public Iterator<Series> iterator() {
    return series().iterator();
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    for (int i = 0; i < series.size(); i++) {
      if (i > 0) {
        buf.append("\n");
      }
      buf.append(series.get(i));
    }
    return buf.toString();
  }
}
