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
 * A list of samples that all share the same evaluation timestamp. A vector
 * never holds two samples with the same labels.
 *
 * @since 1.0
 */
public class Vector implements Value, Iterable<Sample> {
  private final List<Sample> samples;

  /** Ctor for an empty vector. */
  public Vector() {
    samples = Lists.newArrayList();
  }

  /**
   * Ctor wrapping the given samples.
   * @param samples A non-null list of samples.
   */
  public Vector(final List<Sample> samples) {
    if (samples == null) {
      throw new IllegalArgumentException("Samples cannot be null.");
    }
    this.samples = Lists.newArrayList(samples);
  }

  @Override
  public ValueType type() {
    return ValueType.VECTOR;
  }

  /** @param sample A non-null sample to append. */
  public void add(final Sample sample) {
    samples.add(sample);
  }

  /** @return An unmodifiable view of the samples. */
  public List<Sample> samples() {
    return Collections.unmodifiableList(samples);
  }

  /** @return The number of samples. */
  public int size() {
    return samples.size();
  }

  /** @return True if two or more samples carry the same labels. */
  public boolean containsSameLabelset() {
    final Set<Labels> seen = Sets.newHashSetWithExpectedSize(samples.size());
    for (final Sample sample : samples) {
      if (!seen.add(sample.metric())) {
        return true;
      }
    }
    return false;
  }

  @Override
  public Iterator<Sample> iterator() {
    return samples().iterator();
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    for (int i = 0; i < samples.size(); i++) {
      if (i > 0) {
        buf.append("\n");
      }
      buf.append(samples.get(i));
    }
    return buf.toString();
  }
}
