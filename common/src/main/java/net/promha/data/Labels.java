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

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.hash.Hasher;

import net.promha.common.Const;

/**
 * An immutable, by-name sorted set of uniquely named {@link Label}s that
 * identifies a time series. Two instances with the same content are the
 * same series regardless of where they were decoded or merged.
 * <p>
 * Ordering compares label by label, name first then value. If one set is
 * a prefix of the other, the shorter sorts first.
 *
 * @since 1.0
 */
public final class Labels implements Comparable<Labels>, Iterable<Label> {

  /** An empty set. */
  public static final Labels EMPTY = new Labels(new Label[0]);

  /** The sorted labels. */
  private final Label[] labels;

  /** A cached hash, computed lazily. */
  private volatile long cached_hash;

  private Labels(final Label[] labels) {
    this.labels = labels;
  }

  /**
   * Builds a set from alternating name and value strings.
   * @param pairs An even number of strings, name then value.
   * @return The sorted set.
   * @throws IllegalArgumentException if the count was odd or a name was
   * repeated.
   */
  public static Labels of(final String... pairs) {
    if (pairs.length % 2 != 0) {
      throw new IllegalArgumentException("Labels must be given as name and "
          + "value pairs.");
    }
    final Builder builder = newBuilder();
    for (int i = 0; i < pairs.length; i += 2) {
      builder.addLabel(pairs[i], pairs[i + 1]);
    }
    return builder.build();
  }

  /**
   * Builds a set from a map of names to values.
   * @param map A non-null map.
   * @return The sorted set.
   */
  public static Labels fromMap(final Map<String, String> map) {
    final Builder builder = newBuilder();
    for (final Entry<String, String> entry : map.entrySet()) {
      builder.addLabel(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  /** @return The number of labels in the set. */
  public int size() {
    return labels.length;
  }

  /** @return Whether or not the set is empty. */
  public boolean isEmpty() {
    return labels.length == 0;
  }

  /**
   * @param index A zero based index.
   * @return The label at the index.
   */
  public Label get(final int index) {
    return labels[index];
  }

  /**
   * Finds the value of the label with the given name.
   * @param name The label name.
   * @return The value or null if no such label exists.
   */
  public String value(final String name) {
    for (final Label label : labels) {
      final int cmp = label.name().compareTo(name);
      if (cmp == 0) {
        return label.value();
      }
      if (cmp > 0) {
        break;
      }
    }
    return null;
  }

  /** @return The metric name, i.e. the value of {@code __name__} or null. */
  public String metricName() {
    return value(Const.METRIC_NAME_LABEL);
  }

  /** @return An unmodifiable view of the sorted labels. */
  public List<Label> asList() {
    return Collections.unmodifiableList(Arrays.asList(labels));
  }

  /** @return A sorted, modifiable copy of the labels as a map. */
  public Map<String, String> toMap() {
    final Map<String, String> map = Maps.newTreeMap();
    for (final Label label : labels) {
      map.put(label.name(), label.value());
    }
    return map;
  }

  /** @return A stable 64 bit hash over the sorted content. */
  public long hash() {
    long hash = cached_hash;
    if (hash == 0) {
      final Hasher hasher = Const.HASH_FUNCTION().newHasher();
      for (final Label label : labels) {
        hasher.putString(label.name(), Const.UTF8_CHARSET);
        hasher.putByte((byte) 0xff);
        hasher.putString(label.value(), Const.UTF8_CHARSET);
        hasher.putByte((byte) 0xff);
      }
      hash = hasher.hash().asLong();
      cached_hash = hash;
    }
    return hash;
  }

  @Override
  public Iterator<Label> iterator() {
    return asList().iterator();
  }

  @Override
  public int compareTo(final Labels o) {
    final int len = Math.min(labels.length, o.labels.length);
    for (int i = 0; i < len; i++) {
      final int cmp = labels[i].compareTo(o.labels[i]);
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(labels.length, o.labels.length);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Labels)) {
      return false;
    }
    return Arrays.equals(labels, ((Labels) o).labels);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(hash());
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder().append("{");
    for (int i = 0; i < labels.length; i++) {
      if (i > 0) {
        buf.append(", ");
      }
      buf.append(labels[i]);
    }
    return buf.append("}").toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Collects labels in any order and sorts them on build.
   */
  public static class Builder {
    private final List<Label> labels = Lists.newArrayList();

    /**
     * @param name A non-null label name.
     * @param value A non-null label value.
     * @return The builder.
     */
    public Builder addLabel(final String name, final String value) {
      labels.add(new Label(name, value));
      return this;
    }

    /**
     * @param label A non-null label.
     * @return The builder.
     */
    public Builder addLabel(final Label label) {
      if (label == null) {
        throw new IllegalArgumentException("Label cannot be null.");
      }
      labels.add(label);
      return this;
    }

    /**
     * @return The immutable sorted set.
     * @throws IllegalArgumentException if a name appeared more than once.
     */
    public Labels build() {
      if (labels.isEmpty()) {
        return EMPTY;
      }
      final Label[] sorted = labels.toArray(new Label[labels.size()]);
      Arrays.sort(sorted);
      for (int i = 1; i < sorted.length; i++) {
        if (sorted[i].name().equals(sorted[i - 1].name())) {
          throw new IllegalArgumentException("Duplicate label name: "
              + sorted[i].name());
        }
      }
      return new Labels(sorted);
    }
  }
}
