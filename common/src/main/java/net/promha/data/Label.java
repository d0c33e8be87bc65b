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

import java.util.Objects;

import com.google.common.collect.ComparisonChain;

/**
 * An immutable name and value pair. Part of a {@link Labels} set.
 *
 * @since 1.0
 */
public final class Label implements Comparable<Label> {

  /** The label name. */
  private final String name;

  /** The label value. */
  private final String value;

  /**
   * Default ctor.
   * Names and values are checked for legality by {@link LabelValidator}.
   * @param name A non-null name.
   * @param value A non-null value, may be empty.
   * @throws IllegalArgumentException if the name or value was null.
   */
  public Label(final String name, final String value) {
    if (name == null) {
      throw new IllegalArgumentException("Label name cannot be null.");
    }
    if (value == null) {
      throw new IllegalArgumentException("Label value cannot be null.");
    }
    this.name = name;
    this.value = value;
  }

  /** @return The label name. */
  public String name() {
    return name;
  }

  /** @return The label value. */
  public String value() {
    return value;
  }

  @Override
  public int compareTo(final Label o) {
    return ComparisonChain.start()
        .compare(name, o.name)
        .compare(value, o.value)
        .result();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Label)) {
      return false;
    }
    final Label other = (Label) o;
    return name.equals(other.name) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, value);
  }

  @Override
  public String toString() {
    return name + "=\"" + value + "\"";
  }
}
