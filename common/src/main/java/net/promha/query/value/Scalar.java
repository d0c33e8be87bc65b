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

/**
 * A timestamped value that isn't associated with a series.
 *
 * @since 1.0
 */
public final class Scalar implements Value {
  private final long timestamp;
  private final double value;

  /**
   * Default ctor.
   * @param timestamp The timestamp in seconds.
   * @param value The value.
   */
  public Scalar(final long timestamp, final double value) {
    this.timestamp = timestamp;
    this.value = value;
  }

  @Override
  public ValueType type() {
    return ValueType.SCALAR;
  }

  /** @return The timestamp in seconds. */
  public long timestamp() {
    return timestamp;
  }

  /** @return The value. */
  public double value() {
    return value;
  }

  @Override
  public String toString() {
    return "scalar: " + value + " @[" + timestamp + "]";
  }
}
