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
package net.promha.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import net.promha.pools.PointArrayPool;

/**
 * Sizing of the point array pool.
 *
 * @since 1.0
 */
@JsonDeserialize(builder = PoolConfig.Builder.class)
public class PoolConfig {
  private final int size;
  private final int array_length;

  protected PoolConfig(final Builder builder) {
    if (builder.size < 1) {
      throw new IllegalArgumentException("Pool size must be at least 1: "
          + builder.size);
    }
    if (builder.arrayLength < 1) {
      throw new IllegalArgumentException("Pool array length must be at "
          + "least 1: " + builder.arrayLength);
    }
    size = builder.size;
    array_length = builder.arrayLength;
  }

  /** @return The number of pre-allocated array pairs. */
  public int getSize() {
    return size;
  }

  /** @return The length of each pooled array. */
  public int getArrayLength() {
    return array_length;
  }

  /** @return A config with the pool defaults. */
  public static PoolConfig defaults() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Builder {
    @JsonProperty
    private int size = PointArrayPool.DEFAULT_SIZE;
    @JsonProperty
    private int arrayLength = PointArrayPool.DEFAULT_ARRAY_LENGTH;

    Builder() {
    }

    public Builder setSize(final int size) {
      this.size = size;
      return this;
    }

    public Builder setArrayLength(final int array_length) {
      arrayLength = array_length;
      return this;
    }

    public PoolConfig build() {
      return new PoolConfig(this);
    }
  }
}
