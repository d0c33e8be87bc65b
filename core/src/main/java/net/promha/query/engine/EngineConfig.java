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
package net.promha.query.engine;

import net.promha.common.Const;

/**
 * Limits and defaults for a {@link QueryEngine}.
 *
 * @since 1.0
 */
public class EngineConfig {
  public static final int DEFAULT_MAX_CONCURRENT = 20;
  public static final int DEFAULT_MAX_SAMPLES = 50000000;
  public static final long DEFAULT_TIMEOUT_MS = 120000;

  /** Queries allowed to execute at once. */
  private final int max_concurrent;

  /** Points a single query may load. */
  private final int max_samples;

  /** The deadline of a query in milliseconds. */
  private final long timeout_ms;

  /** How far back to look for a sample, in seconds. */
  private final long lookback_delta;

  protected EngineConfig(final Builder builder) {
    if (builder.maxConcurrent < 1) {
      throw new IllegalArgumentException("Max concurrent must be at least 1: "
          + builder.maxConcurrent);
    }
    if (builder.maxSamples < 1) {
      throw new IllegalArgumentException("Max samples must be at least 1: "
          + builder.maxSamples);
    }
    if (builder.timeout < 0) {
      throw new IllegalArgumentException("Timeout cannot be negative: "
          + builder.timeout);
    }
    if (builder.lookbackDelta < 1) {
      throw new IllegalArgumentException("Lookback delta must be at least "
          + "one second: " + builder.lookbackDelta);
    }
    max_concurrent = builder.maxConcurrent;
    max_samples = builder.maxSamples;
    timeout_ms = builder.timeout;
    lookback_delta = builder.lookbackDelta;
  }

  /** @return Queries allowed to execute at once. */
  public int getMaxConcurrent() {
    return max_concurrent;
  }

  /** @return Points a single query may load. */
  public int getMaxSamples() {
    return max_samples;
  }

  /** @return The deadline of a query in milliseconds, 0 for none. */
  public long getTimeout() {
    return timeout_ms;
  }

  /** @return The lookback window in seconds. */
  public long getLookbackDelta() {
    return lookback_delta;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("maxConcurrent=")
        .append(max_concurrent)
        .append(", maxSamples=")
        .append(max_samples)
        .append(", timeout=")
        .append(timeout_ms)
        .append("ms, lookbackDelta=")
        .append(lookback_delta)
        .append("s")
        .toString();
  }

  /** @return A config with every default. */
  public static EngineConfig defaults() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private int maxConcurrent = DEFAULT_MAX_CONCURRENT;
    private int maxSamples = DEFAULT_MAX_SAMPLES;
    private long timeout = DEFAULT_TIMEOUT_MS;
    private long lookbackDelta = Const.DEFAULT_LOOKBACK_SECONDS;

    public Builder setMaxConcurrent(final int max_concurrent) {
      maxConcurrent = max_concurrent;
      return this;
    }

    public Builder setMaxSamples(final int max_samples) {
      maxSamples = max_samples;
      return this;
    }

    /**
     * @param timeout_ms The query deadline in milliseconds. 0 disables it.
     * @return The builder.
     */
    public Builder setTimeout(final long timeout_ms) {
      timeout = timeout_ms;
      return this;
    }

    /**
     * @param lookback_delta The lookback window in seconds.
     * @return The builder.
     */
    public Builder setLookbackDelta(final long lookback_delta) {
      lookbackDelta = lookback_delta;
      return this;
    }

    public EngineConfig build() {
      return new EngineConfig(this);
    }
  }
}
