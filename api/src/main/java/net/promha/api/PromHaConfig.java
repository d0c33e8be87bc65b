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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;

import net.promha.query.engine.EngineConfig;
import net.promha.query.merge.MergeStrategies;
import net.promha.query.merge.SampleMergeStrategy;
import net.promha.utils.DateTime;
import net.promha.utils.JSONException;
import net.promha.utils.YAML;

/**
 * The top level configuration: the redundant backends to read from, the
 * engine limits and the merge strategy used when replicas disagree. Loaded
 * from YAML or JSON, e.g.
 * <pre>
 * backends:
 *   - endpoint: http://prom-a:9090
 *     timeout: 30s
 *   - endpoint: http://prom-b:9090
 * maxConcurrent: 20
 * maxSamples: 50000000
 * timeout: 2m
 * lookbackDelta: 5m
 * mergeStrategy: priority
 * pool:
 *   size: 1024
 *   arrayLength: 128
 * </pre>
 * The order of the backends is their priority.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(builder = PromHaConfig.Builder.class)
public class PromHaConfig {
  public static final String DEFAULT_TIMEOUT = "2m";
  public static final String DEFAULT_LOOKBACK_DELTA = "5m";

  /** The non-empty list of backends, highest priority first. */
  private final List<BackendConfig> backends;

  private final int max_concurrent;

  private final int max_samples;

  /** The query deadline as a duration string. */
  private final String timeout;

  /** The lookback window as a duration string. */
  private final String lookback_delta;

  /** The name of the tie break used when replicas disagree. */
  private final String merge_strategy;

  private final PoolConfig pool;

  /**
   * Default ctor.
   * @param builder A non-null builder.
   * @throws IllegalArgumentException if no backend was given, a duration
   * was malformed, a limit was less than 1 or the merge strategy is
   * unknown.
   */
  protected PromHaConfig(final Builder builder) {
    if (builder.backends == null || builder.backends.isEmpty()) {
      throw new IllegalArgumentException("At least one backend must be "
          + "configured.");
    }
    if (builder.maxConcurrent < 1) {
      throw new IllegalArgumentException("Max concurrent must be at least 1: "
          + builder.maxConcurrent);
    }
    if (builder.maxSamples < 1) {
      throw new IllegalArgumentException("Max samples must be at least 1: "
          + builder.maxSamples);
    }
    backends = Collections.unmodifiableList(
        Lists.newArrayList(builder.backends));
    max_concurrent = builder.maxConcurrent;
    max_samples = builder.maxSamples;
    timeout = Strings.isNullOrEmpty(builder.timeout) ?
        DEFAULT_TIMEOUT : builder.timeout;
    lookback_delta = Strings.isNullOrEmpty(builder.lookbackDelta) ?
        DEFAULT_LOOKBACK_DELTA : builder.lookbackDelta;
    merge_strategy = Strings.isNullOrEmpty(builder.mergeStrategy) ?
        MergeStrategies.DEFAULT : builder.mergeStrategy;
    pool = builder.pool == null ? PoolConfig.defaults() : builder.pool;

    // validate
    DateTime.parseDuration(timeout);
    DateTime.parseDurationSeconds(lookback_delta);
    MergeStrategies.forName(merge_strategy);
  }

  /** @return The non-empty list of backends, highest priority first. */
  public List<BackendConfig> getBackends() {
    return backends;
  }

  public int getMaxConcurrent() {
    return max_concurrent;
  }

  public int getMaxSamples() {
    return max_samples;
  }

  /** @return The query deadline, e.g. "2m". */
  public String getTimeout() {
    return timeout;
  }

  /** @return The lookback window, e.g. "5m". */
  public String getLookbackDelta() {
    return lookback_delta;
  }

  public String getMergeStrategy() {
    return merge_strategy;
  }

  public PoolConfig getPool() {
    return pool;
  }

  /** @return The strategy named by {@link #getMergeStrategy()}. */
  public SampleMergeStrategy mergeStrategy() {
    return MergeStrategies.forName(merge_strategy);
  }

  /** @return The engine limits from this config. */
  public EngineConfig toEngineConfig() {
    return EngineConfig.newBuilder()
        .setMaxConcurrent(max_concurrent)
        .setMaxSamples(max_samples)
        .setTimeout(DateTime.parseDuration(timeout))
        .setLookbackDelta(DateTime.parseDurationSeconds(lookback_delta))
        .build();
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("backends=")
        .append(backends)
        .append(", maxConcurrent=")
        .append(max_concurrent)
        .append(", maxSamples=")
        .append(max_samples)
        .append(", timeout=")
        .append(timeout)
        .append(", lookbackDelta=")
        .append(lookback_delta)
        .append(", mergeStrategy=")
        .append(merge_strategy)
        .toString();
  }

  /**
   * Parses a YAML or JSON document.
   * @param yaml The non-null and non-empty document.
   * @return The config.
   * @throws IllegalArgumentException if the document was malformed or
   * failed validation.
   */
  public static PromHaConfig parse(final String yaml) {
    return YAML.parseToObject(yaml, PromHaConfig.class);
  }

  /**
   * Parses a YAML or JSON document from a stream.
   * @param stream The non-null stream to read.
   * @return The config.
   * @throws IllegalArgumentException if the document was malformed or
   * failed validation.
   */
  public static PromHaConfig parse(final InputStream stream) {
    return YAML.parseToObject(stream, PromHaConfig.class);
  }

  /**
   * Loads the config from a file.
   * @param path The non-null path to a YAML or JSON file.
   * @return The config.
   * @throws IllegalArgumentException if the file was malformed or failed
   * validation.
   * @throws JSONException if the file could not be read.
   */
  public static PromHaConfig load(final Path path) {
    if (path == null) {
      throw new IllegalArgumentException("Path cannot be null.");
    }
    try (final InputStream stream = Files.newInputStream(path)) {
      return parse(stream);
    } catch (IOException e) {
      throw new JSONException("Unable to read config file " + path, e);
    }
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Builder {
    @JsonProperty
    private List<BackendConfig> backends;
    @JsonProperty
    private int maxConcurrent = EngineConfig.DEFAULT_MAX_CONCURRENT;
    @JsonProperty
    private int maxSamples = EngineConfig.DEFAULT_MAX_SAMPLES;
    @JsonProperty
    private String timeout;
    @JsonProperty
    private String lookbackDelta;
    @JsonProperty
    private String mergeStrategy;
    @JsonProperty
    private PoolConfig pool;

    Builder() {
    }

    public Builder setBackends(final List<BackendConfig> backends) {
      this.backends = backends;
      return this;
    }

    public Builder addBackend(final BackendConfig backend) {
      if (backends == null) {
        backends = Lists.newArrayList();
      }
      backends.add(backend);
      return this;
    }

    public Builder setMaxConcurrent(final int max_concurrent) {
      maxConcurrent = max_concurrent;
      return this;
    }

    public Builder setMaxSamples(final int max_samples) {
      maxSamples = max_samples;
      return this;
    }

    /**
     * @param timeout The query deadline, e.g. "2m".
     * @return The builder.
     */
    public Builder setTimeout(final String timeout) {
      this.timeout = timeout;
      return this;
    }

    /**
     * @param lookback_delta The lookback window, at least one second, e.g.
     * "5m".
     * @return The builder.
     */
    public Builder setLookbackDelta(final String lookback_delta) {
      lookbackDelta = lookback_delta;
      return this;
    }

    public Builder setMergeStrategy(final String merge_strategy) {
      mergeStrategy = merge_strategy;
      return this;
    }

    public Builder setPool(final PoolConfig pool) {
      this.pool = pool;
      return this;
    }

    public PromHaConfig build() {
      return new PromHaConfig(this);
    }
  }
}
