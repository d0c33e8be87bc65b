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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Strings;

import net.promha.utils.DateTime;

/**
 * One Prometheus compatible replica to read from.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(builder = BackendConfig.Builder.class)
public class BackendConfig {
  public static final String DEFAULT_TIMEOUT = "30s";

  /** The base URL, e.g. http://prom-a:9090 */
  private final String endpoint;

  /** The per request timeout as a duration string. */
  private final String timeout;

  /**
   * Default ctor.
   * @param builder A non-null builder.
   * @throws IllegalArgumentException if the endpoint was missing or not an
   * HTTP URL or the timeout was malformed.
   */
  protected BackendConfig(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.endpoint)) {
      throw new IllegalArgumentException("Backend endpoint cannot be null "
          + "or empty.");
    }
    if (!builder.endpoint.startsWith("http://") &&
        !builder.endpoint.startsWith("https://")) {
      throw new IllegalArgumentException("Backend endpoint must be an http "
          + "or https URL: " + builder.endpoint);
    }
    endpoint = builder.endpoint;
    timeout = Strings.isNullOrEmpty(builder.timeout) ?
        DEFAULT_TIMEOUT : builder.timeout;
    DateTime.parseDuration(timeout);
  }

  public String getEndpoint() {
    return endpoint;
  }

  /** @return The timeout as a duration string like "30s". */
  public String getTimeout() {
    return timeout;
  }

  /** @return The timeout in milliseconds. */
  public long timeoutMs() {
    return DateTime.parseDuration(timeout);
  }

  @Override
  public String toString() {
    return endpoint + " (timeout " + timeout + ")";
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Builder {
    @JsonProperty
    private String endpoint;
    @JsonProperty
    private String timeout;

    Builder() {
    }

    public Builder setEndpoint(final String endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    /**
     * @param timeout A duration like "30s". Defaults to
     * {@link BackendConfig#DEFAULT_TIMEOUT}.
     * @return The builder.
     */
    public Builder setTimeout(final String timeout) {
      this.timeout = timeout;
      return this;
    }

    public BackendConfig build() {
      return new BackendConfig(this);
    }
  }
}
