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
package net.promha.query;

import java.util.Objects;

import com.google.common.base.Strings;

/**
 * The parameters of a single select against a backend. Times are Unix epoch
 * seconds and both ends are inclusive. A step of 0 means an instant query in
 * which case the start and end must be equal.
 *
 * @since 1.0
 */
public final class SelectParams {
  private final String query;
  private final long start;
  private final long end;
  private final long step;

  private SelectParams(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.query)) {
      throw new IllegalArgumentException("Query cannot be null or empty.");
    }
    if (builder.step < 0) {
      throw new IllegalArgumentException("Step cannot be negative: "
          + builder.step);
    }
    if (builder.end < builder.start) {
      throw new IllegalArgumentException("End " + builder.end
          + " cannot be before the start " + builder.start);
    }
    if (builder.step == 0 && builder.start != builder.end) {
      throw new IllegalArgumentException("Instant queries must have the "
          + "same start and end.");
    }
    query = builder.query;
    start = builder.start;
    end = builder.end;
    step = builder.step;
  }

  /** @return The query text passed to the backends. */
  public String query() {
    return query;
  }

  /** @return The start time in seconds. */
  public long start() {
    return start;
  }

  /** @return The end time in seconds. */
  public long end() {
    return end;
  }

  /** @return The step in seconds, 0 for instant queries. */
  public long step() {
    return step;
  }

  /** @return Whether or not this is an instant query. */
  public boolean isInstant() {
    return step == 0;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SelectParams)) {
      return false;
    }
    final SelectParams other = (SelectParams) o;
    return query.equals(other.query) &&
        start == other.start &&
        end == other.end &&
        step == other.step;
  }

  @Override
  public int hashCode() {
    return Objects.hash(query, start, end, step);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("query=")
        .append(query)
        .append(", start=")
        .append(start)
        .append(", end=")
        .append(end)
        .append(", step=")
        .append(step)
        .toString();
  }

  /**
   * @param query The query text.
   * @param timestamp The evaluation time in seconds.
   * @return Parameters for an instant query.
   */
  public static SelectParams instant(final String query, final long timestamp) {
    return newBuilder()
        .setQuery(query)
        .setStart(timestamp)
        .setEnd(timestamp)
        .build();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String query;
    private long start;
    private long end;
    private long step;

    public Builder setQuery(final String query) {
      this.query = query;
      return this;
    }

    public Builder setStart(final long start) {
      this.start = start;
      return this;
    }

    public Builder setEnd(final long end) {
      this.end = end;
      return this;
    }

    public Builder setStep(final long step) {
      this.step = step;
      return this;
    }

    public SelectParams build() {
      return new SelectParams(this);
    }
  }
}
