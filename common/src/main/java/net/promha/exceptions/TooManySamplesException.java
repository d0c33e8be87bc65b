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
package net.promha.exceptions;

/**
 * Thrown when a query would load more samples into memory than the
 * configured budget allows.
 *
 * @since 1.0
 */
public class TooManySamplesException extends QueryExecutionException {
  private static final long serialVersionUID = -1956443105318427130L;

  /** The configured maximum. */
  private final int max_samples;

  /**
   * Default ctor.
   * @param env Where the overflow happened, e.g. "query execution".
   * @param max_samples The configured budget.
   */
  public TooManySamplesException(final String env, final int max_samples) {
    super("query processing would load too many samples into memory in "
        + env, 422);
    this.max_samples = max_samples;
  }

  /** @return The configured maximum number of samples. */
  public int getMaxSamples() {
    return max_samples;
  }
}
