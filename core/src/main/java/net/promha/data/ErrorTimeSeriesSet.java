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

/**
 * An empty set that only reports an error.
 *
 * @since 1.0
 */
public class ErrorTimeSeriesSet implements TimeSeriesSet {
  private final Exception error;

  /**
   * Default ctor.
   * @param error The non-null error.
   */
  public ErrorTimeSeriesSet(final Exception error) {
    if (error == null) {
      throw new IllegalArgumentException("Error cannot be null.");
    }
    this.error = error;
  }

  @Override
  public boolean next() {
    return false;
  }

  @Override
  public TimeSeries at() {
    throw new IllegalStateException("Error sets do not contain series.");
  }

  @Override
  public Exception error() {
    return error;
  }
}
