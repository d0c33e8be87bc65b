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
 * A single series: its identifying labels and a way to walk its samples.
 *
 * @since 1.0
 */
public interface TimeSeries {

  /** @return The non-null labels identifying the series. */
  public Labels labels();

  /** @return A new iterator over the samples. */
  public TimeSeriesIterator iterator();

}
