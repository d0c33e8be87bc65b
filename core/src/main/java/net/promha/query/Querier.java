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

import com.stumbleupon.async.Deferred;

import net.promha.data.TimeSeriesSet;

/**
 * Reads series for one query.
 *
 * @since 1.0
 */
public interface Querier {

  /**
   * Executes the select.
   * @param params The non-null parameters.
   * @return A deferred resolving to the set of series or an exception.
   */
  public Deferred<TimeSeriesSet> select(final SelectParams params);

  /** Releases any resources held by the querier. */
  public void close();

}
