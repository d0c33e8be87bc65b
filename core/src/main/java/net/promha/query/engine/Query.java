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

import net.promha.query.SelectParams;
import net.promha.query.value.Result;

/**
 * A single instant or range query created by a {@link QueryEngine}.
 *
 * @since 1.0
 */
public interface Query {

  /**
   * Runs the query and blocks until it completes, fails or times out.
   * Failures are returned as an error {@link Result}, never thrown.
   * @return The non-null result.
   * @throws IllegalStateException if the query was already executed.
   */
  public Result exec();

  /** Cancels the query. A no-op if it already finished. */
  public void cancel();

  /**
   * Returns the storage backing the result to the pool. The result must
   * not be used afterwards.
   * @throws IllegalStateException if the query was already closed.
   */
  public void close();

  /** @return The current state. */
  public QueryState state();

  /** @return The parameters of the query. */
  public SelectParams params();

}
