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
 * Exception bubbled up when a query is canceled, either explicitly by the
 * caller or because a downstream request was aborted.
 *
 * @since 1.0
 */
public class QueryExecutionCanceled extends QueryExecutionException {
  private static final long serialVersionUID = -2225712915698705683L;

  /** The phase the query was in. */
  private final QueryPhase phase;

  /**
   * Default ctor for a query canceled in the given phase.
   * @param phase The non-null phase the query was in.
   */
  public QueryExecutionCanceled(final QueryPhase phase) {
    super("query was canceled in " + phase.description(), 400);
    this.phase = phase;
  }

  /**
   * Ctor that sets a descriptive message and status code. Used by remote
   * executors when their request is canceled.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   */
  public QueryExecutionCanceled(final String msg, final int status_code) {
    super(msg, status_code);
    phase = QueryPhase.EVALUATION;
  }

  /** @return The phase the query was canceled in. */
  public QueryPhase getPhase() {
    return phase;
  }
}
