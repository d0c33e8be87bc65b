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
 * Thrown when the query deadline expired.
 *
 * @since 1.0
 */
public class QueryTimeoutException extends QueryExecutionException {
  private static final long serialVersionUID = 4131808466284035547L;

  /** The phase the query was in. */
  private final QueryPhase phase;

  /**
   * Default ctor.
   * @param phase The non-null phase the query was in when it expired.
   */
  public QueryTimeoutException(final QueryPhase phase) {
    super("query timed out in " + phase.description(), 408);
    this.phase = phase;
  }

  /** @return The phase the query was in when it timed out. */
  public QueryPhase getPhase() {
    return phase;
  }
}
