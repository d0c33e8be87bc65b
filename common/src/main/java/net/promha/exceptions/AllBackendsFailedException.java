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

import java.util.List;

/**
 * Thrown when every configured backend failed for a query. The individual
 * exceptions are available via {@link #getExceptions()} in backend priority
 * order and the status code is the highest one found among them, or 500 if
 * none carried a code.
 *
 * @since 1.0
 */
public class AllBackendsFailedException extends QueryExecutionException {
  private static final long serialVersionUID = -8213542718356206741L;

  /**
   * Default ctor.
   * @param exceptions The non-null list of backend exceptions.
   */
  public AllBackendsFailedException(final List<Exception> exceptions) {
    super("All " + exceptions.size() + " backends failed to respond",
        highestStatus(exceptions), exceptions);
  }

  static int highestStatus(final List<Exception> exceptions) {
    int status = 0;
    for (final Exception e : exceptions) {
      if (e instanceof QueryExecutionException &&
          ((QueryExecutionException) e).getStatusCode() > status) {
        status = ((QueryExecutionException) e).getStatusCode();
      }
    }
    return status == 0 ? 500 : status;
  }
}
