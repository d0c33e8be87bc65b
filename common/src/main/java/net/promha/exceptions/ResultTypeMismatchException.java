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
 * Thrown when a typed accessor is called on a result holding a different
 * value type.
 *
 * @since 1.0
 */
public class ResultTypeMismatchException extends QueryExecutionException {
  private static final long serialVersionUID = 3357926604861210722L;

  /**
   * Default ctor.
   * @param expected The requested type name.
   * @param actual The type name actually stored.
   */
  public ResultTypeMismatchException(final String expected,
                                     final String actual) {
    super("query result is not a " + expected + " but a " + actual, 400);
  }
}
