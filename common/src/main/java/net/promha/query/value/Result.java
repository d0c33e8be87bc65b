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
package net.promha.query.value;

import net.promha.exceptions.QueryExecutionException;
import net.promha.exceptions.ResultTypeMismatchException;

/**
 * The outcome of a query execution: either an error or a value. The typed
 * accessors throw the stored error first and a
 * {@link ResultTypeMismatchException} if the value is of another type.
 *
 * @since 1.0
 */
public class Result {
  private final Exception error;
  private final Value value;

  private Result(final Exception error, final Value value) {
    this.error = error;
    this.value = value;
  }

  /**
   * @param value The non-null value.
   * @return A successful result.
   */
  public static Result ofValue(final Value value) {
    if (value == null) {
      throw new IllegalArgumentException("Value cannot be null.");
    }
    return new Result(null, value);
  }

  /**
   * @param error The non-null error.
   * @return A failed result.
   */
  public static Result ofError(final Exception error) {
    if (error == null) {
      throw new IllegalArgumentException("Error cannot be null.");
    }
    return new Result(error, null);
  }

  /** @return The error if the query failed, null otherwise. */
  public Exception error() {
    return error;
  }

  /** @return The value if the query succeeded, null otherwise. */
  public Value value() {
    return value;
  }

  /** @return The vector. */
  public Vector vector() {
    return (Vector) typed(ValueType.VECTOR);
  }

  /** @return The matrix. */
  public Matrix matrix() {
    return (Matrix) typed(ValueType.MATRIX);
  }

  /** @return The scalar. */
  public Scalar scalar() {
    return (Scalar) typed(ValueType.SCALAR);
  }

  /** @return The string. */
  public StringValue stringValue() {
    return (StringValue) typed(ValueType.STRING);
  }

  private Value typed(final ValueType expected) {
    if (error != null) {
      if (error instanceof RuntimeException) {
        throw (RuntimeException) error;
      }
      throw new QueryExecutionException(error.getMessage(), 500, error);
    }
    if (value.type() != expected) {
      throw new ResultTypeMismatchException(expected.wireName(),
          value.type().wireName());
    }
    return value;
  }

  @Override
  public String toString() {
    if (error != null) {
      return error.getMessage();
    }
    return value.toString();
  }
}
