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

/**
 * The kinds of values a query can produce. The name is what appears as the
 * {@code resultType} on the wire.
 *
 * @since 1.0
 */
public enum ValueType {
  VECTOR("vector"),
  MATRIX("matrix"),
  SCALAR("scalar"),
  STRING("string");

  private final String wire_name;

  private ValueType(final String wire_name) {
    this.wire_name = wire_name;
  }

  /** @return The lower case name used in responses. */
  public String wireName() {
    return wire_name;
  }
}
