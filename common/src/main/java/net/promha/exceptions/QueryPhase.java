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
 * The phase a query was in when it was aborted. Used to tell a query that
 * never got a slot apart from one that was already fetching or sampling.
 *
 * @since 1.0
 */
public enum QueryPhase {
  /** Waiting on the admission gate. */
  QUEUE("query queue"),

  /** Fetching from backends, merging or sampling. */
  EVALUATION("expression evaluation");

  private final String description;

  private QueryPhase(final String description) {
    this.description = description;
  }

  /** @return The human readable phase name used in error messages. */
  public String description() {
    return description;
  }
}
