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

/**
 * The lifecycle of a query. A query moves forward through the states and
 * ends in either {@link #DONE} or {@link #FAILED}.
 *
 * @since 1.0
 */
public enum QueryState {
  /** Created, waiting for a gate slot. */
  QUEUED,
  /** Holds a gate slot. */
  ADMITTED,
  /** Waiting on the backends. */
  FETCHING,
  /** Sampling the fetched series. */
  SAMPLING,
  /** Finished with a value. */
  DONE,
  /** Finished with an error. */
  FAILED
}
