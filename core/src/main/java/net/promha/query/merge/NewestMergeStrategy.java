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
package net.promha.query.merge;

/**
 * Walks the union of every backend's timestamps so the most recent sample
 * from any backend wins. Samples at the same timestamp merge to the first
 * non-stale one in backend order.
 *
 * @since 1.0
 */
public class NewestMergeStrategy extends PriorityMergeStrategy {
  public static final String NAME = "newest";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean byBackendOrder() {
    return false;
  }
}
