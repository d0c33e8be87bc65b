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
package net.promha.query;

/**
 * Something that can be queried for time series, e.g. a remote backend or a
 * merge over several of them.
 *
 * @since 1.0
 */
public interface Queryable {

  /**
   * Opens a querier bound to the given query context.
   * @param context The non-null context of the query.
   * @return A non-null querier. The caller must close it.
   */
  public Querier querier(final QueryContext context);

}
