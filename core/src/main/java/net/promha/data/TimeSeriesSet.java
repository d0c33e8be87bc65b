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
package net.promha.data;

/**
 * A cursor over a set of series. After {@link #next()} returns false the
 * caller must check {@link #error()}.
 *
 * @since 1.0
 */
public interface TimeSeriesSet {

  /** @return True if the cursor moved to another series. */
  public boolean next();

  /** @return The current series. */
  public TimeSeries at();

  /** @return An error that ended the set early or null. */
  public Exception error();

}
