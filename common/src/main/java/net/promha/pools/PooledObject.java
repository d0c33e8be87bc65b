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
package net.promha.pools;

/**
 * An object claimed from a pool. It <b>MUST</b> be {@link #release()}d
 * exactly once when the holder is finished with it. Releasing twice or
 * touching the object after release throws an {@link IllegalStateException}.
 *
 * @since 1.0
 */
public interface PooledObject {

  /** @return The non-null object. */
  public Object object();

  /**
   * Called to release the object back to the pool for reuse.
   * @throws IllegalStateException if the object was already released.
   */
  public void release();

  /** @return Whether or not {@link #release()} has been called. */
  public boolean released();

}
