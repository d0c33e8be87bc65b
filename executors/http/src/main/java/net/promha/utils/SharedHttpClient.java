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
package net.promha.utils;

import java.io.Closeable;

import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;

/**
 * A shared asynchronous HTTP client used by every remote backend so
 * connections and IO threads are pooled across backends.
 *
 * @since 1.0
 */
public interface SharedHttpClient extends Closeable {

  /**
   * NOTE: Do not close it.
   * @return The non-null, started client.
   */
  public CloseableHttpAsyncClient getClient();

}
