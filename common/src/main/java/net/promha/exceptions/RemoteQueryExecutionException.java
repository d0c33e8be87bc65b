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
 * An exception that occurred when querying a single remote backend. The
 * merge layer absorbs these as long as at least one backend answered.
 *
 * @since 1.0
 */
public class RemoteQueryExecutionException extends QueryExecutionException {
  private static final long serialVersionUID = 2967693539088677442L;

  /** A description of the remote service that threw the exception. */
  private final String remote_endpoint;

  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   * @param remote_endpoint A description of the remote that threw this exception.
   * @param status_code An optional status code reflecting the error state.
   */
  public RemoteQueryExecutionException(final String msg,
                                       final String remote_endpoint,
                                       final int status_code) {
    super(msg, status_code);
    this.remote_endpoint = remote_endpoint;
  }

  /**
   * Ctor setting a message, status code and exception.
   * @param msg A non-null message to be given.
   * @param remote_endpoint A description of the remote that threw this exception.
   * @param status_code An optional status code reflecting the error state.
   * @param t The original exception that caused this to be thrown.
   */
  public RemoteQueryExecutionException(final String msg,
                                       final String remote_endpoint,
                                       final int status_code,
                                       final Throwable t) {
    super(msg, status_code, t);
    this.remote_endpoint = remote_endpoint;
  }

  /** @return A description of the remote endpoint that threw the exception. */
  public String getRemoteEndpoint() {
    return remote_endpoint;
  }

  @Override
  public String toString() {
    return super.toString() + " remoteEndpoint=" + remote_endpoint;
  }
}
