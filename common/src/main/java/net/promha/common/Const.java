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
package net.promha.common;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/** Constants used in various places.  */
public final class Const {

  /** Used for metrics, label names and label values. */
  public static final Charset UTF8_CHARSET = StandardCharsets.UTF_8;

  /** The name of the label carrying the metric name. */
  public static final String METRIC_NAME_LABEL = "__name__";

  /** The default lookback window in seconds. */
  public static final long DEFAULT_LOOKBACK_SECONDS = 300;

  /** Hash function used for label set hashing. */
  private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128();

  /** @return The hash function used for label set hashing. */
  public static HashFunction HASH_FUNCTION() {
    return HASH_FUNCTION;
  }

  private Const() {
    // static constants only.
  }
}
