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

import java.util.Map;
import java.util.Set;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

/**
 * Looks up the built in {@link SampleMergeStrategy} implementations by name.
 * The strategies are stateless.
 *
 * @since 1.0
 */
public final class MergeStrategies {

  /** The name of the default strategy. */
  public static final String DEFAULT = PriorityMergeStrategy.NAME;

  private static final Map<String, SampleMergeStrategy> STRATEGIES =
      ImmutableMap.<String, SampleMergeStrategy>of(
          PriorityMergeStrategy.NAME, new PriorityMergeStrategy(),
          StrictMergeStrategy.NAME, new StrictMergeStrategy(),
          LargestMergeStrategy.NAME, new LargestMergeStrategy(),
          NewestMergeStrategy.NAME, new NewestMergeStrategy());

  /**
   * @param name The name of a strategy, null or empty for the default.
   * @return The strategy.
   * @throws IllegalArgumentException if no strategy has that name.
   */
  public static SampleMergeStrategy forName(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      return STRATEGIES.get(DEFAULT);
    }
    final SampleMergeStrategy strategy = STRATEGIES.get(name.toLowerCase());
    if (strategy == null) {
      throw new IllegalArgumentException("Unknown merge strategy: " + name
          + ". Must be one of " + STRATEGIES.keySet());
    }
    return strategy;
  }

  /** @return The names of the available strategies. */
  public static Set<String> names() {
    return STRATEGIES.keySet();
  }

  private MergeStrategies() {
  }
}
