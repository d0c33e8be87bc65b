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

import java.util.regex.Pattern;

import net.promha.common.Const;

/**
 * Validates label sets decoded from backends before they are merged.
 *
 * @since 1.0
 */
public class LabelValidator {

  private static final Pattern METRIC_NAME =
      Pattern.compile("^[a-zA-Z_:][a-zA-Z0-9_:]*$");

  private static final Pattern LABEL_NAME =
      Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

  /**
   * @param name The name to check.
   * @return True if the string is a legal metric name.
   */
  public static boolean isValidMetricName(final String name) {
    return name != null && !name.isEmpty() && METRIC_NAME.matcher(name).matches();
  }

  /**
   * @param name The name to check.
   * @return True if the string is a legal label name.
   */
  public static boolean isValidLabelName(final String name) {
    return name != null && !name.isEmpty() && LABEL_NAME.matcher(name).matches();
  }

  /**
   * Label values may hold any text that can be encoded as UTF-8, i.e. no
   * unpaired surrogates.
   * @param value The value to check.
   * @return True if the value is legal.
   */
  public static boolean isValidLabelValue(final String value) {
    return value != null && Const.UTF8_CHARSET.newEncoder().canEncode(value);
  }

  /**
   * Checks every label in the set.
   * @param labels A non-null label set.
   * @throws IllegalArgumentException with a description of the first
   * offending label.
   */
  public static void validate(final Labels labels) {
    for (final Label label : labels) {
      if (label.name().equals(Const.METRIC_NAME_LABEL) &&
          !isValidMetricName(label.value())) {
        throw new IllegalArgumentException("Invalid metric name: "
            + label.value());
      }
      if (!isValidLabelName(label.name())) {
        throw new IllegalArgumentException("Invalid label name: "
            + label.name());
      }
      if (!isValidLabelValue(label.value())) {
        throw new IllegalArgumentException("Invalid label value: "
            + label.value());
      }
    }
  }

  private LabelValidator() {
  }
}
