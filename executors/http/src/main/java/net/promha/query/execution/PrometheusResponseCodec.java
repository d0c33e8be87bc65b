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
package net.promha.query.execution;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map.Entry;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.Lists;

import net.promha.data.ConcreteTimeSeries;
import net.promha.data.ConcreteTimeSeriesSet;
import net.promha.data.Labels;
import net.promha.data.Point;
import net.promha.exceptions.RemoteQueryExecutionException;
import net.promha.query.value.ValueType;

/**
 * Decodes the JSON body of a Prometheus {@code /api/v1/query} or
 * {@code /api/v1/query_range} response into series. Vectors become one
 * point series, matrices keep every point. Fractional timestamps are
 * truncated to seconds. The series come out sorted by labels.
 *
 * @since 1.0
 */
public class PrometheusResponseCodec {

  /**
   * Decodes a response.
   * @param root The parsed body.
   * @param endpoint The backend, for error messages.
   * @return A non-null set, possibly empty.
   * @throws RemoteQueryExecutionException if the status wasn't a success or
   * the body was malformed.
   */
  public static ConcreteTimeSeriesSet decode(final JsonNode root,
                                             final String endpoint) {
    if (root == null || !root.isObject()) {
      throw new RemoteQueryExecutionException("Response body was not a "
          + "JSON object", endpoint, 500);
    }
    final JsonNode status = root.get("status");
    if (status == null || !"success".equals(status.asText())) {
      final JsonNode error = root.get("error");
      throw new RemoteQueryExecutionException("Backend returned status ["
          + (status == null ? "null" : status.asText()) + "]"
          + (error != null ? ": " + error.asText() : ""), endpoint, 500);
    }
    final JsonNode data = root.get("data");
    if (data == null || data.isNull()) {
      return ConcreteTimeSeriesSet.empty();
    }
    final JsonNode result = data.get("result");
    if (result == null || result.isNull()) {
      return ConcreteTimeSeriesSet.empty();
    }
    if (!result.isArray()) {
      throw new RemoteQueryExecutionException("Result was not an array",
          endpoint, 500);
    }
    final JsonNode type_node = data.get("resultType");
    final String type = type_node == null ? null : type_node.asText();

    final List<ConcreteTimeSeries> series =
        Lists.newArrayListWithCapacity(result.size());
    if (ValueType.VECTOR.wireName().equals(type)) {
      for (final JsonNode entry : result) {
        final Labels labels = parseLabels(entry.get("metric"), endpoint);
        series.add(new ConcreteTimeSeries(labels, Lists.newArrayList(
            parsePoint(entry.get("value"), endpoint))));
      }
    } else if (ValueType.MATRIX.wireName().equals(type)) {
      for (final JsonNode entry : result) {
        final Labels labels = parseLabels(entry.get("metric"), endpoint);
        final JsonNode values = entry.get("values");
        final List<Point> points = Lists.newArrayListWithCapacity(
            values == null ? 0 : values.size());
        if (values != null) {
          for (final JsonNode value : values) {
            final Point point = parsePoint(value, endpoint);
            if (!points.isEmpty() &&
                point.timestamp() <= points.get(points.size() - 1).timestamp()) {
              throw new RemoteQueryExecutionException("Out of order or "
                  + "duplicate timestamp " + point.timestamp() + " for "
                  + labels, endpoint, 500);
            }
            points.add(point);
          }
        }
        series.add(new ConcreteTimeSeries(labels, points));
      }
    } else {
      throw new RemoteQueryExecutionException("Unsupported result type ["
          + type + "]", endpoint, 500);
    }

    Collections.sort(series, (a, b) -> a.labels().compareTo(b.labels()));
    return new ConcreteTimeSeriesSet(series);
  }

  /**
   * Parses a sample value as sent by Prometheus, including the special
   * float spellings.
   * @param value The non-null string.
   * @return The parsed value.
   * @throws NumberFormatException if the value couldn't be parsed.
   */
  public static double parseValue(final String value) {
    switch (value) {
    case "NaN":
      return Double.NaN;
    case "+Inf":
    case "Inf":
      return Double.POSITIVE_INFINITY;
    case "-Inf":
      return Double.NEGATIVE_INFINITY;
    default:
      return Double.parseDouble(value);
    }
  }

  static Labels parseLabels(final JsonNode metric, final String endpoint) {
    if (metric == null || metric.isNull()) {
      return Labels.EMPTY;
    }
    if (!metric.isObject()) {
      throw new RemoteQueryExecutionException("Metric was not an object: "
          + metric, endpoint, 500);
    }
    final Labels.Builder builder = Labels.newBuilder();
    final Iterator<Entry<String, JsonNode>> it = metric.fields();
    while (it.hasNext()) {
      final Entry<String, JsonNode> field = it.next();
      builder.addLabel(field.getKey(), field.getValue().asText());
    }
    return builder.build();
  }

  static Point parsePoint(final JsonNode pair, final String endpoint) {
    if (pair == null || !pair.isArray() || pair.size() != 2) {
      throw new RemoteQueryExecutionException("Sample was not a "
          + "[timestamp, value] pair: " + pair, endpoint, 500);
    }
    final JsonNode ts = pair.get(0);
    final JsonNode value = pair.get(1);
    if (!ts.isNumber()) {
      throw new RemoteQueryExecutionException("Timestamp was not a number: "
          + pair, endpoint, 500);
    }
    try {
      return new Point((long) ts.asDouble(),
          value.isNumber() ? value.asDouble() : parseValue(value.asText()));
    } catch (NumberFormatException e) {
      throw new RemoteQueryExecutionException("Unable to parse value: "
          + pair, endpoint, 500, e);
    }
  }
}
