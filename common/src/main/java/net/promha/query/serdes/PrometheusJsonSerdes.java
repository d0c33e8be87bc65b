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
package net.promha.query.serdes;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;

import com.fasterxml.jackson.core.JsonGenerator;

import net.promha.data.Label;
import net.promha.data.Labels;
import net.promha.exceptions.QueryExecutionCanceled;
import net.promha.exceptions.QueryExecutionException;
import net.promha.exceptions.QueryTimeoutException;
import net.promha.exceptions.ResultTypeMismatchException;
import net.promha.exceptions.TooManySamplesException;
import net.promha.pools.PooledPoints;
import net.promha.query.value.Matrix;
import net.promha.query.value.Result;
import net.promha.query.value.Sample;
import net.promha.query.value.Scalar;
import net.promha.query.value.Series;
import net.promha.query.value.StringValue;
import net.promha.query.value.Vector;
import net.promha.utils.JSON;
import net.promha.utils.JSONException;

/**
 * Writes query results in the Prometheus HTTP API format:
 * <pre>
 * {"status":"success","data":{"resultType":"vector","result":[...]}}
 * {"status":"error","errorType":"timeout","error":"..."}
 * </pre>
 * Timestamps are written as seconds and values as strings so that NaN and
 * the infinities survive the trip.
 *
 * @since 1.0
 */
public class PrometheusJsonSerdes {

  /**
   * Serializes the result to a UTF-8 byte array.
   * @param result A non-null result.
   * @return The serialized bytes.
   * @throws JSONException if serialization failed.
   */
  public static byte[] serialize(final Result result) {
    final ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try {
      final JsonGenerator json = JSON.getFactory().createGenerator(baos);
      serialize(result, json);
      json.close();
    } catch (IOException e) {
      throw new JSONException("Failed to serialize the query result", e);
    }
    return baos.toByteArray();
  }

  /**
   * Writes the result as a single object to the generator.
   * @param result A non-null result.
   * @param json A non-null generator.
   * @throws IOException if writing failed.
   */
  public static void serialize(final Result result,
                               final JsonGenerator json) throws IOException {
    json.writeStartObject();
    if (result.error() != null) {
      json.writeStringField("status", "error");
      json.writeStringField("errorType", errorType(result.error()));
      json.writeStringField("error", result.error().getMessage());
      json.writeEndObject();
      return;
    }

    json.writeStringField("status", "success");
    json.writeObjectFieldStart("data");
    json.writeStringField("resultType", result.value().type().wireName());
    json.writeFieldName("result");
    switch (result.value().type()) {
    case VECTOR:
      json.writeStartArray();
      for (final Sample sample : (Vector) result.value()) {
        json.writeStartObject();
        writeMetric(sample.metric(), json);
        json.writeFieldName("value");
        writePoint(sample.point().timestamp(), sample.point().value(), json);
        json.writeEndObject();
      }
      json.writeEndArray();
      break;
    case MATRIX:
      json.writeStartArray();
      for (final Series series : (Matrix) result.value()) {
        json.writeStartObject();
        writeMetric(series.metric(), json);
        json.writeArrayFieldStart("values");
        final PooledPoints points = series.pooledPoints();
        for (int i = 0; i < points.size(); i++) {
          writePoint(points.timestamp(i), points.value(i), json);
        }
        json.writeEndArray();
        json.writeEndObject();
      }
      json.writeEndArray();
      break;
    case SCALAR:
      final Scalar scalar = (Scalar) result.value();
      writePoint(scalar.timestamp(), scalar.value(), json);
      break;
    case STRING:
      final StringValue string = (StringValue) result.value();
      json.writeStartArray();
      json.writeNumber(string.timestamp());
      json.writeString(string.value());
      json.writeEndArray();
      break;
    default:
      throw new IllegalStateException("Unhandled value type: "
          + result.value().type());
    }
    json.writeEndObject();
    json.writeEndObject();
  }

  /**
   * Formats the value with the fewest digits that round trip, without an
   * exponent. NaN and the infinities are spelled out.
   * @param value The value to format.
   * @return The formatted value.
   */
  public static String formatValue(final double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (value == Double.POSITIVE_INFINITY) {
      return "+Inf";
    }
    if (value == Double.NEGATIVE_INFINITY) {
      return "-Inf";
    }
    if (value == 0) {
      return (Double.doubleToRawLongBits(value) < 0) ? "-0" : "0";
    }
    return new BigDecimal(Double.toString(value))
        .stripTrailingZeros()
        .toPlainString();
  }

  /**
   * Maps an exception to the API error type.
   * @param error A non-null exception.
   * @return The error type string.
   */
  public static String errorType(final Exception error) {
    if (error instanceof QueryTimeoutException) {
      return "timeout";
    }
    if (error instanceof QueryExecutionCanceled) {
      return "canceled";
    }
    if (error instanceof ResultTypeMismatchException) {
      return "bad_data";
    }
    if (error instanceof TooManySamplesException ||
        error instanceof QueryExecutionException) {
      return "execution";
    }
    return "internal";
  }

  private static void writeMetric(final Labels labels,
                                  final JsonGenerator json) throws IOException {
    json.writeObjectFieldStart("metric");
    for (final Label label : labels) {
      json.writeStringField(label.name(), label.value());
    }
    json.writeEndObject();
  }

  private static void writePoint(final long timestamp,
                                 final double value,
                                 final JsonGenerator json) throws IOException {
    json.writeStartArray();
    json.writeNumber(timestamp);
    json.writeString(formatValue(value));
    json.writeEndArray();
  }

  private PrometheusJsonSerdes() {
  }
}
