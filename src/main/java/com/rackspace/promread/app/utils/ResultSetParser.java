/*
 * Copyright 2022 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.promread.app.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.rackspace.promread.app.model.Cell;
import com.rackspace.promread.app.model.ResultSet;
import com.rackspace.promread.app.model.ValueType;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link ResultSet} from the <code>result</code> object of a querier response, reading
 * each cell as the kind its column schema declares.
 */
public class ResultSetParser {

  private static final DateTimeFormatter DATETIME_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  public static ResultSet parse(JsonNode result) {
    final ResultSet resultSet = new ResultSet();
    if (result == null || result.isNull()) {
      return resultSet;
    }
    result.path("columns").forEach(column -> resultSet.getColumns().add(column.asText()));
    result.path("schemas").forEach(schema -> resultSet.getSchemas().add(
        ValueType.fromTypeName(schema.isTextual() ?
            schema.asText() : schema.path("value_type").asText())));
    while (resultSet.getSchemas().size() < resultSet.getColumns().size()) {
      resultSet.getSchemas().add(ValueType.OTHER);
    }

    for (JsonNode rowNode : result.path("values")) {
      final List<Cell> row = new ArrayList<>(rowNode.size());
      for (int i = 0; i < rowNode.size(); i++) {
        final ValueType declared = i < resultSet.getSchemas().size() ?
            resultSet.getSchemas().get(i) : ValueType.OTHER;
        row.add(toCell(declared, rowNode.get(i)));
      }
      resultSet.getValues().add(row);
    }
    return resultSet;
  }

  static Cell toCell(ValueType declared, JsonNode node) {
    switch (declared) {
      case INT:
        if (node.isIntegralNumber()) {
          return Cell.ofInteger(node.asLong());
        }
        break;
      case FLOAT64:
        if (node.isNumber()) {
          return Cell.ofFloat(node.asDouble());
        }
        break;
      case DATETIME:
        if (node.isIntegralNumber()) {
          return Cell.ofTimestamp(Instant.ofEpochSecond(node.asLong()));
        }
        if (node.isTextual()) {
          final Instant instant = parseDateTime(node.asText());
          if (instant != null) {
            return Cell.ofTimestamp(instant);
          }
        }
        break;
      case STRING:
        break;
      case NULLABLE_FLOAT64:
      case OTHER:
        if (node.isNull() || node.isNumber()) {
          return Cell.ofNullableFloat(node.isNull() ? null : node.asDouble());
        }
        break;
    }
    return inferCell(node);
  }

  private static Cell inferCell(JsonNode node) {
    if (node.isNull()) {
      return Cell.ofNullableFloat(null);
    }
    if (node.isIntegralNumber()) {
      return Cell.ofInteger(node.asLong());
    }
    if (node.isNumber()) {
      return Cell.ofFloat(node.asDouble());
    }
    if (node.isContainerNode()) {
      return Cell.ofString(node.toString());
    }
    return Cell.ofString(node.asText());
  }

  private static Instant parseDateTime(String text) {
    try {
      return LocalDateTime.parse(text, DATETIME_FORMAT).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}
