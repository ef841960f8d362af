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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.promread.app.exceptions.CellTypeException;
import com.rackspace.promread.app.model.Cell;
import com.rackspace.promread.app.model.Label;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Converts result cells and column names into remote read label names and values.
 */
@Slf4j
public class LabelFormatter {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final TypeReference<LinkedHashMap<String, String>> TAG_MAP_TYPE =
      new TypeReference<>() {};
  private static final String EMPTY_OBJECT = "{}";
  private static final long NEGATIVE_ZERO_BITS = Double.doubleToRawLongBits(-0.0);
  // 17 significant digits always identify a double
  private static final int MAX_DOUBLE_DIGITS = 17;

  /**
   * Renders a cell the way it appears as a label value.
   *
   * @throws CellTypeException for nullable floats, which have no label form
   */
  public static String formatValue(Cell cell) {
    return switch (cell.getKind()) {
      case INTEGER -> Long.toString(cell.integerValue());
      case FLOAT -> formatFloat(cell.floatValue());
      case TIMESTAMP -> cell.timestampValue().toString();
      case STRING -> cell.stringValue();
      case NULLABLE_FLOAT -> throw new CellTypeException(
          "nullable float cells cannot be used as label values");
    };
  }

  /**
   * Shortest decimal that reads back as the same double, without exponent notation.
   */
  public static String formatFloat(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "+Inf" : "-Inf";
    }
    if (value == 0) {
      return Double.doubleToRawLongBits(value) == NEGATIVE_ZERO_BITS ? "-0" : "0";
    }
    final BigDecimal exact = new BigDecimal(value);
    for (int precision = 1; precision < MAX_DOUBLE_DIGITS; precision++) {
      final BigDecimal rounded = exact.round(new MathContext(precision));
      if (rounded.doubleValue() == value) {
        return rounded.stripTrailingZeros().toPlainString();
      }
    }
    return exact.round(new MathContext(MAX_DOUBLE_DIGITS)).stripTrailingZeros().toPlainString();
  }

  /**
   * Cells that carry no tag value. Integer zero is indistinguishable from an absent integer
   * tag in the querier output, so a genuine zero-valued tag is treated as absent too.
   */
  public static boolean isNil(Cell cell) {
    return switch (cell.getKind()) {
      case STRING -> cell.stringValue().isEmpty() || EMPTY_OBJECT.equals(cell.stringValue());
      case INTEGER -> cell.integerValue() == 0;
      case FLOAT, TIMESTAMP, NULLABLE_FLOAT -> false;
    };
  }

  /**
   * Prometheus label names cannot contain <code>.</code>, <code>-</code> or <code>/</code>.
   */
  public static String formatTagName(String tagName) {
    return StringUtils.replaceChars(tagName, ".-/", "___");
  }

  /**
   * Parses a serialized tag map such as <code>{"host":"h-1"}</code> into labels, in the order
   * the keys appear in the text.
   */
  public static List<Label> tagsToLabels(String tagsJson) {
    final List<Label> labels = new ArrayList<>();
    if (StringUtils.isBlank(tagsJson)) {
      return labels;
    }
    final Map<String, String> tags;
    try {
      tags = OBJECT_MAPPER.readValue(tagsJson, TAG_MAP_TYPE);
    } catch (JsonProcessingException e) {
      log.warn("Ignoring unparseable tags {}", tagsJson, e);
      return labels;
    }
    if (tags != null) {
      tags.forEach((name, value) -> labels.add(new Label(name, value)));
    }
    return labels;
  }
}
