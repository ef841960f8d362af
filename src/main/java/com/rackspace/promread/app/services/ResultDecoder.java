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

package com.rackspace.promread.app.services;

import static com.rackspace.promread.app.services.MatcherCompiler.METRIC_NAME_LABEL;
import static com.rackspace.promread.app.services.MetricIdentifierParser.METRICS_PREFIX;
import static com.rackspace.promread.app.services.SqlAssembler.TIME_ALIAS;
import static com.rackspace.promread.app.services.TagExpander.TAGS_COLUMN;

import com.rackspace.promread.app.exceptions.CellTypeException;
import com.rackspace.promread.app.exceptions.MissingColumnException;
import com.rackspace.promread.app.model.Cell;
import com.rackspace.promread.app.model.Label;
import com.rackspace.promread.app.model.QueryResult;
import com.rackspace.promread.app.model.ReadResponse;
import com.rackspace.promread.app.model.ResultSet;
import com.rackspace.promread.app.model.Sample;
import com.rackspace.promread.app.model.TimeSeries;
import com.rackspace.promread.app.model.ValueType;
import com.rackspace.promread.app.services.SeriesAccumulator.Admission;
import com.rackspace.promread.app.utils.LabelFormatter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns a querier result into remote read series, one series per distinct tag combination.
 */
@Component
@Slf4j
public class ResultDecoder {

  private final Counter rejectedRowsCounter;

  @Autowired
  public ResultDecoder(MeterRegistry meterRegistry) {
    this.rejectedRowsCounter = meterRegistry.counter("promread.series.dropped");
  }

  public ReadResponse decode(ResultSet resultSet, int seriesLimit) {
    final List<String> columns = resultSet.getColumns();
    int tagIndex = -1;
    int metricsIndex = -1;
    int timeIndex = -1;
    String metricName = "";
    for (int i = 0; i < columns.size(); i++) {
      final String column = columns.get(i);
      if (TAGS_COLUMN.equals(column)) {
        tagIndex = i;
      } else if (column.startsWith(METRICS_PREFIX)) {
        metricsIndex = i;
        metricName = column.substring(METRICS_PREFIX.length());
      } else if (TIME_ALIAS.equals(column)) {
        timeIndex = i;
      }
    }
    if (metricsIndex < 0 || timeIndex < 0) {
      throw new MissingColumnException(metricsIndex, timeIndex);
    }

    // flow tables have no generic tag column, so every other column is a tag of its own
    final List<Integer> bareTagIndexes = new ArrayList<>();
    for (int i = 0; i < columns.size(); i++) {
      if (i != tagIndex && i != metricsIndex && i != timeIndex) {
        bareTagIndexes.add(i);
      }
    }

    final ValueType metricsType = resultSet.getSchemas().size() > metricsIndex ?
        resultSet.getSchemas().get(metricsIndex) : ValueType.OTHER;
    final SeriesAccumulator accumulator = new SeriesAccumulator(seriesLimit);
    for (List<Cell> row : resultSet.getValues()) {
      final String seriesKey = tagIndex > -1 ?
          row.get(tagIndex).stringValue() :
          fingerprint(row, bareTagIndexes);

      final Admission admission = accumulator.admit(seriesKey);
      if (!admission.isAdmitted()) {
        continue;
      }
      final TimeSeries series = admission.getSeries();
      if (admission.isCreated()) {
        series.setLabels(buildLabels(metricName, row, tagIndex, seriesKey, columns,
            bareTagIndexes));
      }
      series.getSamples().add(new Sample(
          metricValue(metricsType, row.get(metricsIndex)),
          epochSeconds(row.get(timeIndex)) * 1000
      ));
    }

    if (accumulator.getRejectedRows() > 0) {
      log.debug("Series limit {} reached, dropped {} rows", seriesLimit,
          accumulator.getRejectedRows());
      rejectedRowsCounter.increment(accumulator.getRejectedRows());
    }
    final ReadResponse response = new ReadResponse();
    response.getResults().add(new QueryResult().setTimeseries(accumulator.getSeries()));
    return response;
  }

  private static String fingerprint(List<Cell> row, List<Integer> bareTagIndexes) {
    final List<String> parts = new ArrayList<>(bareTagIndexes.size() * 2);
    for (int i : bareTagIndexes) {
      if (LabelFormatter.isNil(row.get(i))) {
        continue;
      }
      parts.add(Integer.toString(i));
      parts.add(LabelFormatter.formatValue(row.get(i)));
    }
    return String.join("-", parts);
  }

  private static List<Label> buildLabels(String metricName, List<Cell> row, int tagIndex,
                                         String tagsJson, List<String> columns,
                                         List<Integer> bareTagIndexes) {
    final List<Label> labels = new ArrayList<>();
    labels.add(new Label(METRIC_NAME_LABEL, metricName));
    if (tagIndex > -1) {
      labels.addAll(LabelFormatter.tagsToLabels(tagsJson));
      return labels;
    }
    for (int i : bareTagIndexes) {
      if (LabelFormatter.isNil(row.get(i))) {
        continue;
      }
      labels.add(new Label(
          LabelFormatter.formatTagName(columns.get(i)),
          LabelFormatter.formatValue(row.get(i))));
    }
    return labels;
  }

  /**
   * Reads the metric cell as the kind its column declares. Columns declared as neither
   * <code>Int</code> nor <code>Float64</code> hold nullable floats, where absent values read
   * as NaN.
   */
  static double metricValue(ValueType declared, Cell cell) {
    switch (declared) {
      case INT:
        return cell.integerValue();
      case FLOAT64:
        return cell.floatValue();
      default:
        final Double value = cell.nullableFloatValue();
        return value == null ? Double.NaN : value;
    }
  }

  static long epochSeconds(Cell cell) {
    return switch (cell.getKind()) {
      case INTEGER -> cell.integerValue();
      case TIMESTAMP -> cell.timestampValue().getEpochSecond();
      case FLOAT, STRING, NULLABLE_FLOAT -> throw new CellTypeException(
          String.format("time column holds a %s cell", cell.getKind()));
    };
  }
}
