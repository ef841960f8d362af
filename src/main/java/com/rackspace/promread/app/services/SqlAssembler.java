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

import com.rackspace.promread.app.exceptions.NoMetricSelectedException;
import com.rackspace.promread.app.model.CompiledQuery;
import com.rackspace.promread.app.model.MetricIdentifier;
import com.rackspace.promread.app.model.QueryPlan;
import com.rackspace.promread.app.model.TimeRange;
import com.rackspace.promread.app.model.TranslationSettings;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class SqlAssembler {

  public static final String TIME_ALIAS = "timestamp";
  public static final String TIME_COLUMN = "toUnixTimestamp(time) AS " + TIME_ALIAS;

  private static final String RESOLVED_TEMPLATE =
      "SELECT %s FROM %s WHERE %s ORDER BY time desc LIMIT %d";
  // ordering is left to the virtual view
  private static final String VIRTUAL_TEMPLATE = "SELECT %s FROM %s.%s WHERE %s LIMIT %d";

  public CompiledQuery assemble(QueryPlan plan, List<String> tagColumns,
                                TranslationSettings settings) {
    final MetricIdentifier metric = plan.getMetric();
    final List<String> columns = new ArrayList<>();
    columns.add(TIME_COLUMN);
    if (metric != null && metric.getSelectExpression() != null) {
      columns.add(metric.getSelectExpression());
    }
    if (columns.size() == 1) {
      throw new NoMetricSelectedException();
    }
    columns.addAll(tagColumns);

    final List<String> filters = new ArrayList<>();
    filters.add(timeFilter(plan.getTimeRange()));
    filters.addAll(plan.getPredicates());

    final String sql = metric.isResolved() ?
        String.format(RESOLVED_TEMPLATE, String.join(",", columns), metric.getTable(),
            String.join(" AND ", filters), settings.getRowLimit()) :
        String.format(VIRTUAL_TEMPLATE, String.join(",", columns), settings.getVirtualNamespace(),
            metric.getMetricName(), String.join(" AND ", filters), settings.getRowLimit());
    return new CompiledQuery(sql, metric.getDatabase(), metric.getDataSource());
  }

  static String timeFilter(TimeRange timeRange) {
    return String.format("(time >= %d AND time <= %d)", timeRange.getStart(), timeRange.getEnd());
  }
}
