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

import com.google.common.base.Splitter;
import com.rackspace.promread.app.exceptions.UnknownMetricException;
import com.rackspace.promread.app.model.MetricIdentifier;
import com.rackspace.promread.app.model.TranslationSettings;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Decodes the value of a <code>__name__</code> matcher. Names of the form
 * <code>database__table__metric[__datasource]</code> address a physical table, any other name
 * is read from the virtual view of the same name.
 */
@Component
public class MetricIdentifierParser {

  public static final String DELIMITER = "__";
  public static final String METRICS_PREFIX = "metrics.";

  private static final Splitter SPLITTER = Splitter.on(DELIMITER);

  public MetricIdentifier parse(String metricName, TranslationSettings settings) {
    final MetricIdentifier identifier = new MetricIdentifier();
    if (!metricName.contains(DELIMITER)) {
      return identifier
          .setMetricName(metricName)
          .setSelectExpression(METRICS_PREFIX + metricName);
    }

    final List<String> segments = SPLITTER.splitToList(metricName);
    if (segments.size() < 3 || !settings.getDatabases().contains(segments.get(0))) {
      throw new UnknownMetricException(metricName);
    }
    identifier
        .setDatabase(segments.get(0))
        .setTable(segments.get(1))
        .setMetricName(segments.get(2))
        .setSelectExpression(
            String.format("%s as `%s%s`", segments.get(2), METRICS_PREFIX, segments.get(2)));
    if (segments.size() > 3) {
      identifier.setDataSource(segments.get(3));
    }
    return identifier;
  }
}
