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

import static com.rackspace.promread.app.TestSettings.settings;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.rackspace.promread.app.exceptions.UnknownMetricException;
import com.rackspace.promread.app.model.MetricIdentifier;
import org.junit.jupiter.api.Test;

class MetricIdentifierParserTest {

  private final MetricIdentifierParser parser = new MetricIdentifierParser();

  @Test
  void resolvesPhysicalTable() {
    MetricIdentifier metric = parser.parse("df__l7_flow_log__request", settings());

    assertThat(metric.isResolved()).isTrue();
    assertThat(metric.getDatabase()).isEqualTo("df");
    assertThat(metric.getTable()).isEqualTo("l7_flow_log");
    assertThat(metric.getMetricName()).isEqualTo("request");
    assertThat(metric.getDataSource()).isEmpty();
    assertThat(metric.getSelectExpression()).isEqualTo("request as `metrics.request`");
  }

  @Test
  void resolvesDataSource() {
    MetricIdentifier metric = parser.parse("flow_metrics__vtap_flow_port__byte__1m", settings());

    assertThat(metric.getDatabase()).isEqualTo("flow_metrics");
    assertThat(metric.getTable()).isEqualTo("vtap_flow_port");
    assertThat(metric.getMetricName()).isEqualTo("byte");
    assertThat(metric.getDataSource()).isEqualTo("1m");
  }

  @Test
  void plainNameIsVirtual() {
    MetricIdentifier metric = parser.parse("http_requests_total", settings());

    assertThat(metric.isResolved()).isFalse();
    assertThat(metric.getDatabase()).isEmpty();
    assertThat(metric.getMetricName()).isEqualTo("http_requests_total");
    assertThat(metric.getSelectExpression()).isEqualTo("metrics.http_requests_total");
  }

  @Test
  void unknownDatabase() {
    UnknownMetricException e = assertThrows(UnknownMetricException.class,
        () -> parser.parse("zz__t__m", settings()));

    assertThat(e.getMetricName()).isEqualTo("zz__t__m");
    assertThat(e.getMessage()).contains("zz__t__m");
  }

  @Test
  void tooFewSegments() {
    assertThrows(UnknownMetricException.class, () -> parser.parse("df__l7_flow_log", settings()));
  }
}
