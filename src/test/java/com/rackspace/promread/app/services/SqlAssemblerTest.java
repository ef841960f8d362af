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

import com.rackspace.promread.app.exceptions.NoMetricSelectedException;
import com.rackspace.promread.app.model.CompiledQuery;
import com.rackspace.promread.app.model.MetricIdentifier;
import com.rackspace.promread.app.model.QueryPlan;
import com.rackspace.promread.app.model.TimeRange;
import java.util.List;
import org.junit.jupiter.api.Test;

class SqlAssemblerTest {

  private final SqlAssembler assembler = new SqlAssembler();

  @Test
  void resolvedTableIsOrderedByTime() {
    QueryPlan plan = new QueryPlan()
        .setMetric(new MetricIdentifier()
            .setDatabase("flow_metrics")
            .setTable("vtap_flow_port")
            .setMetricName("byte")
            .setDataSource("1m")
            .setSelectExpression("byte as `metrics.byte`"))
        .setPredicates(List.of("region='east'"))
        .setTimeRange(new TimeRange(10, 20));

    CompiledQuery compiled = assembler.assemble(plan, List.of("`region`"), settings(50, 5));

    assertThat(compiled.getSql()).isEqualTo(
        "SELECT toUnixTimestamp(time) AS timestamp,byte as `metrics.byte`,`region` "
            + "FROM vtap_flow_port WHERE (time >= 10 AND time <= 20) AND region='east' "
            + "ORDER BY time desc LIMIT 50");
    assertThat(compiled.getDatabase()).isEqualTo("flow_metrics");
    assertThat(compiled.getDataSource()).isEqualTo("1m");
  }

  @Test
  void virtualMetricReadsFromNamespace() {
    QueryPlan plan = new QueryPlan()
        .setMetric(new MetricIdentifier()
            .setMetricName("up")
            .setSelectExpression("metrics.up"))
        .setPredicates(List.of())
        .setTimeRange(new TimeRange(10, 20));

    CompiledQuery compiled = assembler.assemble(plan, List.of("tag"), settings(50, 5));

    assertThat(compiled.getSql()).isEqualTo(
        "SELECT toUnixTimestamp(time) AS timestamp,metrics.up,tag FROM prometheus.up "
            + "WHERE (time >= 10 AND time <= 20) LIMIT 50");
    assertThat(compiled.getDatabase()).isEmpty();
  }

  @Test
  void noMetricSelected() {
    QueryPlan plan = new QueryPlan()
        .setPredicates(List.of("host='h-1'"))
        .setTimeRange(new TimeRange(10, 20));

    assertThrows(NoMetricSelectedException.class,
        () -> assembler.assemble(plan, List.of(), settings()));
  }
}
