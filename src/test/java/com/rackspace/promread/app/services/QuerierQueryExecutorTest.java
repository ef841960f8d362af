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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.promread.app.config.AppProperties;
import com.rackspace.promread.app.exceptions.QuerierException;
import com.rackspace.promread.app.model.Cell;
import com.rackspace.promread.app.model.CompiledQuery;
import com.rackspace.promread.app.model.ResultSet;
import com.rackspace.promread.app.model.ValueType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class QuerierQueryExecutorTest {

  private static final String SUCCESS_BODY = "{\"OPT_STATUS\":\"SUCCESS\",\"DESCRIPTION\":\"\","
      + "\"result\":{\"columns\":[\"timestamp\",\"metrics.byte\"],"
      + "\"schemas\":[{\"value_type\":\"Int\"},{\"value_type\":\"Float64\"}],"
      + "\"values\":[[1700000000,12.5]]}}";

  private MeterRegistry meterRegistry;
  private List<ClientRequest> requests;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    requests = new ArrayList<>();
  }

  private QuerierQueryExecutor executor(HttpStatus status, String body) {
    final WebClient webClient = WebClient.builder()
        .exchangeFunction(request -> {
          requests.add(request);
          return Mono.just(ClientResponse.create(status)
              .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
              .body(body)
              .build());
        })
        .build();
    return new QuerierQueryExecutor(webClient, new AppProperties(), new ObjectMapper(),
        meterRegistry);
  }

  @Test
  void executesAgainstQueryPath() {
    final QuerierQueryExecutor executor = executor(HttpStatus.OK, SUCCESS_BODY);

    StepVerifier.create(executor.execute(
            new CompiledQuery("SELECT 1", "flow_metrics", "1m")))
        .assertNext(resultSet -> {
          assertThat(resultSet.getColumns()).containsExactly("timestamp", "metrics.byte");
          assertThat(resultSet.getSchemas()).containsExactly(ValueType.INT, ValueType.FLOAT64);
          assertThat(resultSet.getValues())
              .containsExactly(List.of(Cell.ofInteger(1700000000), Cell.ofFloat(12.5)));
        })
        .verifyComplete();

    assertThat(requests).hasSize(1);
    assertThat(requests.get(0).url().getPath()).isEqualTo("/v1/query/");
    assertThat(meterRegistry.get("promread.querier.errors").counter().count()).isZero();
  }

  @Test
  void serverErrorsBecomeQuerierErrors() {
    final QuerierQueryExecutor executor = executor(HttpStatus.SERVICE_UNAVAILABLE, "down");

    StepVerifier.create(executor.execute(new CompiledQuery("SELECT 1", "flow_metrics", "")))
        .expectError(QuerierException.class)
        .verify();

    assertThat(meterRegistry.get("promread.querier.errors").counter().count()).isEqualTo(1);
  }

  @Test
  void failedStatusIsReported() {
    final QuerierQueryExecutor executor = executor(HttpStatus.OK,
        "{\"OPT_STATUS\":\"FAILED\",\"DESCRIPTION\":\"table not found\"}");

    StepVerifier.create(executor.execute(new CompiledQuery("SELECT 1", "flow_metrics", "")))
        .expectErrorSatisfies(e -> assertThat(e)
            .isInstanceOf(QuerierException.class)
            .hasMessageContaining("FAILED")
            .hasMessageContaining("table not found"))
        .verify();
  }

  @Test
  void malformedJson() {
    final QuerierQueryExecutor executor = executor(HttpStatus.OK, "");

    assertThatThrownBy(() -> executor.parseResponse("{not json"))
        .isInstanceOf(QuerierException.class)
        .hasMessageContaining("malformed");
  }

  @Test
  void parsesSuccessfulResponse() {
    final ResultSet resultSet = executor(HttpStatus.OK, "").parseResponse(SUCCESS_BODY);

    assertThat(resultSet.getValues()).hasSize(1);
  }
}
