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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.promread.app.config.AppProperties;
import com.rackspace.promread.app.exceptions.QuerierException;
import com.rackspace.promread.app.model.CompiledQuery;
import com.rackspace.promread.app.model.ResultSet;
import com.rackspace.promread.app.utils.ResultSetParser;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Executes statements through the querier's SQL API.
 */
@Service
@Slf4j
public class QuerierQueryExecutor implements QueryExecutor {

  static final String QUERY_PATH = "/v1/query/";
  static final String STATUS_SUCCESS = "SUCCESS";

  private final ObjectMapper objectMapper;
  private final WebClient webClient;
  private final Duration timeout;
  private final Counter querierErrorsCounter;

  @Autowired
  public QuerierQueryExecutor(AppProperties appProperties, ObjectMapper objectMapper,
                              MeterRegistry meterRegistry) {
    this(WebClient.create(String.format("http://%s:%d",
            appProperties.getQuerier().getHost(), appProperties.getQuerier().getPort())),
        appProperties, objectMapper, meterRegistry);
  }

  QuerierQueryExecutor(WebClient webClient, AppProperties appProperties,
                       ObjectMapper objectMapper, MeterRegistry meterRegistry) {
    this.webClient = webClient;
    this.objectMapper = objectMapper;
    this.timeout = appProperties.getQuerier().getTimeout();
    this.querierErrorsCounter = meterRegistry.counter("promread.querier.errors");
  }

  @Override
  public Mono<ResultSet> execute(CompiledQuery query) {
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("db", query.getDatabase());
    form.add("sql", query.getSql());
    if (StringUtils.isNotEmpty(query.getDataSource())) {
      form.add("datasource", query.getDataSource());
    }

    return webClient.post()
        .uri(QUERY_PATH)
        .accept(MediaType.APPLICATION_JSON)
        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
        .body(BodyInserters.fromFormData(form))
        .retrieve()
        .bodyToMono(String.class)
        .timeout(timeout)
        .map(this::parseResponse)
        .onErrorMap(e -> !(e instanceof QuerierException),
            e -> new QuerierException("Querier request failed: " + e.getMessage(), e))
        .doOnError(e -> {
          querierErrorsCounter.increment();
          log.warn("Failed to execute {} on db={}", query.getSql(), query.getDatabase(), e);
        });
  }

  ResultSet parseResponse(String body) {
    final JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new QuerierException("Querier returned malformed JSON", e);
    }
    final String status = root.path("OPT_STATUS").asText();
    if (!STATUS_SUCCESS.equals(status)) {
      throw new QuerierException(String.format("Querier answered %s: %s",
          status, root.path("DESCRIPTION").asText()));
    }
    return ResultSetParser.parse(root.get("result"));
  }
}
