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

import com.rackspace.promread.app.config.AppProperties;
import com.rackspace.promread.app.model.ReadRequest;
import com.rackspace.promread.app.model.ReadResponse;
import com.rackspace.promread.app.model.TranslationSettings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Answers a remote read by compiling it, running the statement on the querier and decoding
 * the result.
 */
@Service
@Slf4j
public class RemoteReadService {

  private final PromReadTranslator translator;
  private final QueryExecutor queryExecutor;
  private final AppProperties appProperties;
  private final Counter readSuccessCounter;
  private final Counter readFailureCounter;

  @Autowired
  public RemoteReadService(PromReadTranslator translator,
                           QueryExecutor queryExecutor,
                           AppProperties appProperties,
                           MeterRegistry meterRegistry) {
    this.translator = translator;
    this.queryExecutor = queryExecutor;
    this.appProperties = appProperties;
    this.readSuccessCounter = meterRegistry.counter("promread.read", "result", "success");
    this.readFailureCounter = meterRegistry.counter("promread.read", "result", "failure");
  }

  public Mono<ReadResponse> read(ReadRequest request) {
    final TranslationSettings settings = appProperties.toTranslationSettings();
    return translator.toSql(request, settings)
        .flatMap(queryExecutor::execute)
        .map(resultSet -> translator.toResponse(resultSet, settings))
        .defaultIfEmpty(ReadResponse.empty())
        .doOnSuccess(response -> readSuccessCounter.increment())
        .doOnError(e -> readFailureCounter.increment())
        .checkpoint();
  }
}
