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

import com.rackspace.promread.app.model.CompiledQuery;
import com.rackspace.promread.app.model.LabelMatcher;
import com.rackspace.promread.app.model.MetricIdentifier;
import com.rackspace.promread.app.model.QueryPlan;
import com.rackspace.promread.app.model.ReadQuery;
import com.rackspace.promread.app.model.ReadRequest;
import com.rackspace.promread.app.model.ReadResponse;
import com.rackspace.promread.app.model.ResultSet;
import com.rackspace.promread.app.model.TimeRange;
import com.rackspace.promread.app.model.TranslationSettings;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Translates remote read requests to SQL and querier results back to remote read responses.
 * Every call works on its own structures, the settings passed in are only read.
 */
@Service
@Slf4j
public class PromReadTranslator {

  private final MetricIdentifierParser metricIdentifierParser;
  private final MatcherCompiler matcherCompiler;
  private final TagExpander tagExpander;
  private final SqlAssembler sqlAssembler;
  private final ResultDecoder resultDecoder;

  @Autowired
  public PromReadTranslator(MetricIdentifierParser metricIdentifierParser,
                            MatcherCompiler matcherCompiler,
                            TagExpander tagExpander,
                            SqlAssembler sqlAssembler,
                            ResultDecoder resultDecoder) {
    this.metricIdentifierParser = metricIdentifierParser;
    this.matcherCompiler = matcherCompiler;
    this.tagExpander = tagExpander;
    this.sqlAssembler = sqlAssembler;
    this.resultDecoder = resultDecoder;
  }

  /**
   * Compiles the first query of the request. Any further queries are ignored.
   *
   * @return the compiled query, or empty when the request holds no query
   */
  public Mono<CompiledQuery> toSql(ReadRequest request, TranslationSettings settings) {
    final List<ReadQuery> queries = request.getQueries();
    if (queries == null || queries.isEmpty()) {
      return Mono.empty();
    }
    if (queries.size() > 1) {
      log.debug("Only the first of {} queries is translated", queries.size());
    }
    final ReadQuery query = queries.get(0);

    return Mono.fromCallable(() -> plan(query, settings))
        .flatMap(plan -> expandTags(plan, settings)
            .map(tagColumns -> sqlAssembler.assemble(plan, tagColumns, settings)))
        .doOnNext(compiled -> log.debug("Compiled remote read into {} on db={} datasource={}",
            compiled.getSql(), compiled.getDatabase(), compiled.getDataSource()));
  }

  public ReadResponse toResponse(ResultSet resultSet, TranslationSettings settings) {
    return resultDecoder.decode(resultSet, settings.getSeriesLimit());
  }

  private Mono<List<String>> expandTags(QueryPlan plan, TranslationSettings settings) {
    if (plan.getMetric() == null) {
      // nothing to describe, assembling reports the missing metric
      return Mono.just(List.of());
    }
    return tagExpander.expand(plan.getMetric(), plan.getTimeRange(), settings);
  }

  QueryPlan plan(ReadQuery query, TranslationSettings settings) {
    final TimeRange timeRange =
        TimeRange.fromMillis(query.getStartTimestampMs(), query.getEndTimestampMs());
    // the metric name is resolved first since it decides how the other matchers reference tags
    final MetricIdentifier metric = query.getMatchers().stream()
        .filter(matcher -> METRIC_NAME_LABEL.equals(matcher.getName()))
        .findFirst()
        .map(LabelMatcher::getValue)
        .map(name -> metricIdentifierParser.parse(name, settings))
        .orElse(null);

    return new QueryPlan()
        .setMetric(metric)
        .setTimeRange(timeRange)
        .setPredicates(matcherCompiler.compile(query.getMatchers(), metric, settings));
  }
}
