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

import com.rackspace.promread.app.model.MetricIdentifier;
import com.rackspace.promread.app.model.TagDescription;
import com.rackspace.promread.app.model.TimeRange;
import com.rackspace.promread.app.model.TranslationSettings;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Decides which tag columns are selected next to the metric.
 */
@Component
@Slf4j
public class TagExpander {

  /**
   * Column holding all tags of a row serialized as a JSON object.
   */
  public static final String TAGS_COLUMN = "tag";

  private final TagCatalog tagCatalog;

  @Autowired
  public TagExpander(TagCatalog tagCatalog) {
    this.tagCatalog = tagCatalog;
  }

  /**
   * Tables of the virtual views and of the system database carry their tags in the generic
   * {@value #TAGS_COLUMN} column. Physical tables are described by the tag catalog, and when that
   * lookup fails or finds nothing the query proceeds without tag columns.
   */
  public Mono<List<String>> expand(MetricIdentifier metric, TimeRange timeRange,
                                   TranslationSettings settings) {
    if (!metric.isResolved() || settings.isSystemDatabase(metric.getDatabase())) {
      return Mono.just(List.of(TAGS_COLUMN));
    }

    final String statement = String.format("SHOW tags FROM %s WHERE time >= %d AND time <= %d",
        metric.getTable(), timeRange.getStart(), timeRange.getEnd());
    return tagCatalog
        .getTagDescriptions(metric.getDatabase(), metric.getTable(), statement, timeRange)
        .map(descriptions -> toColumns(metric.getTable(), descriptions, settings))
        .onErrorResume(e -> {
          log.warn("Tag discovery failed for {}.{}, selecting no tag columns",
              metric.getDatabase(), metric.getTable(), e);
          return Mono.just(List.of());
        })
        .defaultIfEmpty(List.of());
  }

  List<String> toColumns(String table, List<TagDescription> descriptions,
                         TranslationSettings settings) {
    final boolean edgeTable = settings.isEdgeTable(table);
    final List<String> columns = new ArrayList<>();
    for (TagDescription description : descriptions) {
      if (settings.getIgnoredTags().contains(description.getName())) {
        continue;
      }
      if (edgeTable && description.isDirectional()) {
        columns.add(quoteColumn(description.getClientName()));
        columns.add(quoteColumn(description.getServerName()));
      } else {
        columns.add(quoteColumn(description.getName()));
      }
    }
    return columns;
  }

  private static String quoteColumn(String name) {
    return "`" + name + "`";
  }
}
