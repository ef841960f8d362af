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

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.rackspace.promread.app.model.Cell;
import com.rackspace.promread.app.model.CompiledQuery;
import com.rackspace.promread.app.model.ResultSet;
import com.rackspace.promread.app.model.TagCatalogCacheKey;
import com.rackspace.promread.app.model.TagDescription;
import com.rackspace.promread.app.model.TimeRange;
import com.rackspace.promread.app.utils.LabelFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Describes tables by running their <code>SHOW tags</code> statement on the querier. Listings
 * are cached per table and statement for a short while, failed lookups are not cached.
 */
@Service
@Slf4j
public class QuerierTagCatalog implements TagCatalog {

  private static final String COL_NAME = "name";
  private static final String COL_CLIENT_NAME = "client_name";
  private static final String COL_SERVER_NAME = "server_name";

  private final QueryExecutor queryExecutor;
  private final AsyncCache<TagCatalogCacheKey, List<TagDescription>> tagDescriptionCache;

  @Autowired
  public QuerierTagCatalog(QueryExecutor queryExecutor,
                           AsyncCache<TagCatalogCacheKey, List<TagDescription>> tagDescriptionCache) {
    this.queryExecutor = queryExecutor;
    this.tagDescriptionCache = tagDescriptionCache;
  }

  @Override
  public Mono<List<TagDescription>> getTagDescriptions(String database, String table,
                                                       String statement, TimeRange timeRange) {
    final CompletableFuture<List<TagDescription>> result = tagDescriptionCache.get(
        new TagCatalogCacheKey(database, table, statement),
        (key, executor) -> queryExecutor.execute(new CompiledQuery(statement, database, ""))
            .map(QuerierTagCatalog::toDescriptions)
            .doOnNext(descriptions ->
                log.debug("Discovered {} tags for {}.{}", descriptions.size(), database, table))
            .toFuture()
    );
    return Mono.fromFuture(result);
  }

  static List<TagDescription> toDescriptions(ResultSet resultSet) {
    final int nameIndex = indexOf(resultSet, COL_NAME, 0);
    final int clientIndex = indexOf(resultSet, COL_CLIENT_NAME, 1);
    final int serverIndex = indexOf(resultSet, COL_SERVER_NAME, 2);
    final int width = Math.max(nameIndex, Math.max(clientIndex, serverIndex)) + 1;

    final List<TagDescription> descriptions = new ArrayList<>();
    for (List<Cell> row : resultSet.getValues()) {
      if (row.size() < width) {
        log.warn("Skipping tag description row with {} of {} columns", row.size(), width);
        continue;
      }
      descriptions.add(new TagDescription(
          LabelFormatter.formatValue(row.get(nameIndex)),
          LabelFormatter.formatValue(row.get(clientIndex)),
          LabelFormatter.formatValue(row.get(serverIndex))));
    }
    return descriptions;
  }

  private static int indexOf(ResultSet resultSet, String column, int fallback) {
    final int index = resultSet.getColumns().indexOf(column);
    return index < 0 ? fallback : index;
  }
}
