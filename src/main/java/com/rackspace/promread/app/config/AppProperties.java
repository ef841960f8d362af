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

package com.rackspace.promread.app.config;

import com.google.common.collect.ImmutableSet;
import com.rackspace.promread.app.config.configValidator.RegistryValidator;
import com.rackspace.promread.app.model.TranslationSettings;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("promread")
@Component
@Data
@Validated
@RegistryValidator
public class AppProperties {

  /**
   * Row cap rendered as the <code>LIMIT</code> of every compiled statement.
   */
  @Min(1)
  int rowLimit = 10000;

  /**
   * Maximum number of distinct series admitted into a single remote read response.
   * Rows for series first seen after this cap is reached are dropped.
   */
  @Min(1)
  int seriesLimit = 500;

  /**
   * Databases that may be addressed by a <code>db__table__metric</code> metric name.
   */
  @NotNull
  List<String> databases = List.of(
      "flow_log", "flow_metrics", "ext_metrics", "deepflow_system");

  /**
   * The database whose tables keep their tags in the generic <code>tag</code> column, the same
   * way the virtual prometheus views do.
   */
  @NotBlank
  String systemDatabase = "deepflow_system";

  /**
   * Namespace queried when a metric name does not address a physical table.
   */
  @NotBlank
  String virtualNamespace = "prometheus";

  /**
   * Tables recording bidirectional traffic, where a tag has distinct client and server columns.
   */
  @NotNull
  List<String> edgeTables = List.of(
      "vtap_flow_edge_port", "vtap_app_edge_port", "l4_flow_log", "l7_flow_log");

  /**
   * Tags reported by the catalog that are never selected as series labels.
   */
  @NotNull
  List<String> ignoredTags = List.of("lb_listener", "pod_ingress");

  @NotNull
  Querier querier = new Querier();

  @NotNull
  TagCatalog tagCatalog = new TagCatalog();

  public TranslationSettings toTranslationSettings() {
    return TranslationSettings.builder()
        .rowLimit(rowLimit)
        .seriesLimit(seriesLimit)
        .databases(ImmutableSet.copyOf(databases))
        .systemDatabase(systemDatabase)
        .virtualNamespace(virtualNamespace)
        .edgeTables(ImmutableSet.copyOf(edgeTables))
        .ignoredTags(ImmutableSet.copyOf(ignoredTags))
        .build();
  }

  @Data
  public static class Querier {
    @NotBlank
    String host = "localhost";

    @Min(1)
    int port = 20416;

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    Duration timeout = Duration.ofSeconds(60);
  }

  @Data
  public static class TagCatalog {
    /**
     * Maximum number of tag listings, one per table and statement, kept in memory.
     */
    @Min(0)
    long cacheSize = 1000;

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    Duration cacheTtl = Duration.ofMinutes(1);
  }
}
