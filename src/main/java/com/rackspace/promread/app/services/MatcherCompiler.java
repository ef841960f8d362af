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

import com.rackspace.promread.app.exceptions.UnsupportedMatcherTypeException;
import com.rackspace.promread.app.model.LabelMatcher;
import com.rackspace.promread.app.model.MetricIdentifier;
import com.rackspace.promread.app.model.TranslationSettings;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Compiles label matchers into SQL predicates. Physical tables expose tags as plain columns
 * while the virtual views and the system database keep them under the <code>tag.</code>
 * namespace.
 */
@Component
public class MatcherCompiler {

  public static final String METRIC_NAME_LABEL = "__name__";

  public List<String> compile(List<LabelMatcher> matchers, MetricIdentifier metric,
                              TranslationSettings settings) {
    final boolean rawColumns = metric != null && metric.isResolved()
        && !settings.isSystemDatabase(metric.getDatabase());

    final List<String> predicates = new ArrayList<>();
    for (LabelMatcher matcher : matchers) {
      if (METRIC_NAME_LABEL.equals(matcher.getName())) {
        continue;
      }
      final String column = rawColumns ?
          matcher.getName() :
          String.format("`tag.%s`", matcher.getName());
      predicates.add(column + operator(matcher) + quote(matcher.getValue()));
    }
    return predicates;
  }

  private String operator(LabelMatcher matcher) {
    if (matcher.getType() == null) {
      throw new UnsupportedMatcherTypeException(matcher.getName(), null);
    }
    return switch (matcher.getType()) {
      case EQ -> "=";
      case NEQ -> "!=";
      case RE -> " regexp ";
      case NRE -> " not regexp ";
    };
  }

  static String quote(String value) {
    final String escaped = value == null ? "" :
        value.replace("\\", "\\\\").replace("'", "\\'");
    return "'" + escaped + "'";
  }
}
