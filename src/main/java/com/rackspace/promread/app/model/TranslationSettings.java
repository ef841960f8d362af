package com.rackspace.promread.app.model;

import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of the caps and registries a single translation runs against.
 */
@Value
@Builder
public class TranslationSettings {
  int rowLimit;
  int seriesLimit;
  Set<String> databases;
  String systemDatabase;
  String virtualNamespace;
  Set<String> edgeTables;
  Set<String> ignoredTags;

  public boolean isSystemDatabase(String database) {
    return systemDatabase.equals(database);
  }

  public boolean isEdgeTable(String table) {
    return edgeTables.contains(table);
  }
}
