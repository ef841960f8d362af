package com.rackspace.promread.app.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class TagCatalogCacheKey {
  String database;
  String table;
  /**
   * The <code>SHOW tags</code> statement, which carries the time range being described.
   */
  String statement;
}
