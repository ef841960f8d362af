package com.rackspace.promread.app.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompiledQuery {
  String sql;
  String database;
  String dataSource;
}
