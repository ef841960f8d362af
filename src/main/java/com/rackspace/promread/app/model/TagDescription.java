package com.rackspace.promread.app.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One tag reported by the tag catalog. Directional tables store a tag twice, once under its
 * client-side and once under its server-side column name.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TagDescription {
  String name;
  String clientName;
  String serverName;

  public boolean isDirectional() {
    return !name.equals(clientName);
  }
}
