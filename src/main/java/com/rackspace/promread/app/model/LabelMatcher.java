package com.rackspace.promread.app.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LabelMatcher {
  MatchType type;
  String name;
  String value;
}
