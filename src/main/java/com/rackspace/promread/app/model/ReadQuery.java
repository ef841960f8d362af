package com.rackspace.promread.app.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class ReadQuery {
  long startTimestampMs;
  long endTimestampMs;
  List<LabelMatcher> matchers = new ArrayList<>();
}
