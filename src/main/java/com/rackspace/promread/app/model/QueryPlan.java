package com.rackspace.promread.app.model;

import java.util.List;
import lombok.Data;

/**
 * Parts of a remote read query resolved before tag discovery.
 */
@Data
public class QueryPlan {
  MetricIdentifier metric;
  List<String> predicates;
  TimeRange timeRange;
}
