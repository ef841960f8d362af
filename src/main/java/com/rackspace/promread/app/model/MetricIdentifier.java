package com.rackspace.promread.app.model;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;

/**
 * Physical location of a metric decoded from a <code>__name__</code> matcher. An empty database
 * means the metric is read from the virtual view named after it.
 */
@Data
public class MetricIdentifier {
  String database = "";
  String table = "";
  String metricName;
  String dataSource = "";
  /**
   * The column expression that selects this metric's value.
   */
  String selectExpression;

  public boolean isResolved() {
    return StringUtils.isNotEmpty(database);
  }
}
