package com.rackspace.promread.app.model;

import lombok.Value;

/**
 * Inclusive time filter bounds in whole epoch seconds.
 */
@Value
public class TimeRange {
  long start;
  long end;

  /**
   * Converts remote read millisecond bounds to seconds. The end is rounded up when it carries a
   * millisecond remainder so the filter never ends short of the requested range.
   */
  public static TimeRange fromMillis(long startMs, long endMs) {
    final long start = startMs / 1000;
    long end = endMs / 1000;
    if (endMs % 1000 > 0) {
      end += 1;
    }
    if (start > end) {
      throw new IllegalArgumentException(
          String.format("start time %d is after end time %d", startMs, endMs));
    }
    return new TimeRange(start, end);
  }
}
