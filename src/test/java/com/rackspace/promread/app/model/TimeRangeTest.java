package com.rackspace.promread.app.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class TimeRangeTest {

  @Test
  void roundsEndUpOnMillisecondRemainder() {
    TimeRange range = TimeRange.fromMillis(1000, 2500);

    assertThat(range.getStart()).isEqualTo(1);
    assertThat(range.getEnd()).isEqualTo(3);
  }

  @Test
  void exactSecondsAreKept() {
    TimeRange range = TimeRange.fromMillis(1000, 2000);

    assertThat(range.getStart()).isEqualTo(1);
    assertThat(range.getEnd()).isEqualTo(2);
  }

  @Test
  void startIsTruncated() {
    TimeRange range = TimeRange.fromMillis(1999, 2001);

    assertThat(range.getStart()).isEqualTo(1);
    assertThat(range.getEnd()).isEqualTo(3);
  }

  @Test
  void subSecondRangeStaysValid() {
    TimeRange range = TimeRange.fromMillis(1200, 1300);

    assertThat(range.getStart()).isEqualTo(1);
    assertThat(range.getEnd()).isEqualTo(2);
  }

  @Test
  void startAfterEnd() {
    assertThrows(IllegalArgumentException.class, () -> TimeRange.fromMillis(5000, 1000));
  }
}
