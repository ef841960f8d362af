package com.rackspace.promread.app.model;

import lombok.Getter;

/**
 * Label matcher operators of the remote read protocol, keyed by their wire number.
 */
public enum MatchType {
  EQ(0),
  NEQ(1),
  RE(2),
  NRE(3);

  @Getter
  private final int number;

  MatchType(int number) {
    this.number = number;
  }

  /**
   * @return the matching type or <code>null</code> when the wire number is not a known operator
   */
  public static MatchType forNumber(int number) {
    for (MatchType type : values()) {
      if (type.number == number) {
        return type;
      }
    }
    return null;
  }
}
