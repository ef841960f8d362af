package com.rackspace.promread.app.model;

import com.rackspace.promread.app.exceptions.CellTypeException;
import java.time.Instant;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A single value of a querier result row. Each cell carries exactly one of the kinds a result
 * column may hold and only exposes the accessor of that kind.
 */
@EqualsAndHashCode
@ToString
public final class Cell {

  public enum Kind {
    INTEGER,
    FLOAT,
    STRING,
    TIMESTAMP,
    /**
     * A float that may be absent, as returned for nullable columns.
     */
    NULLABLE_FLOAT
  }

  @Getter
  private final Kind kind;
  private final Object value;

  private Cell(Kind kind, Object value) {
    this.kind = kind;
    this.value = value;
  }

  public static Cell ofInteger(long value) {
    return new Cell(Kind.INTEGER, value);
  }

  public static Cell ofFloat(double value) {
    return new Cell(Kind.FLOAT, value);
  }

  public static Cell ofString(String value) {
    if (value == null) {
      throw new IllegalArgumentException("string cell requires a value");
    }
    return new Cell(Kind.STRING, value);
  }

  public static Cell ofTimestamp(Instant value) {
    if (value == null) {
      throw new IllegalArgumentException("timestamp cell requires a value");
    }
    return new Cell(Kind.TIMESTAMP, value);
  }

  public static Cell ofNullableFloat(Double value) {
    return new Cell(Kind.NULLABLE_FLOAT, value);
  }

  public long integerValue() {
    requireKind(Kind.INTEGER);
    return (Long) value;
  }

  public double floatValue() {
    requireKind(Kind.FLOAT);
    return (Double) value;
  }

  public String stringValue() {
    requireKind(Kind.STRING);
    return (String) value;
  }

  public Instant timestampValue() {
    requireKind(Kind.TIMESTAMP);
    return (Instant) value;
  }

  /**
   * @return the float or <code>null</code> when the cell holds no value
   */
  public Double nullableFloatValue() {
    requireKind(Kind.NULLABLE_FLOAT);
    return (Double) value;
  }

  private void requireKind(Kind expected) {
    if (kind != expected) {
      throw new CellTypeException(expected, kind);
    }
  }
}
