package com.rackspace.promread.app.model;

/**
 * Declared column kinds reported in a querier result schema.
 */
public enum ValueType {
  INT("Int"),
  FLOAT64("Float64"),
  NULLABLE_FLOAT64("Nullable(Float64)"),
  STRING("String"),
  DATETIME("DateTime"),
  OTHER("");

  private final String typeName;

  ValueType(String typeName) {
    this.typeName = typeName;
  }

  public static ValueType fromTypeName(String typeName) {
    for (ValueType valueType : values()) {
      if (valueType != OTHER && valueType.typeName.equals(typeName)) {
        return valueType;
      }
    }
    return OTHER;
  }
}
