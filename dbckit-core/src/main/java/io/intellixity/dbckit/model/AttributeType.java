package io.intellixity.dbckit.model;

public enum AttributeType {
  INT,
  HEX,
  FLOAT,
  STRING,
  ENUM;

  public boolean isNumeric() {
    return this == INT || this == HEX || this == FLOAT;
  }
}
