package io.intellixity.dbckit.model;

public enum ValueType {
  SIGNED(0),
  UNSIGNED(0),
  /** IEEE 754 single precision; declared with {@code SIG_VALTYPE_ ... : 1}. */
  IEEE_FLOAT(32),
  /** IEEE 754 double precision; declared with {@code SIG_VALTYPE_ ... : 2}. */
  IEEE_DOUBLE(64);

  private final int requiredLength;

  ValueType(int requiredLength) {
    this.requiredLength = requiredLength;
  }

  /** Bit length a signal of this type must have, or 0 when any length is accepted. */
  public int requiredLength() {
    return requiredLength;
  }

  public boolean isFloatingPoint() {
    return requiredLength != 0;
  }

  public static ValueType fromSign(String sign) {
    if ("+".equals(sign)) return UNSIGNED;
    if ("-".equals(sign)) return SIGNED;
    throw new IllegalArgumentException("Unknown value sign: " + sign);
  }

  /** Maps the {@code SIG_VALTYPE_} code; code 0 keeps the integer type the signal was declared with. */
  public static ValueType fromExtendedCode(int code, ValueType declared) {
    return switch (code) {
      case 0 -> declared.isFloatingPoint() ? SIGNED : declared;
      case 1 -> IEEE_FLOAT;
      case 2 -> IEEE_DOUBLE;
      default -> throw new IllegalArgumentException("Unknown signal value type code: " + code);
    };
  }
}
