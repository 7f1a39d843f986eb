package io.intellixity.dbckit.model;

/** Signal bit numbering convention; the code is the digit after {@code @} in a signal statement. */
public enum ByteOrder {
  BIG_ENDIAN('0', "Motorola"),
  LITTLE_ENDIAN('1', "Intel");

  private final char code;
  private final String displayName;

  ByteOrder(char code, String displayName) {
    this.code = code;
    this.displayName = displayName;
  }

  public char code() { return code; }
  public String displayName() { return displayName; }

  public static ByteOrder fromCode(String code) {
    if ("0".equals(code)) return BIG_ENDIAN;
    if ("1".equals(code)) return LITTLE_ENDIAN;
    throw new IllegalArgumentException("Unknown byte order code: " + code);
  }
}
