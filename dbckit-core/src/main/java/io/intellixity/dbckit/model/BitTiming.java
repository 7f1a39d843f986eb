package io.intellixity.dbckit.model;

/** Content of the {@code BS_} statement; all zero when the section is empty, as it almost always is. */
public record BitTiming(long baudrate, long btr1, long btr2) {
  public static final BitTiming UNSPECIFIED = new BitTiming(0, 0, 0);

  public boolean isSpecified() {
    return baudrate != 0 || btr1 != 0 || btr2 != 0;
  }
}
