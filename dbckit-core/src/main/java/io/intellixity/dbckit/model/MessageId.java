package io.intellixity.dbckit.model;

import java.util.Objects;

/**
 * CAN message identifier as written in a DBC file.
 * <p>
 * The DBC encoding flags 29-bit (extended) identifiers by setting bit 31 of the 32-bit value; the
 * wire identifier is the encoded value with that bit cleared.
 */
public final class MessageId implements Comparable<MessageId> {
  public static final long EXTENDED_FLAG = 0x8000_0000L;
  public static final int STANDARD_MAX = 0x7FF;
  public static final int EXTENDED_MAX = 0x1FFF_FFFF;

  public enum Kind {
    STANDARD(11),
    EXTENDED(29);

    private final int bits;

    Kind(int bits) {
      this.bits = bits;
    }

    public int bits() {
      return bits;
    }
  }

  private final long raw;
  private final Kind kind;

  private MessageId(long raw, Kind kind) {
    this.raw = raw;
    this.kind = kind;
  }

  /** Decode the 32-bit value used by {@code BO_} and every statement that references a message. */
  public static MessageId of(long encoded) {
    if (encoded < 0 || encoded > 0xFFFF_FFFFL) {
      throw new IllegalArgumentException("Message id does not fit in 32 bits: " + encoded);
    }
    if ((encoded & EXTENDED_FLAG) != 0) {
      return new MessageId(encoded & ~EXTENDED_FLAG, Kind.EXTENDED);
    }
    return new MessageId(encoded, Kind.STANDARD);
  }

  public static MessageId standard(long raw) {
    return of(raw & ~EXTENDED_FLAG);
  }

  public static MessageId extended(long raw) {
    return of((raw & ~EXTENDED_FLAG) | EXTENDED_FLAG);
  }

  /** Identifier as sent on the bus (extended flag removed). */
  public long raw() { return raw; }

  public Kind kind() { return kind; }

  public boolean isExtended() { return kind == Kind.EXTENDED; }

  /** Value as written in the DBC file (extended flag restored). */
  public long encoded() {
    return kind == Kind.EXTENDED ? raw | EXTENDED_FLAG : raw;
  }

  /** Whether {@link #raw()} fits in the bit width of {@link #kind()}. */
  public boolean inRange() {
    return raw <= (kind == Kind.EXTENDED ? EXTENDED_MAX : STANDARD_MAX);
  }

  @Override
  public int compareTo(MessageId o) {
    int c = kind.compareTo(o.kind);
    return c != 0 ? c : Long.compare(raw, o.raw);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof MessageId other)) return false;
    return raw == other.raw && kind == other.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(raw, kind);
  }

  @Override
  public String toString() {
    return String.format(kind == Kind.EXTENDED ? "0x%08X(ext)" : "0x%03X", raw);
  }
}
