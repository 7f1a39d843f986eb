package io.intellixity.dbckit.model;

import java.util.Objects;

/**
 * Multiplexing role of a signal, from the indicator between the signal name and the colon.
 * <p>
 * {@code M} marks the multiplexor, {@code m<n>} a signal present when the multiplexor equals {@code n},
 * and {@code m<n>M} a multiplexed signal that itself selects further signals (extended multiplexing).
 */
public record MultiplexRole(Kind kind, long switchValue) {
  public enum Kind {
    NONE,
    MULTIPLEXOR,
    MULTIPLEXED,
    MULTIPLEXED_MULTIPLEXOR
  }

  public static final MultiplexRole NONE = new MultiplexRole(Kind.NONE, 0);
  public static final MultiplexRole MULTIPLEXOR = new MultiplexRole(Kind.MULTIPLEXOR, 0);

  public MultiplexRole {
    Objects.requireNonNull(kind, "kind");
    if (switchValue < 0) throw new IllegalArgumentException("switchValue must be >= 0");
    if (kind == Kind.NONE || kind == Kind.MULTIPLEXOR) switchValue = 0;
  }

  public static MultiplexRole multiplexed(long switchValue) {
    return new MultiplexRole(Kind.MULTIPLEXED, switchValue);
  }

  public static MultiplexRole multiplexedMultiplexor(long switchValue) {
    return new MultiplexRole(Kind.MULTIPLEXED_MULTIPLEXOR, switchValue);
  }

  /** True for signals that only appear for one multiplexor value. */
  public boolean isMultiplexed() {
    return kind == Kind.MULTIPLEXED || kind == Kind.MULTIPLEXED_MULTIPLEXOR;
  }

  /** True for signals whose value selects other signals. */
  public boolean isMultiplexor() {
    return kind == Kind.MULTIPLEXOR || kind == Kind.MULTIPLEXED_MULTIPLEXOR;
  }

  /** Indicator as written in a signal statement, empty for plain signals. */
  public String indicator() {
    return switch (kind) {
      case NONE -> "";
      case MULTIPLEXOR -> "M";
      case MULTIPLEXED -> "m" + switchValue;
      case MULTIPLEXED_MULTIPLEXOR -> "m" + switchValue + "M";
    };
  }
}
