package io.intellixity.dbckit.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One CAN frame definition ({@code BO_}) with the signals declared under it, in file order.
 * <p>
 * {@code transmitter} is null when the statement names no sender or uses the {@code Vector__XXX}
 * placeholder. {@code cycleTime} is the {@code GenMsgCycleTime} attribute (or its default) in ms.
 */
public record Message(
    MessageId id,
    String name,
    int size,
    String transmitter,
    List<String> additionalTransmitters,
    List<Signal> signals,
    List<SignalGroup> signalGroups,
    String comment,
    Map<String, Object> attributes,
    long cycleTime
) {
  /** Placeholder node name DBC editors write when a message or signal has no sender/receiver. */
  public static final String NO_NODE = "Vector__XXX";

  /** Pseudo-message CANdb++ uses to hold signals not yet assigned to a real message. */
  public static final String INDEPENDENT_SIGNALS = "VECTOR__INDEPENDENT_SIG_MSG";

  public Message {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    if (size < 0) throw new IllegalArgumentException("size must be >= 0 for message " + name);
    if (NO_NODE.equals(transmitter) || (transmitter != null && transmitter.isBlank())) transmitter = null;
    additionalTransmitters = additionalTransmitters == null ? List.of() : List.copyOf(additionalTransmitters);
    signals = signals == null ? List.of() : List.copyOf(signals);
    signalGroups = signalGroups == null ? List.of() : List.copyOf(signalGroups);
    attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public boolean hasTransmitter() {
    return transmitter != null;
  }

  public boolean isIndependentSignals() {
    return INDEPENDENT_SIGNALS.equals(name);
  }

  public Signal signal(String signalName) {
    for (Signal s : signals) {
      if (s.name().equals(signalName)) return s;
    }
    return null;
  }

  /** The top-level multiplexor ({@code M}) of this message, or null. */
  public Signal multiplexor() {
    for (Signal s : signals) {
      if (s.multiplex().kind() == MultiplexRole.Kind.MULTIPLEXOR) return s;
    }
    return null;
  }

  public boolean isMultiplexed() {
    for (Signal s : signals) {
      if (s.multiplex().isMultiplexed()) return true;
    }
    return false;
  }
}
