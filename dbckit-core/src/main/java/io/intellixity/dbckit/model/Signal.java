package io.intellixity.dbckit.model;

import io.intellixity.dbckit.layout.BitLayout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One signal of a message.
 * <p>
 * {@code valueDescriptions} holds the labels of a {@code VAL_} statement for this signal, or the entries
 * of the value table named by {@code valueTable} when the signal links to one. {@code switchRange} is
 * null unless an {@code SG_MUL_VAL_} statement names the signal.
 */
public record Signal(
    String name,
    int startBit,
    int length,
    ByteOrder byteOrder,
    ValueType valueType,
    double factor,
    double offset,
    double minimum,
    double maximum,
    String unit,
    List<String> receivers,
    MultiplexRole multiplex,
    SwitchRange switchRange,
    String valueTable,
    Map<Long, String> valueDescriptions,
    double initialValue,
    String comment,
    Map<String, Object> attributes,
    BitLayout layout
) {
  public Signal {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(byteOrder, "byteOrder");
    Objects.requireNonNull(valueType, "valueType");
    unit = unit == null ? "" : unit;
    receivers = receivers == null ? List.of() : List.copyOf(receivers);
    multiplex = multiplex == null ? MultiplexRole.NONE : multiplex;
    valueDescriptions = valueDescriptions == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(valueDescriptions));
    attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public boolean isSigned() {
    return valueType != ValueType.UNSIGNED;
  }

  /** physical = raw * factor + offset */
  public double toPhysical(double raw) {
    return raw * factor + offset;
  }

  /** Initial value ({@code GenSigStartValue}) converted to physical units. */
  public double physicalInitialValue() {
    return toPhysical(initialValue);
  }

  /** Start bit as displayed by CANdb++; see {@link BitLayout#displayStartBit()}. */
  public int displayStartBit() {
    return layout != null ? layout.displayStartBit() : startBit;
  }

  /** Label of a raw value, or null. */
  public String describe(long raw) {
    return valueDescriptions.get(raw);
  }
}
