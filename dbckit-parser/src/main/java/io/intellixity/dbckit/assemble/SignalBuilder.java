package io.intellixity.dbckit.assemble;

import io.intellixity.dbckit.layout.BitLayout;
import io.intellixity.dbckit.model.Signal;
import io.intellixity.dbckit.model.SwitchRange;
import io.intellixity.dbckit.model.ValueType;
import io.intellixity.dbckit.statement.SignalStatement;

import java.util.LinkedHashMap;
import java.util.Map;

/** Mutable signal state while later statements are applied to it. */
final class SignalBuilder {
  final SignalStatement declared;
  ValueType valueType;
  SwitchRange switchRange;
  String valueTable;
  Map<Long, String> valueDescriptions = new LinkedHashMap<>();
  String comment;
  final Map<String, Object> attributes = new LinkedHashMap<>();

  SignalBuilder(SignalStatement declared) {
    this.declared = declared;
    this.valueType = declared.valueType();
  }

  String name() {
    return declared.name();
  }

  Signal build(BitLayout layout, double initialValue) {
    SignalStatement s = declared;
    return new Signal(s.name(), s.startBit(), s.length(), s.byteOrder(), valueType, s.factor(), s.offset(),
        s.minimum(), s.maximum(), s.unit(), s.receivers(), s.multiplex(), switchRange, valueTable,
        valueDescriptions, initialValue, comment, attributes, layout);
  }
}
