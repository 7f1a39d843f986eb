package io.intellixity.dbckit.assemble;

import io.intellixity.dbckit.model.Message;
import io.intellixity.dbckit.model.MessageId;
import io.intellixity.dbckit.model.Signal;
import io.intellixity.dbckit.model.SignalGroup;
import io.intellixity.dbckit.statement.MessageStatement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Mutable message state: the BO_ line, its signals in file order and everything applied later. */
final class MessageBuilder {
  final MessageStatement declared;
  final MessageId id;
  final List<SignalBuilder> signals = new ArrayList<>();
  final List<String> additionalTransmitters = new ArrayList<>();
  final List<SignalGroup> signalGroups = new ArrayList<>();
  final Map<String, Object> attributes = new LinkedHashMap<>();
  String comment;

  MessageBuilder(MessageStatement declared) {
    this.declared = declared;
    this.id = MessageId.of(declared.encodedId());
  }

  boolean isIndependentSignals() {
    return Message.INDEPENDENT_SIGNALS.equals(declared.name());
  }

  /** First signal with the given name; duplicates are left to validation. */
  SignalBuilder signal(String name) {
    for (SignalBuilder s : signals) {
      if (s.name().equals(name)) return s;
    }
    return null;
  }

  Message build(List<Signal> builtSignals, long cycleTime) {
    return new Message(id, declared.name(), declared.size(), declared.transmitter(), additionalTransmitters,
        builtSignals, signalGroups, comment, attributes, cycleTime);
  }
}
