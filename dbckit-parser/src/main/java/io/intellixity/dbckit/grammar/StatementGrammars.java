package io.intellixity.dbckit.grammar;

import io.intellixity.dbckit.statement.StatementKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Grammar per statement kind.\n
 *
 * Adding a statement means adding a {@link StatementKind} constant and one entry here; nothing else
 * dispatches on keywords.\n
 */
public final class StatementGrammars {
  private static final Map<StatementKind, StatementGrammar> TABLE;

  static {
    Map<StatementKind, StatementGrammar> m = new EnumMap<>(StatementKind.class);
    m.put(StatementKind.VERSION, HeaderGrammars::version);
    m.put(StatementKind.NEW_SYMBOLS, HeaderGrammars::newSymbols);
    m.put(StatementKind.BIT_TIMING, HeaderGrammars::bitTiming);
    m.put(StatementKind.NODES, HeaderGrammars::nodes);
    m.put(StatementKind.MESSAGE, MessageGrammars::message);
    m.put(StatementKind.SIGNAL, MessageGrammars::signal);
    m.put(StatementKind.MESSAGE_TRANSMITTERS, MessageGrammars::messageTransmitters);
    m.put(StatementKind.SIGNAL_VALUE_TYPE, MessageGrammars::signalValueType);
    m.put(StatementKind.SIGNAL_GROUP, MessageGrammars::signalGroup);
    m.put(StatementKind.MULTIPLEX_RANGE, MessageGrammars::multiplexRange);
    m.put(StatementKind.VALUE_TABLE, ValueGrammars::valueTable);
    m.put(StatementKind.VALUE_DESCRIPTION, ValueGrammars::valueDescription);
    m.put(StatementKind.COMMENT, AttributeGrammars::comment);
    m.put(StatementKind.ATTRIBUTE_DEFINITION, AttributeGrammars::attributeDefinition);
    m.put(StatementKind.ATTRIBUTE_DEFAULT, AttributeGrammars::attributeDefault);
    m.put(StatementKind.ATTRIBUTE_VALUE, AttributeGrammars::attributeValue);
    for (StatementKind k : StatementKind.values()) {
      if (!m.containsKey(k)) throw new IllegalStateException("No grammar for " + k);
    }
    TABLE = Collections.unmodifiableMap(m);
  }

  private StatementGrammars() {}

  public static StatementGrammar forKind(StatementKind kind) {
    return TABLE.get(kind);
  }
}
