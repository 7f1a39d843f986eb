package io.intellixity.dbckit.grammar;

import io.intellixity.dbckit.lex.TokenType;
import io.intellixity.dbckit.statement.*;

import java.util.ArrayList;
import java.util.List;

/** Value tables and per-signal value descriptions. */
final class ValueGrammars {
  private ValueGrammars() {}

  // VAL_TABLE_ Gear 0 "P" 1 "R" 2 "N" 3 "D"
  static DbcStatement valueTable(TokenCursor in) {
    String name = in.identifier("value table name");
    return new ValueTableStatement(in.line(), name, entries(in));
  }

  // VAL_ 256 Gear 0 "P" 1 "R"   |   VAL_ 256 Gear GearTable
  static DbcStatement valueDescription(TokenCursor in) {
    if (in.at(TokenType.IDENTIFIER)) {
      String variable = in.next().text();
      while (!in.atEnd()) in.next();
      return new IgnoredStatement(in.line(), StatementKind.VALUE_DESCRIPTION,
          "value descriptions of environment variable " + variable);
    }
    long id = MessageGrammars.messageId(in);
    String signal = in.identifier("signal name");
    if (in.at(TokenType.IDENTIFIER) && in.peek(1) == null) {
      return new ValueDescriptionStatement(in.line(), id, signal, List.of(), in.identifier("value table name"));
    }
    return new ValueDescriptionStatement(in.line(), id, signal, entries(in), null);
  }

  private static List<ValueEntry> entries(TokenCursor in) {
    List<ValueEntry> out = new ArrayList<>();
    while (!in.atEnd()) {
      long value = in.integer("raw value");
      out.add(new ValueEntry(value, in.string("value label")));
    }
    return out;
  }
}
