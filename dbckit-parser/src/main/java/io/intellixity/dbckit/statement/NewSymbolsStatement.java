package io.intellixity.dbckit.statement;

import java.util.List;

/** {@code NS_ :} followed by the new-symbol keywords the file may use. */
public record NewSymbolsStatement(int line, List<String> symbols) implements DbcStatement {
  @Override
  public StatementKind kind() {
    return StatementKind.NEW_SYMBOLS;
  }
}
