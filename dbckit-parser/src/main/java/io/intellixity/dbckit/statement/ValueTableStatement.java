package io.intellixity.dbckit.statement;

import java.util.List;

/** {@code VAL_TABLE_ name value "label" ...}; entries keep duplicates so the assembler can report them. */
public record ValueTableStatement(int line, String name, List<ValueEntry> entries) implements DbcStatement {
  @Override
  public StatementKind kind() {
    return StatementKind.VALUE_TABLE;
  }
}
