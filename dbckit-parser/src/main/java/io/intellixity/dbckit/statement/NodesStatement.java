package io.intellixity.dbckit.statement;

import java.util.List;

/** {@code BU_: name name ...} */
public record NodesStatement(int line, List<String> names) implements DbcStatement {
  @Override
  public StatementKind kind() {
    return StatementKind.NODES;
  }
}
