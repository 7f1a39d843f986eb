package io.intellixity.dbckit.statement;

/** {@code VERSION "text"} */
public record VersionStatement(int line, String version) implements DbcStatement {
  @Override
  public StatementKind kind() {
    return StatementKind.VERSION;
  }
}
