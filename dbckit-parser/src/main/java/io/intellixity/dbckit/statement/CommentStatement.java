package io.intellixity.dbckit.statement;

/** {@code CM_ [object] "text"} */
public record CommentStatement(int line, ObjectRef target, String text) implements DbcStatement {
  @Override
  public StatementKind kind() {
    return StatementKind.COMMENT;
  }
}
