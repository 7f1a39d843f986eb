package io.intellixity.dbckit.statement;

/** {@code BA_DEF_DEF_ "name" value}; value is a Long, Double or String as written. */
public record AttributeDefaultStatement(int line, String name, Object value) implements DbcStatement {
  @Override
  public StatementKind kind() {
    return StatementKind.ATTRIBUTE_DEFAULT;
  }
}
