package io.intellixity.dbckit.statement;

/** {@code BA_ "name" [object] value}; value is a Long, Double or String as written. */
public record AttributeValueStatement(int line, String name, ObjectRef target, Object value) implements DbcStatement {
  @Override
  public StatementKind kind() {
    return StatementKind.ATTRIBUTE_VALUE;
  }
}
