package io.intellixity.dbckit.statement;

import io.intellixity.dbckit.model.AttributeDefinition;

/** {@code BA_DEF_ [object type] "name" type params}; the definition carries no default yet. */
public record AttributeDefinitionStatement(int line, AttributeDefinition definition) implements DbcStatement {
  @Override
  public StatementKind kind() {
    return StatementKind.ATTRIBUTE_DEFINITION;
  }
}
