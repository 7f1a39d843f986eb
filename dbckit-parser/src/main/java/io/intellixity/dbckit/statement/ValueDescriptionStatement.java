package io.intellixity.dbckit.statement;

import java.util.List;

/**
 * {@code VAL_ id signal value "label" ...} or {@code VAL_ id signal TableName}.
 * <p>
 * Exactly one of {@code entries} (non-empty) and {@code tableName} (non-null) describes the signal.
 */
public record ValueDescriptionStatement(int line,
                                        long encodedId,
                                        String signalName,
                                        List<ValueEntry> entries,
                                        String tableName) implements DbcStatement {
  public ValueDescriptionStatement {
    entries = entries == null ? List.of() : List.copyOf(entries);
  }

  public boolean referencesTable() {
    return tableName != null;
  }

  @Override
  public StatementKind kind() {
    return StatementKind.VALUE_DESCRIPTION;
  }
}
