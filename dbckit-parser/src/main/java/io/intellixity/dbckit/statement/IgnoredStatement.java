package io.intellixity.dbckit.statement;

/**
 * Well-formed statement whose content has no place in the model, e.g. value descriptions of
 * environment variables.
 */
public record IgnoredStatement(int line, StatementKind kind, String reason) implements DbcStatement {
}
