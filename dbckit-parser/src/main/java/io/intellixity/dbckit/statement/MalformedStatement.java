package io.intellixity.dbckit.statement;

/**
 * Placeholder for a recognized statement that failed its grammar while errors are being collected.
 * Lets the assembler drop the signals of a message whose {@code BO_} line was rejected.
 */
public record MalformedStatement(int line, StatementKind kind) implements DbcStatement {
}
