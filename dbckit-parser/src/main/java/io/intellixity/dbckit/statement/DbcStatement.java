package io.intellixity.dbckit.statement;

/** Typed record produced by one statement grammar. */
public interface DbcStatement {
  /** 1-based source line of the statement's keyword. */
  int line();

  StatementKind kind();
}
