package io.intellixity.dbckit;

import java.util.List;

/** Statements parse but the assembled model violates a structural invariant. */
public final class DbcSemanticException extends DbcParseException {
  public DbcSemanticException(List<DbcProblem> problems) {
    super(problems);
  }
}
