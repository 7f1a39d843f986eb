package io.intellixity.dbckit;

import java.util.List;

/** A recognized statement does not match its keyword's grammar. */
public final class DbcSyntaxException extends DbcParseException {
  public DbcSyntaxException(List<DbcProblem> problems) {
    super(problems);
  }
}
