package io.intellixity.dbckit;

import java.util.List;

/** Malformed quoting or statement boundaries; the text cannot be split into statements. */
public final class DbcLexException extends DbcParseException {
  public DbcLexException(List<DbcProblem> problems) {
    super(problems);
  }
}
