package io.intellixity.dbckit.grammar;

import io.intellixity.dbckit.ProblemCode;

/** Token sequence does not match the grammar of its statement; converted to a syntax problem by the classifier. */
public final class GrammarException extends RuntimeException {
  private final ProblemCode code;
  private final int line;
  private final int column;

  public GrammarException(ProblemCode code, int line, int column, String message) {
    super(message);
    this.code = code;
    this.line = line;
    this.column = column;
  }

  public ProblemCode code() { return code; }
  public int line() { return line; }
  public int column() { return column; }
}
