package io.intellixity.dbckit;

import java.util.Objects;

/** One diagnostic with its source position; line and column are 1-based, 0 when not tied to a statement. */
public record DbcProblem(ProblemCode code, Severity severity, int line, int column, String message) {
  public enum Severity {
    ERROR,
    WARNING
  }

  public DbcProblem {
    Objects.requireNonNull(code, "code");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(message, "message");
  }

  public ProblemCategory category() {
    return code.category();
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public String toString() {
    String where = line > 0 ? ("line " + line + (column > 0 ? ":" + column : "") + ": ") : "";
    return where + code + " " + message;
  }
}
