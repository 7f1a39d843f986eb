package io.intellixity.dbckit;

import java.util.List;

/**
 * Raised when a DBC buffer cannot be turned into a model.
 * <p>
 * {@link #problems()} holds the first error only, or every error found when
 * {@link ParseOptions#collectAllErrors()} is set. The concrete subclass follows the category of the
 * first error; see {@link #of(List)}.
 */
public class DbcParseException extends RuntimeException {
  private final List<DbcProblem> problems;

  public DbcParseException(List<DbcProblem> problems) {
    super(describe(problems));
    if (problems == null || problems.isEmpty()) throw new IllegalArgumentException("problems must not be empty");
    this.problems = List.copyOf(problems);
  }

  public List<DbcProblem> problems() {
    return problems;
  }

  public DbcProblem first() {
    return problems.get(0);
  }

  public static DbcParseException of(List<DbcProblem> problems) {
    if (problems == null || problems.isEmpty()) throw new IllegalArgumentException("problems must not be empty");
    return switch (problems.get(0).category()) {
      case LEX -> new DbcLexException(problems);
      case SYNTAX -> new DbcSyntaxException(problems);
      case SEMANTIC -> new DbcSemanticException(problems);
      case UNRECOGNIZED -> new DbcParseException(problems);
    };
  }

  private static String describe(List<DbcProblem> problems) {
    if (problems == null || problems.isEmpty()) return "DBC parse failed";
    if (problems.size() == 1) return problems.get(0).toString();
    return problems.get(0) + " (and " + (problems.size() - 1) + " more)";
  }
}
