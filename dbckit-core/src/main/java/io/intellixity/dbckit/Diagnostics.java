package io.intellixity.dbckit;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Problem sink shared by the lexer, the statement grammars, the assembler and the validation rules of
 * one parse call.
 * <p>
 * Severity is decided here from {@link ParseOptions}. Unless {@link ParseOptions#collectAllErrors()} is
 * set the first error is thrown immediately; lexical errors are always thrown. Warnings are only
 * recorded.
 */
public final class Diagnostics {
  private final ParseOptions options;
  private final List<DbcProblem> errors = new ArrayList<>();
  private final List<DbcProblem> warnings = new ArrayList<>();

  public Diagnostics(ParseOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  public ParseOptions options() {
    return options;
  }

  public void report(ProblemCode code, int line, int column, String message) {
    report(new DbcProblem(code, code.severity(options), line, column, message));
  }

  public void report(ProblemCode code, int line, String message) {
    report(code, line, 0, message);
  }

  public void report(DbcProblem problem) {
    Objects.requireNonNull(problem, "problem");
    if (!problem.isError()) {
      warnings.add(problem);
      return;
    }
    if (problem.category() == ProblemCategory.LEX) {
      // lexing cannot resume, the lex error leads whatever was collected before it
      errors.add(0, problem);
      throw DbcParseException.of(errors);
    }
    errors.add(problem);
    if (!options.collectAllErrors()) {
      throw DbcParseException.of(errors);
    }
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public List<DbcProblem> errors() {
    return List.copyOf(errors);
  }

  public List<DbcProblem> warnings() {
    return List.copyOf(warnings);
  }

  /** Throws the collected errors, if any. */
  public void throwIfErrors() {
    if (!errors.isEmpty()) throw DbcParseException.of(errors);
  }
}
