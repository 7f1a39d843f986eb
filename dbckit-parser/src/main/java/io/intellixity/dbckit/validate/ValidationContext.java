package io.intellixity.dbckit.validate;

import io.intellixity.dbckit.Diagnostics;
import io.intellixity.dbckit.ParseOptions;
import io.intellixity.dbckit.ProblemCode;
import io.intellixity.dbckit.assemble.SourceLines;
import io.intellixity.dbckit.model.DbcModel;

import java.util.Objects;

/** What a {@link ValidationRule} sees: the model, where its objects were declared, and the problem sink. */
public final class ValidationContext {
  private final DbcModel model;
  private final SourceLines lines;
  private final Diagnostics diagnostics;

  public ValidationContext(DbcModel model, SourceLines lines, Diagnostics diagnostics) {
    this.model = Objects.requireNonNull(model, "model");
    this.lines = lines == null ? SourceLines.empty() : lines;
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
  }

  public DbcModel model() { return model; }

  public ParseOptions options() { return diagnostics.options(); }

  public int lineOf(Object modelObject) {
    return lines.lineOf(modelObject);
  }

  /** Reports a problem at the declaration line of {@code at}. */
  public void report(ProblemCode code, Object at, String message) {
    diagnostics.report(code, lineOf(at), message);
  }
}
