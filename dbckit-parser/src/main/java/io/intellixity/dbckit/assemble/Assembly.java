package io.intellixity.dbckit.assemble;

import io.intellixity.dbckit.model.DbcModel;

import java.util.Objects;

/** Result of {@link DbcAssembler#finish()}: the model plus where its parts were declared. */
public record Assembly(DbcModel model, SourceLines lines) {
  public Assembly {
    Objects.requireNonNull(model, "model");
    lines = lines == null ? SourceLines.empty() : lines;
  }
}
