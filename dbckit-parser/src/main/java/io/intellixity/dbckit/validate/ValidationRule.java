package io.intellixity.dbckit.validate;

/**
 * SPI hook to check a finished model.
 * <p>
 * {@link DbcValidator} runs its rules after assembly and before the model is returned. Rules report
 * through {@link ValidationContext#report}; severity and abort behaviour follow the parse options.
 * Applications may register additional rules in {@code META-INF/dbckit.factories}.
 */
public interface ValidationRule {
  void validate(ValidationContext ctx);
}
