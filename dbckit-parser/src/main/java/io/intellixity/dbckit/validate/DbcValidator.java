package io.intellixity.dbckit.validate;

import io.intellixity.dbckit.Diagnostics;
import io.intellixity.dbckit.assemble.SourceLines;
import io.intellixity.dbckit.model.DbcModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs {@link ValidationRule}s over an assembled model.\n
 *
 * Rule order:\n
 * - built-in rules, in {@link #builtInRules()} order\n
 * - rules discovered via META-INF/dbckit.factories (only with {@link #withDiscoveredRules()})\n
 */
public final class DbcValidator {
  private final List<ValidationRule> rules;

  public DbcValidator() {
    this(builtInRules());
  }

  public DbcValidator(List<ValidationRule> rules) {
    Objects.requireNonNull(rules, "rules");
    this.rules = List.copyOf(rules);
  }

  public static List<ValidationRule> builtInRules() {
    return List.of(new MessageIdRule(), new SignalNameRule(), new NodeReferenceRule(), new ValueTypeRule());
  }

  /** Built-in rules followed by every rule registered under {@code io.intellixity.dbckit.validate.ValidationRule}. */
  public static DbcValidator withDiscoveredRules() {
    List<ValidationRule> all = new ArrayList<>(builtInRules());
    all.addAll(ValidationRuleLoader.load(Thread.currentThread().getContextClassLoader()));
    return new DbcValidator(all);
  }

  public List<ValidationRule> rules() {
    return rules;
  }

  public void validate(DbcModel model, SourceLines lines, Diagnostics diagnostics) {
    ValidationContext ctx = new ValidationContext(model, lines, diagnostics);
    for (ValidationRule rule : rules) {
      rule.validate(ctx);
    }
  }
}
