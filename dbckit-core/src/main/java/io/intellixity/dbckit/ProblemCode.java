package io.intellixity.dbckit;

/**
 * Every diagnostic the parser can produce.
 * <p>
 * Lenient problems (dangling references, unknown nodes, identifiers wider than their kind) are errors
 * only when {@link ParseOptions#strictReferences()} is set and warnings otherwise.
 */
public enum ProblemCode {
  UNTERMINATED_QUOTE(ProblemCategory.LEX, false),

  UNEXPECTED_TOKEN(ProblemCategory.SYNTAX, false),
  INVALID_NUMBER(ProblemCategory.SYNTAX, false),

  DUPLICATE_MESSAGE_ID(ProblemCategory.SEMANTIC, false),
  INVALID_MESSAGE_ID(ProblemCategory.SEMANTIC, true),
  DUPLICATE_SIGNAL(ProblemCategory.SEMANTIC, false),
  DUPLICATE_NODE(ProblemCategory.SEMANTIC, false),
  DUPLICATE_VALUE_TABLE(ProblemCategory.SEMANTIC, false),
  DUPLICATE_VALUE_ENTRY(ProblemCategory.SEMANTIC, false),
  DUPLICATE_ATTRIBUTE_DEFINITION(ProblemCategory.SEMANTIC, false),
  ORPHAN_SIGNAL(ProblemCategory.SEMANTIC, false),
  BIT_RANGE_OVERFLOW(ProblemCategory.SEMANTIC, false),
  INVALID_VALUE_TYPE(ProblemCategory.SEMANTIC, false),
  MULTIPLEXOR_MISSING(ProblemCategory.SEMANTIC, false),
  MULTIPLE_MULTIPLEXORS(ProblemCategory.SEMANTIC, false),
  SWITCH_VALUE_OUT_OF_RANGE(ProblemCategory.SEMANTIC, false),

  DANGLING_REFERENCE(ProblemCategory.SEMANTIC, true),
  UNDEFINED_ATTRIBUTE(ProblemCategory.SEMANTIC, true),
  UNKNOWN_NODE(ProblemCategory.SEMANTIC, true),

  UNRECOGNIZED_STATEMENT(ProblemCategory.UNRECOGNIZED, false);

  private final ProblemCategory category;
  private final boolean lenient;

  ProblemCode(ProblemCategory category, boolean lenient) {
    this.category = category;
    this.lenient = lenient;
  }

  public ProblemCategory category() { return category; }

  /** True for codes whose severity follows {@link ParseOptions#strictReferences()}. */
  public boolean isLenient() { return lenient; }

  public DbcProblem.Severity severity(ParseOptions options) {
    if (category == ProblemCategory.UNRECOGNIZED) return DbcProblem.Severity.WARNING;
    if (lenient && !options.strictReferences()) return DbcProblem.Severity.WARNING;
    return DbcProblem.Severity.ERROR;
  }
}
