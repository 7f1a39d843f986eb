package io.intellixity.dbckit.grammar;

import io.intellixity.dbckit.Diagnostics;
import io.intellixity.dbckit.ProblemCode;
import io.intellixity.dbckit.lex.LexedStatement;
import io.intellixity.dbckit.lex.Token;
import io.intellixity.dbckit.statement.DbcStatement;
import io.intellixity.dbckit.statement.MalformedStatement;
import io.intellixity.dbckit.statement.StatementKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Turns lexed statements into typed statements.
 * <p>
 * Statements with an unknown keyword are skipped, with a warning when
 * {@link io.intellixity.dbckit.ParseOptions#reportUnrecognized()} is set. A grammar failure is reported
 * as a syntax problem; when the diagnostics keep collecting, the statement comes back as a
 * {@link MalformedStatement} so later stages know it existed.
 */
public final class StatementClassifier {
  private static final Logger log = LoggerFactory.getLogger(StatementClassifier.class);

  private final Diagnostics diagnostics;

  public StatementClassifier(Diagnostics diagnostics) {
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
  }

  /** Typed statement, or null when the statement is skipped. */
  public DbcStatement classify(LexedStatement lexed) {
    StatementKind kind = StatementKind.forKeyword(lexed.keyword());
    if (kind == null) {
      skip(lexed);
      return null;
    }
    try {
      return StatementGrammars.forKind(kind).parse(new TokenCursor(lexed));
    } catch (GrammarException e) {
      diagnostics.report(e.code(), e.line(), e.column(), e.getMessage());
      return new MalformedStatement(lexed.line(), kind);
    }
  }

  private void skip(LexedStatement lexed) {
    Token first = lexed.tokens().get(0);
    if (log.isDebugEnabled()) {
      log.debug("dbckit.skip line={} keyword={}", lexed.line(), first.text());
    }
    if (diagnostics.options().reportUnrecognized()) {
      diagnostics.report(ProblemCode.UNRECOGNIZED_STATEMENT, lexed.line(), lexed.column(),
          "statement '" + first.text() + "' is not supported and was skipped");
    }
  }
}
