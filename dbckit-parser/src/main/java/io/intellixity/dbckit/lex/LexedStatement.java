package io.intellixity.dbckit.lex;

import java.util.List;
import java.util.Objects;

/** One logical statement: source position, raw text and tokens. Never empty. */
public record LexedStatement(int line, int column, String text, List<Token> tokens) {
  public LexedStatement {
    Objects.requireNonNull(text, "text");
    tokens = List.copyOf(tokens);
    if (tokens.isEmpty()) throw new IllegalArgumentException("statement without tokens at line " + line);
  }

  /** Leading identifier that selects the grammar, or null when the statement starts with something else. */
  public String keyword() {
    Token first = tokens.get(0);
    return first.is(TokenType.IDENTIFIER) ? first.text() : null;
  }
}
