package io.intellixity.dbckit.lex;

public enum TokenType {
  IDENTIFIER,
  INTEGER,
  FLOAT,
  /** Quoted text; {@link Token#text()} holds the unescaped content without quotes. */
  STRING,
  COLON,
  PIPE,
  AT,
  LPAREN,
  RPAREN,
  LBRACKET,
  RBRACKET,
  COMMA,
  PLUS,
  MINUS,
  /** Any other single character; no grammar accepts it. */
  OTHER
}
