package io.intellixity.dbckit.lex;

import java.util.Objects;

public record Token(TokenType type, String text, int line, int column) {
  public Token {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(text, "text");
  }

  public boolean is(TokenType t) {
    return type == t;
  }

  public boolean isIdentifier(String name) {
    return type == TokenType.IDENTIFIER && text.equals(name);
  }

  /** Form used in diagnostics. */
  public String describe() {
    return switch (type) {
      case STRING -> "string \"" + text + "\"";
      case IDENTIFIER -> "identifier '" + text + "'";
      case INTEGER, FLOAT -> "number " + text;
      default -> "'" + text + "'";
    };
  }
}
