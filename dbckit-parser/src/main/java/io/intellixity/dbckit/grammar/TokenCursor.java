package io.intellixity.dbckit.grammar;

import io.intellixity.dbckit.ProblemCode;
import io.intellixity.dbckit.lex.LexedStatement;
import io.intellixity.dbckit.lex.Token;
import io.intellixity.dbckit.lex.TokenType;

import java.util.ArrayList;
import java.util.List;

/** Forward-only reader over a statement's tokens with typed expectations. */
public final class TokenCursor {
  private final LexedStatement statement;
  private final List<Token> tokens;
  private int pos;

  public TokenCursor(LexedStatement statement) {
    this.statement = statement;
    this.tokens = statement.tokens();
    this.pos = 1;
  }

  /** Line of the statement keyword. */
  public int line() {
    return statement.line();
  }

  public boolean atEnd() {
    return pos >= tokens.size();
  }

  public Token peek() {
    return pos < tokens.size() ? tokens.get(pos) : null;
  }

  public Token peek(int ahead) {
    int i = pos + ahead;
    return i < tokens.size() ? tokens.get(i) : null;
  }

  public boolean at(TokenType type) {
    Token t = peek();
    return t != null && t.is(type);
  }

  public boolean atIdentifier(String name) {
    Token t = peek();
    return t != null && t.isIdentifier(name);
  }

  public Token next() {
    if (atEnd()) throw error("more tokens");
    return tokens.get(pos++);
  }

  /** Consumes the next token when it has the given type. */
  public boolean accept(TokenType type) {
    if (!at(type)) return false;
    pos++;
    return true;
  }

  public boolean acceptIdentifier(String name) {
    if (!atIdentifier(name)) return false;
    pos++;
    return true;
  }

  public Token expect(TokenType type, String what) {
    if (!at(type)) throw error(what);
    return tokens.get(pos++);
  }

  public String identifier(String what) {
    return expect(TokenType.IDENTIFIER, what).text();
  }

  public String string(String what) {
    return expect(TokenType.STRING, what).text();
  }

  public long integer(String what) {
    Token t = expect(TokenType.INTEGER, what);
    try {
      return Long.parseLong(t.text());
    } catch (NumberFormatException e) {
      throw new GrammarException(ProblemCode.INVALID_NUMBER, t.line(), t.column(),
          what + " " + t.text() + " is out of range");
    }
  }

  /** Integer in {@code [0, max]}. */
  public long unsigned(String what, long max) {
    Token t = peek();
    long v = integer(what);
    if (v < 0 || v > max) {
      throw new GrammarException(ProblemCode.INVALID_NUMBER, t.line(), t.column(),
          what + " " + v + " outside 0.." + max);
    }
    return v;
  }

  public int unsignedInt(String what) {
    return (int) unsigned(what, Integer.MAX_VALUE);
  }

  public double number(String what) {
    Token t = peek();
    if (t == null || !(t.is(TokenType.INTEGER) || t.is(TokenType.FLOAT))) throw error(what);
    pos++;
    try {
      return Double.parseDouble(t.text());
    } catch (NumberFormatException e) {
      throw new GrammarException(ProblemCode.INVALID_NUMBER, t.line(), t.column(), what + " " + t.text() + " is not a number");
    }
  }

  /** Attribute value as written: Long, Double or String. */
  public Object value(String what) {
    Token t = peek();
    if (t == null) throw error(what);
    return switch (t.type()) {
      case STRING -> string(what);
      case INTEGER -> integer(what);
      case FLOAT -> number(what);
      default -> throw error(what);
    };
  }

  /** Identifiers separated by commas or whitespace, up to the end of the statement. */
  public List<String> identifierList(String what) {
    List<String> out = new ArrayList<>();
    while (!atEnd()) {
      out.add(identifier(what));
      accept(TokenType.COMMA);
    }
    return out;
  }

  public void expectEnd() {
    if (!atEnd()) throw error("end of statement");
  }

  public GrammarException error(String expected) {
    Token t = peek();
    if (t == null) {
      Token last = tokens.get(tokens.size() - 1);
      return new GrammarException(ProblemCode.UNEXPECTED_TOKEN, last.line(), last.column(),
          statement.keyword() + ": expected " + expected + " but found end of statement");
    }
    return new GrammarException(ProblemCode.UNEXPECTED_TOKEN, t.line(), t.column(),
        statement.keyword() + ": expected " + expected + " but found " + t.describe());
  }
}
