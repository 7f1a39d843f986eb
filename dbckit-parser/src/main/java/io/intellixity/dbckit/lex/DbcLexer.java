package io.intellixity.dbckit.lex;

import io.intellixity.dbckit.DbcLexException;
import io.intellixity.dbckit.DbcProblem;
import io.intellixity.dbckit.ProblemCode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Splits DBC text into statements.
 * <p>
 * A statement ends at a line break or a {@code ;} that is not inside a quoted string; quoted strings
 * may span lines and have no escapes, a backslash is an ordinary character. {@code //} comments, blank lines and stray semicolons are dropped. The {@code NS_}
 * statement is the one multi-line construct without quotes: the indented lines that follow it are its
 * symbol list and are folded into it.
 * <p>
 * Iteration is lazy and every {@link #iterator()} starts over from the beginning of the text. An
 * unterminated string fails with {@link DbcLexException}.
 */
public final class DbcLexer implements Iterable<LexedStatement> {
  static final String NEW_SYMBOLS = "NS_";

  private final String source;

  public DbcLexer(String source) {
    this.source = Objects.requireNonNull(source, "source");
  }

  @Override
  public Iterator<LexedStatement> iterator() {
    return new Scanner(source);
  }

  public List<LexedStatement> toList() {
    List<LexedStatement> out = new ArrayList<>();
    for (LexedStatement s : this) out.add(s);
    return out;
  }

  private static final class Scanner implements Iterator<LexedStatement> {
    private final String src;
    private final int length;

    private int pos;
    private int line = 1;
    private int col = 1;
    private LexedStatement pending;

    Scanner(String src) {
      this.src = src;
      this.length = src.length();
      if (length > 0 && src.charAt(0) == '\uFEFF') pos = 1;
    }

    @Override
    public boolean hasNext() {
      if (pending == null) pending = scanStatement();
      return pending != null;
    }

    @Override
    public LexedStatement next() {
      if (!hasNext()) throw new NoSuchElementException();
      LexedStatement s = pending;
      pending = null;
      return s;
    }

    private LexedStatement scanStatement() {
      skipBetweenStatements();
      if (pos >= length) return null;

      int startPos = pos;
      List<Token> tokens = new ArrayList<>();
      scanLine(tokens);

      if (tokens.get(0).isIdentifier(NEW_SYMBOLS)) {
        while (pos < length && isLineBreak(src.charAt(pos)) && nextLineIndented()) {
          advance();
          if (pos < length && src.charAt(pos - 1) == '\r' && src.charAt(pos) == '\n') advance();
          scanLine(tokens);
        }
      }

      Token first = tokens.get(0);
      String text = src.substring(startPos, pos).strip();
      return new LexedStatement(first.line(), first.column(), text, tokens);
    }

    /** Tokens up to, not including, the next line break or semicolon. */
    private void scanLine(List<Token> tokens) {
      while (pos < length) {
        char c = src.charAt(pos);
        if (isLineBreak(c) || c == ';') return;
        if (Character.isWhitespace(c)) {
          advance();
        } else if (c == '/' && peek(1) == '/') {
          skipComment();
        } else {
          tokens.add(scanToken());
        }
      }
    }

    private void skipBetweenStatements() {
      while (pos < length) {
        char c = src.charAt(pos);
        if (Character.isWhitespace(c) || c == ';') {
          advance();
        } else if (c == '/' && peek(1) == '/') {
          skipComment();
        } else {
          return;
        }
      }
    }

    private void skipComment() {
      while (pos < length && !isLineBreak(src.charAt(pos))) advance();
    }

    private boolean nextLineIndented() {
      int i = pos;
      if (src.charAt(i) == '\r' && i + 1 < length && src.charAt(i + 1) == '\n') i++;
      i++;
      if (i >= length) return false;
      char c = src.charAt(i);
      return c == ' ' || c == '\t';
    }

    private Token scanToken() {
      int tokLine = line;
      int tokCol = col;
      char c = src.charAt(pos);

      if (c == '"') return scanString(tokLine, tokCol);
      if (startsNumber(c)) return scanNumber(tokLine, tokCol);
      if (isIdentifierStart(c)) {
        int start = pos;
        while (pos < length && isIdentifierPart(src.charAt(pos))) advance();
        return new Token(TokenType.IDENTIFIER, src.substring(start, pos), tokLine, tokCol);
      }

      advance();
      TokenType type = switch (c) {
        case ':' -> TokenType.COLON;
        case '|' -> TokenType.PIPE;
        case '@' -> TokenType.AT;
        case '(' -> TokenType.LPAREN;
        case ')' -> TokenType.RPAREN;
        case '[' -> TokenType.LBRACKET;
        case ']' -> TokenType.RBRACKET;
        case ',' -> TokenType.COMMA;
        case '+' -> TokenType.PLUS;
        case '-' -> TokenType.MINUS;
        default -> TokenType.OTHER;
      };
      return new Token(type, String.valueOf(c), tokLine, tokCol);
    }

    private Token scanString(int tokLine, int tokCol) {
      advance();
      StringBuilder sb = new StringBuilder();
      while (true) {
        if (pos >= length) {
          DbcProblem p = new DbcProblem(ProblemCode.UNTERMINATED_QUOTE, DbcProblem.Severity.ERROR, tokLine, tokCol,
              "string opened at line " + tokLine + " is never closed");
          throw new DbcLexException(List.of(p));
        }
        char c = advance();
        if (c == '"') return new Token(TokenType.STRING, sb.toString(), tokLine, tokCol);
        sb.append(c);
      }
    }

    /**
     * Digits with optional sign, fraction and exponent. A sign belongs to the number only when it does
     * not directly follow a word or a closing bracket, so {@code @1-} and {@code 0-3} keep their minus.
     */
    private boolean startsNumber(char c) {
      if (isDigit(c)) return true;
      if (c == '.') return isDigit(peek(1));
      if (c == '+' || c == '-') {
        char prev = pos > 0 ? src.charAt(pos - 1) : ' ';
        if (isIdentifierPart(prev) || prev == ')' || prev == ']') return false;
        return isDigit(peek(1)) || (peek(1) == '.' && isDigit(peek(2)));
      }
      return false;
    }

    private Token scanNumber(int tokLine, int tokCol) {
      int start = pos;
      boolean fractional = false;
      if (src.charAt(pos) == '+' || src.charAt(pos) == '-') advance();
      while (pos < length && isDigit(src.charAt(pos))) advance();
      if (pos < length && src.charAt(pos) == '.') {
        fractional = true;
        advance();
        while (pos < length && isDigit(src.charAt(pos))) advance();
      }
      if (pos < length && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
        char n1 = peek(1);
        if (isDigit(n1) || ((n1 == '+' || n1 == '-') && isDigit(peek(2)))) {
          fractional = true;
          advance();
          if (!isDigit(src.charAt(pos))) advance();
          while (pos < length && isDigit(src.charAt(pos))) advance();
        }
      }
      if (pos < length && isIdentifierPart(src.charAt(pos))) {
        // names such as 2ndGateway
        while (pos < length && isIdentifierPart(src.charAt(pos))) advance();
        return new Token(TokenType.IDENTIFIER, src.substring(start, pos), tokLine, tokCol);
      }
      return new Token(fractional ? TokenType.FLOAT : TokenType.INTEGER, src.substring(start, pos), tokLine, tokCol);
    }

    private char peek(int offset) {
      int i = pos + offset;
      return (i < 0 || i >= length) ? '\0' : src.charAt(i);
    }

    private char advance() {
      char c = src.charAt(pos++);
      if (c == '\n' || (c == '\r' && (pos >= length || src.charAt(pos) != '\n'))) {
        line++;
        col = 1;
      } else {
        col++;
      }
      return c;
    }
  }

  private static boolean isLineBreak(char c) {
    return c == '\n' || c == '\r';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierStart(char c) {
    return c == '_' || Character.isLetter(c);
  }

  private static boolean isIdentifierPart(char c) {
    return c == '_' || Character.isLetterOrDigit(c);
  }
}
