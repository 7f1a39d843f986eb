package io.intellixity.dbckit.grammar;

import io.intellixity.dbckit.lex.TokenType;
import io.intellixity.dbckit.model.BitTiming;
import io.intellixity.dbckit.statement.*;

/** File header statements: VERSION, NS_, BS_ and BU_. */
final class HeaderGrammars {
  private HeaderGrammars() {}

  static DbcStatement version(TokenCursor in) {
    String version = in.string("version string");
    in.expectEnd();
    return new VersionStatement(in.line(), version);
  }

  static DbcStatement newSymbols(TokenCursor in) {
    in.expect(TokenType.COLON, "':'");
    return new NewSymbolsStatement(in.line(), in.identifierList("symbol"));
  }

  static DbcStatement bitTiming(TokenCursor in) {
    in.expect(TokenType.COLON, "':'");
    if (in.atEnd()) return new BitTimingStatement(in.line(), BitTiming.UNSPECIFIED);
    long baud = in.unsigned("baudrate", Long.MAX_VALUE);
    in.expect(TokenType.COLON, "':'");
    long btr1 = in.unsigned("BTR1", Long.MAX_VALUE);
    in.expect(TokenType.COMMA, "','");
    long btr2 = in.unsigned("BTR2", Long.MAX_VALUE);
    in.expectEnd();
    return new BitTimingStatement(in.line(), new BitTiming(baud, btr1, btr2));
  }

  static DbcStatement nodes(TokenCursor in) {
    in.expect(TokenType.COLON, "':'");
    return new NodesStatement(in.line(), in.identifierList("node name"));
  }
}
