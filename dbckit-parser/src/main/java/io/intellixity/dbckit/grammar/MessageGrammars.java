package io.intellixity.dbckit.grammar;

import io.intellixity.dbckit.ProblemCode;
import io.intellixity.dbckit.lex.Token;
import io.intellixity.dbckit.lex.TokenType;
import io.intellixity.dbckit.model.ByteOrder;
import io.intellixity.dbckit.model.MultiplexRole;
import io.intellixity.dbckit.model.SwitchRange;
import io.intellixity.dbckit.model.ValueType;
import io.intellixity.dbckit.statement.*;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Statements that describe or reference messages and their signals. */
final class MessageGrammars {
  static final long MAX_ENCODED_ID = 0xFFFF_FFFFL;

  private static final Pattern MULTIPLEX = Pattern.compile("M|m(\\d+)(M?)");

  private MessageGrammars() {}

  // BO_ 256 ENGINE_DATA: 8 ECU1
  static DbcStatement message(TokenCursor in) {
    long id = messageId(in);
    String name = in.identifier("message name");
    in.expect(TokenType.COLON, "':'");
    int size = in.unsignedInt("message size");
    String transmitter = in.atEnd() ? null : in.identifier("transmitter");
    in.expectEnd();
    return new MessageStatement(in.line(), id, name, size, transmitter);
  }

  // SG_ RPM : 0|16@1+ (0.25,0) [0|16000] "rpm" ECU2
  static DbcStatement signal(TokenCursor in) {
    String name = in.identifier("signal name");
    MultiplexRole mux = MultiplexRole.NONE;
    if (in.at(TokenType.IDENTIFIER)) mux = multiplexIndicator(in.next());
    in.expect(TokenType.COLON, "':'");

    int startBit = in.unsignedInt("start bit");
    in.expect(TokenType.PIPE, "'|'");
    int length = in.unsignedInt("bit length");
    in.expect(TokenType.AT, "'@'");
    ByteOrder order = byteOrder(in);
    ValueType valueType;
    if (in.accept(TokenType.PLUS)) {
      valueType = ValueType.UNSIGNED;
    } else if (in.accept(TokenType.MINUS)) {
      valueType = ValueType.SIGNED;
    } else {
      throw in.error("value sign '+' or '-'");
    }

    in.expect(TokenType.LPAREN, "'('");
    double factor = in.number("factor");
    in.expect(TokenType.COMMA, "','");
    double offset = in.number("offset");
    in.expect(TokenType.RPAREN, "')'");

    in.expect(TokenType.LBRACKET, "'['");
    double min = in.number("minimum");
    in.expect(TokenType.PIPE, "'|'");
    double max = in.number("maximum");
    in.expect(TokenType.RBRACKET, "']'");

    String unit = in.string("unit");
    List<String> receivers = in.identifierList("receiver");
    return new SignalStatement(in.line(), name, mux, startBit, length, order, valueType,
        factor, offset, min, max, unit, receivers);
  }

  // BO_TX_BU_ 256 : ECU1,ECU3
  static DbcStatement messageTransmitters(TokenCursor in) {
    long id = messageId(in);
    in.expect(TokenType.COLON, "':'");
    return new MessageTransmittersStatement(in.line(), id, in.identifierList("transmitter"));
  }

  // SIG_VALTYPE_ 256 Temperature : 1
  static DbcStatement signalValueType(TokenCursor in) {
    long id = messageId(in);
    String signal = in.identifier("signal name");
    in.expect(TokenType.COLON, "':'");
    int code = (int) in.unsigned("value type code", 2);
    in.expectEnd();
    return new SignalValueTypeStatement(in.line(), id, signal, code);
  }

  // SIG_GROUP_ 256 Engine 1 : RPM Temperature
  static DbcStatement signalGroup(TokenCursor in) {
    long id = messageId(in);
    String name = in.identifier("signal group name");
    int repetitions = in.unsignedInt("repetitions");
    in.expect(TokenType.COLON, "':'");
    return new SignalGroupStatement(in.line(), id, name, repetitions, in.identifierList("signal name"));
  }

  // SG_MUL_VAL_ 256 Level2 Mode 0-0, 2-4
  static DbcStatement multiplexRange(TokenCursor in) {
    long id = messageId(in);
    String signal = in.identifier("signal name");
    String switchName = in.identifier("multiplexor name");
    List<SwitchRange.Range> ranges = new ArrayList<>();
    do {
      Token at = in.peek();
      long from = in.unsigned("range start", Long.MAX_VALUE);
      long to;
      if (in.accept(TokenType.MINUS)) {
        to = in.unsigned("range end", Long.MAX_VALUE);
      } else {
        // "0 -3": the lexer glued the minus onto the end value
        to = -in.integer("range end");
      }
      if (from > to) {
        throw new GrammarException(ProblemCode.INVALID_NUMBER, at.line(), at.column(),
            "range " + from + "-" + to + " ends before it starts");
      }
      ranges.add(new SwitchRange.Range(from, to));
    } while (in.accept(TokenType.COMMA));
    in.expectEnd();
    return new MultiplexRangeStatement(in.line(), id, signal, switchName, List.copyOf(ranges));
  }

  static long messageId(TokenCursor in) {
    return in.unsigned("message id", MAX_ENCODED_ID);
  }

  private static ByteOrder byteOrder(TokenCursor in) {
    Token t = in.peek();
    if (t == null || !t.is(TokenType.INTEGER) || !(t.text().equals("0") || t.text().equals("1"))) {
      throw in.error("byte order 0 or 1");
    }
    in.next();
    return ByteOrder.fromCode(t.text());
  }

  private static MultiplexRole multiplexIndicator(Token t) {
    Matcher m = MULTIPLEX.matcher(t.text());
    if (!m.matches()) {
      throw new GrammarException(ProblemCode.UNEXPECTED_TOKEN, t.line(), t.column(),
          "SG_: expected multiplex indicator M, m<n> or m<n>M but found " + t.describe());
    }
    if (m.group(1) == null) return MultiplexRole.MULTIPLEXOR;
    long value;
    try {
      value = Long.parseLong(m.group(1));
    } catch (NumberFormatException e) {
      throw new GrammarException(ProblemCode.INVALID_NUMBER, t.line(), t.column(),
          "multiplex switch value " + m.group(1) + " is out of range");
    }
    return m.group(2).isEmpty() ? MultiplexRole.multiplexed(value) : MultiplexRole.multiplexedMultiplexor(value);
  }
}
