package io.intellixity.dbckit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.dbckit.model.*;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DbcParserTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  private static byte[] resource(String name) throws IOException {
    try (InputStream in = DbcParserTest.class.getResourceAsStream("/dbc/" + name)) {
      assertNotNull(in, name);
      return in.readAllBytes();
    }
  }

  @Test
  void parsesMinimalMessage() {
    String text = """
        BU_: ECU1 ECU2
        BO_ 256 ENGINE_DATA: 8 ECU1
         SG_ RPM : 0|16@1+ (0.25,0) [0|16000] "rpm" ECU2
        """;
    DbcModel model = DbcParser.parse(text.getBytes(StandardCharsets.UTF_8), ParseOptions.defaults());

    assertEquals(1, model.messages().size());
    Message m = model.messages().get(0);
    assertEquals(MessageId.standard(256), m.id());
    assertEquals(256, m.id().raw());
    assertEquals("ENGINE_DATA", m.name());
    assertEquals(8, m.size());
    assertEquals("ECU1", m.transmitter());

    Signal rpm = m.signals().get(0);
    assertEquals("RPM", rpm.name());
    assertEquals(0, rpm.startBit());
    assertEquals(16, rpm.length());
    assertEquals(ByteOrder.LITTLE_ENDIAN, rpm.byteOrder());
    assertEquals(ValueType.UNSIGNED, rpm.valueType());
    assertEquals(0.25, rpm.factor());
    assertEquals(0.0, rpm.offset());
    assertEquals(0.0, rpm.minimum());
    assertEquals(16000.0, rpm.maximum());
    assertEquals("rpm", rpm.unit());
    assertEquals(List.of("ECU2"), rpm.receivers());
    assertEquals(4000.0, rpm.toPhysical(16000));
    assertTrue(model.warnings().isEmpty());
  }

  @Test
  void parsesSampleNetwork() throws IOException {
    DbcModel model = DbcParser.parse(resource("powertrain.dbc"), ParseOptions.defaults());

    assertEquals("1.2", model.version());
    assertEquals(8, model.newSymbols().size());
    assertEquals(List.of("ECU1", "ECU2", "Gateway"), model.nodes().stream().map(Node::name).toList());
    assertEquals("Powertrain sample network", model.comment());
    assertEquals("CAN", model.attributes().get("BusType"));
    assertEquals("Engine controller", model.node("ECU1").comment());

    Message engine = model.message("ENGINE_DATA");
    assertEquals(100L, engine.cycleTime());
    assertEquals(List.of("ECU1", "Gateway"), engine.additionalTransmitters());
    assertEquals("Engine speed", engine.signal("RPM").comment());
    assertEquals("D", engine.signal("Gear").describe(3));
    assertEquals("GearTable", engine.signal("Gear").valueTable());
    assertEquals(10.0, engine.signal("Temperature").physicalInitialValue());
    assertEquals(List.of("RPM", "Temperature"), engine.signalGroups().get(0).signalNames());

    Message body = model.message(MessageId.extended(1024));
    assertEquals("BODY_STATUS", body.name());
    assertTrue(body.id().isExtended());
    assertEquals("Mode", body.multiplexor().name());
    assertEquals(MultiplexRole.multiplexed(1), body.signal("Brightness").multiplex());
    assertEquals("Lights", body.signal("Mode").describe(1));
    assertEquals("OnChange", body.attributes().get("GenMsgSendType"));
    Signal voltage = body.signal("Voltage");
    assertEquals(ByteOrder.BIG_ENDIAN, voltage.byteOrder());
    assertEquals(40, voltage.displayStartBit());
    assertEquals(39, voltage.layout().msb());

    Message floats = model.message("FLOAT_DATA");
    assertFalse(floats.hasTransmitter());
    assertEquals(ValueType.IEEE_FLOAT, floats.signal("Pressure").valueType());

    assertTrue(model.warnings().isEmpty(), model.warnings().toString());
  }

  @Test
  void parsingIsDeterministic() throws IOException {
    byte[] bytes = resource("powertrain.dbc");
    DbcParser parser = new DbcParser(ParseOptions.defaults());
    DbcModel first = parser.parse(bytes);
    DbcModel second = parser.parse(bytes);
    assertEquals(first, second);
    assertEquals(JSON.writeValueAsString(first), JSON.writeValueAsString(second));
  }

  @Test
  void skipsUnknownStatements() {
    String text = """
        VERSION ""
        BU_: A
        EV_ Heater: 0 [0|1] "" 0 1 DUMMY_NODE_VECTOR0 Vector__XXX;
        BO_ 1 M: 8 A
         SG_ S : 0|8@1+ (1,0) [0|0] "" A
        SGTYPE_ Foo : 8@1+ (1,0) [0|0] "" Table;
        ENVVAR_DATA_ Heater: 4;
        """;
    DbcModel quiet = DbcParser.parse(text, ParseOptions.defaults());
    assertEquals(1, quiet.messages().size());
    assertTrue(quiet.warnings().isEmpty());

    DbcModel reported = DbcParser.parse(text, ParseOptions.defaults().withReportUnrecognized(true));
    assertEquals(quiet.messages(), reported.messages());
    assertEquals(3, reported.warnings().size());
    assertEquals(3, reported.warnings().get(0).line());
    for (DbcProblem p : reported.warnings()) assertEquals(ProblemCode.UNRECOGNIZED_STATEMENT, p.code());
  }

  @Test
  void duplicateMessageIdFailsWithBothNames() {
    String text = """
        BO_ 100 FIRST: 8 Vector__XXX
        BO_ 100 SECOND: 8 Vector__XXX
        """;
    DbcSemanticException ex = assertThrows(DbcSemanticException.class,
        () -> DbcParser.parse(text, ParseOptions.defaults()));
    assertEquals(ProblemCode.DUPLICATE_MESSAGE_ID, ex.first().code());
    assertEquals(2, ex.first().line());
    assertTrue(ex.getMessage().contains("FIRST") && ex.getMessage().contains("SECOND"), ex.getMessage());
  }

  @Test
  void wideStandardIdsAreWarningsUnlessStrict() {
    String text = """
        BO_ 2048 A: 8 Vector__XXX
        BO_ 2049 B: 8 Vector__XXX
        """;
    DbcModel model = DbcParser.parse(text, ParseOptions.defaults());
    assertEquals(2, model.messages().size());
    assertEquals(MessageId.standard(2048), model.messages().get(0).id());
    assertEquals(List.of(ProblemCode.INVALID_MESSAGE_ID, ProblemCode.INVALID_MESSAGE_ID),
        model.warnings().stream().map(DbcProblem::code).toList());
    assertEquals(1, model.warnings().get(0).line());

    DbcSemanticException ex = assertThrows(DbcSemanticException.class,
        () -> DbcParser.parse(text, ParseOptions.strict()));
    assertEquals(ProblemCode.INVALID_MESSAGE_ID, ex.first().code());
  }

  @Test
  void commentMayEndInBackslash() {
    String text = "BO_ 1 A: 8 Vector__XXX\nCM_ BO_ 1 \"see C:\\dbc\\\";\nBO_ 2 B: 8 Vector__XXX\n";
    DbcModel model = DbcParser.parse(text, ParseOptions.defaults());
    assertEquals(2, model.messages().size());
    assertEquals("see C:\\dbc\\", model.messages().get(0).comment());
  }

  @Test
  void fileWithoutMessagesIsAnEmptyModel() {
    DbcModel model = DbcParser.parse("VERSION \"\"\n\nBU_:\n", ParseOptions.defaults());
    assertTrue(model.messages().isEmpty());
    assertTrue(model.warnings().isEmpty());
  }

  @Test
  void failsFastOrCollectsEverything() {
    String text = """
        BO_ 1 A: 8 X
         SG_ S : 0|8@1+ (1,0) [0|0] "" X
        BO_ 1 B: 8 X
        BO_ oops C: 8 X
         SG_ T : 0|8@1+ (1,0) [0|0] "" X
        BO_ 2 D: 1 X
         SG_ U : 4|8@1+ (1,0) [0|0] "" X
        """;
    DbcSyntaxException first = assertThrows(DbcSyntaxException.class,
        () -> DbcParser.parse(text, ParseOptions.defaults()));
    assertEquals(1, first.problems().size());
    assertEquals(4, first.first().line());

    DbcParseException all = assertThrows(DbcParseException.class,
        () -> DbcParser.parse(text, ParseOptions.defaults().withCollectAllErrors(true)));
    assertTrue(all instanceof DbcSyntaxException);
    List<ProblemCode> codes = all.problems().stream().map(DbcProblem::code).toList();
    assertEquals(List.of(ProblemCode.UNEXPECTED_TOKEN, ProblemCode.BIT_RANGE_OVERFLOW, ProblemCode.DUPLICATE_MESSAGE_ID), codes);
  }

  @Test
  void unterminatedQuoteIsLexError() {
    DbcLexException ex = assertThrows(DbcLexException.class,
        () -> DbcParser.parse("BO_ 1 A: 8 X\n BO_ oops\nCM_ \"open", ParseOptions.defaults().withCollectAllErrors(true)));
    assertEquals(ProblemCode.UNTERMINATED_QUOTE, ex.first().code());
    assertEquals(3, ex.first().line());
    assertEquals(2, ex.problems().size());
  }

  @Test
  void decodesLossily() {
    byte[] bytes = "BO_ 1 M: 8 A\nCM_ BO_ 1 \"caf\u00e9\";".getBytes(StandardCharsets.ISO_8859_1);
    DbcModel utf8 = DbcParser.parse(bytes, ParseOptions.defaults());
    assertEquals("caf\uFFFD", utf8.messages().get(0).comment());

    DbcModel latin1 = DbcParser.parse(bytes, ParseOptions.defaults().withCharset(StandardCharsets.ISO_8859_1));
    assertEquals("caf\u00e9", latin1.messages().get(0).comment());
  }

  @Test
  void serializesModelAsJson() throws IOException {
    DbcModel model = DbcParser.parse(resource("powertrain.dbc"), ParseOptions.defaults());
    JsonNode json = JSON.readTree(JSON.writeValueAsString(model));
    assertEquals("1.2", json.get("version").asText());
    JsonNode body = json.get("messages").get(1);
    assertEquals(1024, body.get("id").asLong());
    assertEquals("EXTENDED", body.get("kind").asText());
    assertEquals("M", body.get("signals").get(0).get("multiplex").asText());
    assertEquals(16, json.get("messages").get(0).get("signals").get(0).get("bits").size());
  }
}
