package io.intellixity.dbckit.assemble;

import io.intellixity.dbckit.DbcProblem;
import io.intellixity.dbckit.DbcSemanticException;
import io.intellixity.dbckit.Diagnostics;
import io.intellixity.dbckit.ParseOptions;
import io.intellixity.dbckit.ProblemCode;
import io.intellixity.dbckit.grammar.StatementClassifier;
import io.intellixity.dbckit.lex.DbcLexer;
import io.intellixity.dbckit.lex.LexedStatement;
import io.intellixity.dbckit.model.*;
import io.intellixity.dbckit.statement.DbcStatement;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DbcAssemblerTest {
  private static Assembly assemble(String text, Diagnostics d) {
    StatementClassifier classifier = new StatementClassifier(d);
    DbcAssembler assembler = new DbcAssembler(d);
    for (LexedStatement lexed : new DbcLexer(text)) {
      DbcStatement s = classifier.classify(lexed);
      if (s != null) assembler.accept(s);
    }
    return assembler.finish();
  }

  private static Diagnostics collecting() {
    return new Diagnostics(ParseOptions.defaults().withCollectAllErrors(true));
  }

  private static List<ProblemCode> codes(List<DbcProblem> problems) {
    return problems.stream().map(DbcProblem::code).toList();
  }

  @Test
  void attachesSignalsToPrecedingMessage() {
    Diagnostics d = collecting();
    DbcModel m = assemble("""
        BU_: ECU1 ECU2
        BO_ 256 ENGINE_DATA: 8 ECU1
         SG_ RPM : 0|16@1+ (0.25,0) [0|16000] "rpm" ECU2
         SG_ Temp : 16|8@1- (1,-40) [-40|215] "degC" ECU2
        BO_ 257 OTHER: 2 ECU2
         SG_ Flag : 0|1@1+ (1,0) [0|1] "" ECU1
        """, d).model();

    assertFalse(d.hasErrors());
    assertEquals(List.of("ECU1", "ECU2"), m.nodes().stream().map(Node::name).toList());
    assertEquals(2, m.messages().size());
    Message engine = m.message(MessageId.standard(256));
    assertEquals(List.of("RPM", "Temp"), engine.signals().stream().map(Signal::name).toList());
    assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15), engine.signal("RPM").layout().bits());
    assertEquals(1, m.message("OTHER").signals().size());
  }

  @Test
  void signalBeforeAnyMessageIsOrphan() {
    Diagnostics d = new Diagnostics(ParseOptions.defaults());
    DbcSemanticException ex = assertThrows(DbcSemanticException.class,
        () -> assemble("SG_ RPM : 0|16@1+ (1,0) [0|0] \"\" A\nBO_ 1 M: 8 A", d));
    assertEquals(ProblemCode.ORPHAN_SIGNAL, ex.first().code());
    assertEquals(1, ex.first().line());
  }

  @Test
  void signalsOfMalformedMessageAreDropped() {
    Diagnostics d = collecting();
    DbcModel m = assemble("""
        BO_ 1 GOOD: 8 A
         SG_ S1 : 0|8@1+ (1,0) [0|0] "" A
        BO_ bad BROKEN: 8 A
         SG_ S2 : 0|8@1+ (1,0) [0|0] "" A
         SG_ S3 : 8|8@1+ (1,0) [0|0] "" A
        BO_ 2 NEXT: 8 A
         SG_ S4 : 0|8@1+ (1,0) [0|0] "" A
        """, d).model();

    assertEquals(List.of(ProblemCode.UNEXPECTED_TOKEN), codes(d.errors()));
    assertEquals(List.of("GOOD", "NEXT"), m.messages().stream().map(Message::name).toList());
    assertEquals(List.of("S1"), m.message("GOOD").signals().stream().map(Signal::name).toList());
    assertEquals(List.of("S4"), m.message("NEXT").signals().stream().map(Signal::name).toList());
  }

  @Test
  void resolvesForwardReferences() {
    Diagnostics d = collecting();
    DbcModel m = assemble("""
        CM_ SG_ 100 Gear "Selected gear";
        VAL_ 100 Gear GearTable;
        BA_ "GenMsgCycleTime" BO_ 100 50;
        BU_: ECU1
        VAL_TABLE_ GearTable 0 "P" 1 "R";
        BO_ 100 TRANSMISSION: 1 ECU1
         SG_ Gear : 0|4@1+ (1,0) [0|15] "" ECU1
        BA_DEF_ BO_ "GenMsgCycleTime" INT 0 10000;
        """, d).model();

    assertFalse(d.hasErrors());
    assertTrue(d.warnings().isEmpty(), d.warnings().toString());
    Message msg = m.message("TRANSMISSION");
    Signal gear = msg.signal("Gear");
    assertEquals("Selected gear", gear.comment());
    assertEquals("GearTable", gear.valueTable());
    assertEquals("R", gear.describe(1));
    assertEquals(50L, msg.cycleTime());
    assertEquals(50L, msg.attributes().get("GenMsgCycleTime"));
  }

  @Test
  void danglingReferencesAreWarningsByDefault() {
    Diagnostics d = collecting();
    DbcModel m = assemble("""
        BO_ 1 M: 8 A
         SG_ S : 0|8@1+ (1,0) [0|0] "" A
        CM_ BO_ 2 "no such message";
        CM_ SG_ 1 Missing "no such signal";
        CM_ BU_ Ghost "no such node";
        VAL_ 1 S UnknownTable;
        SIG_GROUP_ 1 G 1 : S Missing;
        BA_ "Undefined" BO_ 1 3;
        BA_DEF_DEF_ "AlsoUndefined" 0;
        """, d).model();

    assertFalse(d.hasErrors());
    assertEquals(List.of(
        ProblemCode.DANGLING_REFERENCE,
        ProblemCode.DANGLING_REFERENCE,
        ProblemCode.DANGLING_REFERENCE,
        ProblemCode.DANGLING_REFERENCE,
        ProblemCode.DANGLING_REFERENCE,
        ProblemCode.UNDEFINED_ATTRIBUTE,
        ProblemCode.UNDEFINED_ATTRIBUTE), codes(d.warnings()));
    assertEquals(List.of("S"), m.message("M").signalGroups().get(0).signalNames());
  }

  @Test
  void danglingReferencesFailInStrictMode() {
    Diagnostics d = new Diagnostics(ParseOptions.defaults().withStrictReferences(true));
    DbcSemanticException ex = assertThrows(DbcSemanticException.class,
        () -> assemble("BO_ 1 M: 8 A\nCM_ BO_ 2 \"x\";", d));
    assertEquals(ProblemCode.DANGLING_REFERENCE, ex.first().code());
    assertEquals(2, ex.first().line());
  }

  @Test
  void multiplexedSignalsNeedOneMultiplexor() {
    String body = """
        BO_ 1 MUX: 8 A
         SG_ A0 m0 : 8|8@1+ (1,0) [0|0] "" A
         SG_ A1 m1 : 8|8@1+ (1,0) [0|0] "" A
        """;
    Diagnostics missing = collecting();
    assemble(body, missing);
    assertEquals(List.of(ProblemCode.MULTIPLEXOR_MISSING), codes(missing.errors()));

    Diagnostics fixed = collecting();
    DbcModel m = assemble(body + " SG_ Sel M : 0|8@1+ (1,0) [0|0] \"\" A\n", fixed).model();
    assertFalse(fixed.hasErrors());
    assertEquals("Sel", m.message("MUX").multiplexor().name());
    assertTrue(m.message("MUX").isMultiplexed());

    Diagnostics twice = collecting();
    assemble(body + " SG_ Sel M : 0|4@1+ (1,0) [0|0] \"\" A\n SG_ Sel2 M : 4|4@1+ (1,0) [0|0] \"\" A\n", twice);
    assertEquals(List.of(ProblemCode.MULTIPLE_MULTIPLEXORS), codes(twice.errors()));
  }

  @Test
  void checksExtendedMultiplexRanges() {
    String body = """
        BO_ 1 EXT: 8 A
         SG_ Mode M : 0|2@1+ (1,0) [0|3] "" A
         SG_ Level m1M : 8|8@1+ (1,0) [0|0] "" A
         SG_ Deep m3 : 16|8@1+ (1,0) [0|0] "" A
        """;
    Diagnostics ok = collecting();
    DbcModel m = assemble(body + "SG_MUL_VAL_ 1 Level Mode 1-2;\nSG_MUL_VAL_ 1 Deep Level 2-4, 10-12;\n", ok).model();
    assertFalse(ok.hasErrors(), ok.errors().toString());
    SwitchRange deep = m.message("EXT").signal("Deep").switchRange();
    assertEquals("Level", deep.switchName());
    assertEquals(2, deep.ranges().size());

    Diagnostics outside = collecting();
    assemble(body + "SG_MUL_VAL_ 1 Deep Level 4-5;\n", outside);
    assertEquals(List.of(ProblemCode.SWITCH_VALUE_OUT_OF_RANGE), codes(outside.errors()));

    Diagnostics tooWide = collecting();
    assemble(body + "SG_MUL_VAL_ 1 Level Mode 1-4;\n", tooWide);
    assertEquals(List.of(ProblemCode.SWITCH_VALUE_OUT_OF_RANGE), codes(tooWide.errors()));

    Diagnostics notASwitch = collecting();
    assemble(body + "SG_MUL_VAL_ 1 Level Deep 1-1;\n", notASwitch);
    assertEquals(List.of(ProblemCode.MULTIPLEXOR_MISSING), codes(notASwitch.errors()));
  }

  @Test
  void bitRangeMustFitMessage() {
    Diagnostics d = collecting();
    DbcModel m = assemble("""
        BO_ 1 SMALL: 1 A
         SG_ Fits : 0|8@1+ (1,0) [0|0] "" A
         SG_ TooFar : 60|8@1+ (1,0) [0|0] "" A
        BO_ 3221225472 VECTOR__INDEPENDENT_SIG_MSG: 0 Vector__XXX
         SG_ Loose : 60|8@1+ (1,0) [0|0] "" A
        """, d).model();

    assertEquals(List.of(ProblemCode.BIT_RANGE_OVERFLOW), codes(d.errors()));
    assertEquals(3, d.errors().get(0).line());
    assertNull(m.message("SMALL").signal("TooFar").layout());
    assertNotNull(m.message(Message.INDEPENDENT_SIGNALS).signal("Loose").layout());
  }

  @Test
  void derivesCycleTimeInitialValueAndEnumLabels() {
    Diagnostics d = collecting();
    DbcModel m = assemble("""
        BO_ 1 A_MSG: 8 Vector__XXX
         SG_ Temp : 0|8@1+ (0.5,-40) [0|0] "" Vector__XXX
         SG_ Other : 8|8@1+ (1,0) [0|0] "" Vector__XXX
        BO_ 2 B_MSG: 8 Vector__XXX
        BA_DEF_ BO_ "GenMsgCycleTime" INT 0 65535;
        BA_DEF_ SG_ "GenSigStartValue" FLOAT 0 1000;
        BA_DEF_ BO_ "GenMsgSendType" ENUM "Cyclic","OnChange";
        BA_DEF_DEF_ "GenMsgCycleTime" 200;
        BA_DEF_DEF_ "GenSigStartValue" 4;
        BA_DEF_DEF_ "GenMsgSendType" "Cyclic";
        BA_ "GenMsgCycleTime" BO_ 1 20;
        BA_ "GenSigStartValue" SG_ 1 Temp 100;
        BA_ "GenMsgSendType" BO_ 2 1;
        """, d).model();

    assertFalse(d.hasErrors());
    Message a = m.message("A_MSG");
    Message b = m.message("B_MSG");
    assertFalse(a.hasTransmitter());
    assertEquals(20L, a.cycleTime());
    assertEquals(200L, b.cycleTime());
    assertEquals(100.0, a.signal("Temp").initialValue());
    assertEquals(10.0, a.signal("Temp").physicalInitialValue());
    assertEquals(4.0, a.signal("Other").initialValue());
    assertEquals("OnChange", b.attributes().get("GenMsgSendType"));
    assertEquals("Cyclic", m.attributeDefinition(AttributeTarget.MESSAGE, "GenMsgSendType").defaultValue());
  }

  @Test
  void reportsDuplicateDeclarations() {
    Diagnostics d = collecting();
    DbcModel m = assemble("""
        BU_: A B A
        VAL_TABLE_ T 0 "x" 0 "y";
        VAL_TABLE_ T 1 "z";
        BA_DEF_ BO_ "Attr" INT 0 1;
        BA_DEF_ BO_ "Attr" INT 0 2;
        BA_DEF_ SG_ "Attr" INT 0 3;
        """, d).model();

    assertEquals(List.of(
        ProblemCode.DUPLICATE_NODE,
        ProblemCode.DUPLICATE_VALUE_ENTRY,
        ProblemCode.DUPLICATE_VALUE_TABLE,
        ProblemCode.DUPLICATE_ATTRIBUTE_DEFINITION), codes(d.errors()));
    assertEquals(2, m.nodes().size());
    assertEquals(Map.of(0L, "x"), m.valueTable("T").entries());
    assertEquals(2, m.attributeDefinitions().size());
  }

  @Test
  void appliesValueTypesTransmittersAndComments() {
    Diagnostics d = collecting();
    DbcModel m = assemble("""
        BU_: A B
        BO_ 1 M: 8 A
         SG_ F : 0|32@1- (1,0) [0|0] "" B
         SG_ D : 0|64@1+ (1,0) [0|0] "" B
        SIG_VALTYPE_ 1 F : 1;
        SIG_VALTYPE_ 1 D : 2;
        BO_TX_BU_ 1 : B,A,B;
        CM_ "network";
        CM_ BU_ B "node b";
        CM_ BO_ 1 "message";
        """, d).model();

    Message msg = m.message("M");
    assertEquals(ValueType.IEEE_FLOAT, msg.signal("F").valueType());
    assertEquals(ValueType.IEEE_DOUBLE, msg.signal("D").valueType());
    assertEquals(List.of("B", "A"), msg.additionalTransmitters());
    assertEquals("network", m.comment());
    assertEquals("node b", m.node("B").comment());
    assertEquals("message", msg.comment());
  }

  @Test
  void recordsDeclarationLines() {
    Diagnostics d = collecting();
    Assembly a = assemble("BU_: A\n\nBO_ 1 M: 8 A\n SG_ S : 0|8@1+ (1,0) [0|0] \"\" A\n", d);
    Message msg = a.model().messages().get(0);
    assertEquals(1, a.lines().lineOf(a.model().nodes().get(0)));
    assertEquals(3, a.lines().lineOf(msg));
    assertEquals(4, a.lines().lineOf(msg.signals().get(0)));
    assertEquals(0, a.lines().lineOf(new Object()));
  }
}
