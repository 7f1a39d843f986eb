package io.intellixity.dbckit.validate;

import io.intellixity.dbckit.DbcProblem;
import io.intellixity.dbckit.DbcSemanticException;
import io.intellixity.dbckit.Diagnostics;
import io.intellixity.dbckit.ParseOptions;
import io.intellixity.dbckit.ProblemCode;
import io.intellixity.dbckit.assemble.SourceLines;
import io.intellixity.dbckit.model.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DbcValidatorTest {
  private static Signal signal(String name, int length, ValueType type, List<String> receivers) {
    return new Signal(name, 0, length, ByteOrder.LITTLE_ENDIAN, type, 1, 0, 0, 0, "", receivers,
        MultiplexRole.NONE, null, null, null, 0, null, null, null);
  }

  private static Message message(MessageId id, String name, String transmitter, List<Signal> signals) {
    return new Message(id, name, 8, transmitter, List.of(), signals, List.of(), null, null, 0);
  }

  private static DbcModel model(List<Node> nodes, List<Message> messages) {
    return new DbcModel("", null, null, nodes, messages, null, null, null, null, null);
  }

  private static List<ProblemCode> run(DbcModel model, ParseOptions options) {
    Diagnostics d = new Diagnostics(options.withCollectAllErrors(true));
    new DbcValidator().validate(model, SourceLines.empty(), d);
    List<DbcProblem> all = new ArrayList<>(d.errors());
    all.addAll(d.warnings());
    return all.stream().map(DbcProblem::code).toList();
  }

  @Test
  void duplicateIdsArePerKind() {
    DbcModel m = model(List.of(), List.of(
        message(MessageId.standard(0x100), "A", null, List.of()),
        message(MessageId.extended(0x100), "B", null, List.of()),
        message(MessageId.standard(0x100), "C", null, List.of())));
    assertEquals(List.of(ProblemCode.DUPLICATE_MESSAGE_ID), run(m, ParseOptions.defaults()));
  }

  @Test
  void idsMustFitTheirWidth() {
    DbcModel m = model(List.of(), List.of(
        message(MessageId.standard(0x7FF), "MAX", null, List.of()),
        message(MessageId.standard(0x800), "TOO_BIG", null, List.of()),
        message(MessageId.extended(0x1FFFFFFF), "EXT_MAX", null, List.of()),
        message(MessageId.extended(0x20000000), "EXT_TOO_BIG", null, List.of()),
        message(MessageId.extended(0x40000000), Message.INDEPENDENT_SIGNALS, null, List.of())));
    assertEquals(List.of(ProblemCode.INVALID_MESSAGE_ID, ProblemCode.INVALID_MESSAGE_ID), run(m, ParseOptions.defaults()));
  }

  @Test
  void signalNamesAreUniquePerMessage() {
    Signal s = signal("S", 8, ValueType.UNSIGNED, List.of());
    DbcModel m = model(List.of(), List.of(
        message(MessageId.standard(1), "A", null, List.of(s, signal("S", 4, ValueType.SIGNED, List.of()))),
        message(MessageId.standard(2), "B", null, List.of(s))));
    assertEquals(List.of(ProblemCode.DUPLICATE_SIGNAL), run(m, ParseOptions.defaults()));
  }

  @Test
  void unknownNodesAreWarningsUnlessStrict() {
    DbcModel m = model(List.of(new Node("ECU1", null, null)), List.of(
        message(MessageId.standard(1), "A", "Ghost", List.of(
            signal("S", 8, ValueType.UNSIGNED, List.of("ECU1", "Vector__XXX", "Other"))))));

    Diagnostics lenient = new Diagnostics(ParseOptions.defaults());
    new DbcValidator().validate(m, SourceLines.empty(), lenient);
    assertFalse(lenient.hasErrors());
    assertEquals(2, lenient.warnings().size());
    assertEquals(ProblemCode.UNKNOWN_NODE, lenient.warnings().get(0).code());

    Diagnostics strict = new Diagnostics(ParseOptions.defaults().withStrictReferences(true));
    DbcSemanticException ex = assertThrows(DbcSemanticException.class,
        () -> new DbcValidator().validate(m, SourceLines.empty(), strict));
    assertTrue(ex.first().message().contains("Ghost"), ex.first().message());
  }

  @Test
  void floatingPointSignalsNeedMatchingLength() {
    DbcModel m = model(List.of(), List.of(message(MessageId.standard(1), "A", null, List.of(
        signal("F32", 32, ValueType.IEEE_FLOAT, List.of()),
        signal("F16", 16, ValueType.IEEE_FLOAT, List.of()),
        signal("D64", 64, ValueType.IEEE_DOUBLE, List.of()),
        signal("D32", 32, ValueType.IEEE_DOUBLE, List.of())))));
    assertEquals(List.of(ProblemCode.INVALID_VALUE_TYPE, ProblemCode.INVALID_VALUE_TYPE), run(m, ParseOptions.defaults()));
  }

  @Test
  void runsDiscoveredRulesAfterBuiltIns() {
    DbcValidator v = DbcValidator.withDiscoveredRules();
    int builtIns = DbcValidator.builtInRules().size();
    assertEquals(builtIns + 1, v.rules().size());
    assertTrue(v.rules().get(builtIns) instanceof RecordingRule);

    int before = RecordingRule.SEEN.get();
    v.validate(model(List.of(), List.of()), SourceLines.empty(), new Diagnostics(ParseOptions.defaults()));
    assertEquals(before + 1, RecordingRule.SEEN.get());
  }
}
