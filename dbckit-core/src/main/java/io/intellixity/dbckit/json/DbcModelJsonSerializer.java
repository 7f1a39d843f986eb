package io.intellixity.dbckit.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.dbckit.DbcProblem;
import io.intellixity.dbckit.model.*;

import java.io.IOException;
import java.util.Map;

/**
 * Canonical JSON rendering of a {@link DbcModel}.
 * <p>
 * Message ids are written as the wire id plus kind; empty collections and absent comments are omitted.
 * Layouts are written as their absolute bit positions (LSB first).
 */
public final class DbcModelJsonSerializer extends JsonSerializer<DbcModel> {
  @Override
  public void serialize(DbcModel m, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (m == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("version", m.version());
    if (!m.newSymbols().isEmpty()) g.writeObjectField("newSymbols", m.newSymbols());
    if (m.bitTiming().isSpecified()) {
      g.writeObjectFieldStart("bitTiming");
      g.writeNumberField("baudrate", m.bitTiming().baudrate());
      g.writeNumberField("btr1", m.bitTiming().btr1());
      g.writeNumberField("btr2", m.bitTiming().btr2());
      g.writeEndObject();
    }
    if (m.comment() != null) g.writeStringField("comment", m.comment());
    writeAttributes(m.attributes(), g);

    g.writeArrayFieldStart("nodes");
    for (Node n : m.nodes()) {
      g.writeStartObject();
      g.writeStringField("name", n.name());
      if (n.comment() != null) g.writeStringField("comment", n.comment());
      writeAttributes(n.attributes(), g);
      g.writeEndObject();
    }
    g.writeEndArray();

    g.writeArrayFieldStart("messages");
    for (Message msg : m.messages()) writeMessage(msg, g);
    g.writeEndArray();

    if (!m.valueTables().isEmpty()) {
      g.writeObjectFieldStart("valueTables");
      for (ValueTable t : m.valueTables().values()) {
        g.writeFieldName(t.name());
        writeLabels(t.entries(), g);
      }
      g.writeEndObject();
    }

    if (!m.attributeDefinitions().isEmpty()) {
      g.writeArrayFieldStart("attributeDefinitions");
      for (AttributeDefinition d : m.attributeDefinitions()) {
        g.writeStartObject();
        g.writeStringField("name", d.name());
        g.writeStringField("target", d.target().name());
        g.writeStringField("type", d.type().name());
        if (d.minimum() != null) g.writeObjectField("min", d.minimum());
        if (d.maximum() != null) g.writeObjectField("max", d.maximum());
        if (!d.enumValues().isEmpty()) g.writeObjectField("values", d.enumValues());
        if (d.defaultValue() != null) g.writeObjectField("default", d.defaultValue());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (!m.warnings().isEmpty()) {
      g.writeArrayFieldStart("warnings");
      for (DbcProblem p : m.warnings()) {
        g.writeStartObject();
        g.writeStringField("code", p.code().name());
        g.writeNumberField("line", p.line());
        g.writeStringField("message", p.message());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    g.writeEndObject();
  }

  private static void writeMessage(Message msg, JsonGenerator g) throws IOException {
    g.writeStartObject();
    g.writeNumberField("id", msg.id().raw());
    g.writeStringField("kind", msg.id().kind().name());
    g.writeStringField("name", msg.name());
    g.writeNumberField("size", msg.size());
    if (msg.hasTransmitter()) g.writeStringField("transmitter", msg.transmitter());
    if (!msg.additionalTransmitters().isEmpty()) g.writeObjectField("additionalTransmitters", msg.additionalTransmitters());
    if (msg.cycleTime() != 0) g.writeNumberField("cycleTime", msg.cycleTime());
    if (msg.comment() != null) g.writeStringField("comment", msg.comment());
    writeAttributes(msg.attributes(), g);

    g.writeArrayFieldStart("signals");
    for (Signal s : msg.signals()) writeSignal(s, g);
    g.writeEndArray();

    if (!msg.signalGroups().isEmpty()) {
      g.writeArrayFieldStart("signalGroups");
      for (SignalGroup sg : msg.signalGroups()) {
        g.writeStartObject();
        g.writeStringField("name", sg.name());
        g.writeNumberField("repetitions", sg.repetitions());
        g.writeObjectField("signals", sg.signalNames());
        g.writeEndObject();
      }
      g.writeEndArray();
    }
    g.writeEndObject();
  }

  private static void writeSignal(Signal s, JsonGenerator g) throws IOException {
    g.writeStartObject();
    g.writeStringField("name", s.name());
    g.writeNumberField("startBit", s.startBit());
    g.writeNumberField("length", s.length());
    g.writeStringField("byteOrder", s.byteOrder().name());
    g.writeStringField("valueType", s.valueType().name());
    g.writeNumberField("factor", s.factor());
    g.writeNumberField("offset", s.offset());
    g.writeNumberField("min", s.minimum());
    g.writeNumberField("max", s.maximum());
    g.writeStringField("unit", s.unit());
    g.writeObjectField("receivers", s.receivers());
    if (s.multiplex().kind() != MultiplexRole.Kind.NONE) g.writeStringField("multiplex", s.multiplex().indicator());
    if (s.switchRange() != null) {
      g.writeObjectFieldStart("switchRange");
      g.writeStringField("switch", s.switchRange().switchName());
      g.writeArrayFieldStart("ranges");
      for (SwitchRange.Range r : s.switchRange().ranges()) {
        g.writeStartArray();
        g.writeNumber(r.from());
        g.writeNumber(r.to());
        g.writeEndArray();
      }
      g.writeEndArray();
      g.writeEndObject();
    }
    if (s.valueTable() != null) g.writeStringField("valueTable", s.valueTable());
    if (!s.valueDescriptions().isEmpty()) {
      g.writeFieldName("values");
      writeLabels(s.valueDescriptions(), g);
    }
    if (s.initialValue() != 0) g.writeNumberField("initialValue", s.initialValue());
    if (s.comment() != null) g.writeStringField("comment", s.comment());
    writeAttributes(s.attributes(), g);
    if (s.layout() != null) g.writeObjectField("bits", s.layout().bits());
    g.writeEndObject();
  }

  private static void writeLabels(Map<Long, String> labels, JsonGenerator g) throws IOException {
    g.writeStartObject();
    for (var e : labels.entrySet()) g.writeStringField(String.valueOf(e.getKey()), e.getValue());
    g.writeEndObject();
  }

  private static void writeAttributes(Map<String, Object> attributes, JsonGenerator g) throws IOException {
    if (attributes == null || attributes.isEmpty()) return;
    g.writeObjectField("attributes", attributes);
  }
}
