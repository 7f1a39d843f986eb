package io.intellixity.dbckit.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.dbckit.DbcProblem;
import io.intellixity.dbckit.json.DbcModelJsonSerializer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything one DBC file declares, linked and validated.
 * <p>
 * Collections keep file order, so parsing the same text twice yields equal models. Instances are never
 * modified after the parser returns them and may be shared between threads.
 */
@JsonSerialize(using = DbcModelJsonSerializer.class)
public record DbcModel(
    String version,
    List<String> newSymbols,
    BitTiming bitTiming,
    List<Node> nodes,
    List<Message> messages,
    Map<String, ValueTable> valueTables,
    List<AttributeDefinition> attributeDefinitions,
    Map<String, Object> attributes,
    String comment,
    List<DbcProblem> warnings
) {
  public DbcModel {
    version = version == null ? "" : version;
    newSymbols = newSymbols == null ? List.of() : List.copyOf(newSymbols);
    bitTiming = bitTiming == null ? BitTiming.UNSPECIFIED : bitTiming;
    nodes = nodes == null ? List.of() : List.copyOf(nodes);
    messages = messages == null ? List.of() : List.copyOf(messages);
    valueTables = valueTables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(valueTables));
    attributeDefinitions = attributeDefinitions == null ? List.of() : List.copyOf(attributeDefinitions);
    attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public DbcModel withWarnings(List<DbcProblem> warnings) {
    return new DbcModel(version, newSymbols, bitTiming, nodes, messages, valueTables, attributeDefinitions,
        attributes, comment, warnings);
  }

  public Message message(MessageId id) {
    Objects.requireNonNull(id, "id");
    for (Message m : messages) {
      if (m.id().equals(id)) return m;
    }
    return null;
  }

  public Message message(String name) {
    for (Message m : messages) {
      if (m.name().equals(name)) return m;
    }
    return null;
  }

  public Node node(String name) {
    for (Node n : nodes) {
      if (n.name().equals(name)) return n;
    }
    return null;
  }

  public ValueTable valueTable(String name) {
    return valueTables.get(name);
  }

  public AttributeDefinition attributeDefinition(AttributeTarget target, String name) {
    for (AttributeDefinition d : attributeDefinitions) {
      if (d.target() == target && d.name().equals(name)) return d;
    }
    return null;
  }
}
