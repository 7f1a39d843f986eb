package io.intellixity.dbckit.model;

import java.util.List;
import java.util.Objects;

/**
 * Custom attribute declared with {@code BA_DEF_}; {@code defaultValue} comes from {@code BA_DEF_DEF_}.
 * <p>
 * Numeric bounds are null for STRING and ENUM attributes. Values are Long for INT/HEX, Double for
 * FLOAT and String for STRING/ENUM.
 */
public record AttributeDefinition(
    String name,
    AttributeTarget target,
    AttributeType type,
    Number minimum,
    Number maximum,
    List<String> enumValues,
    Object defaultValue
) {
  public AttributeDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(type, "type");
    enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
  }

  public AttributeDefinition withDefaultValue(Object value) {
    return new AttributeDefinition(name, target, type, minimum, maximum, enumValues, value);
  }

  /**
   * Converts a value as written in a {@code BA_} or {@code BA_DEF_DEF_} statement to this attribute's
   * value type. Enumeration values written as an index resolve to their label; anything that does not
   * fit is returned unchanged.
   */
  public Object coerce(Object written) {
    if (written == null) return null;
    switch (type) {
      case INT, HEX -> {
        if (written instanceof Number n) return n.longValue();
      }
      case FLOAT -> {
        if (written instanceof Number n) return n.doubleValue();
      }
      case STRING -> {
        return String.valueOf(written);
      }
      case ENUM -> {
        if (written instanceof Number n) {
          long idx = n.longValue();
          if (idx >= 0 && idx < enumValues.size()) return enumValues.get((int) idx);
        }
      }
    }
    return written;
  }
}
