package io.intellixity.dbckit.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Bus participant declared in the {@code BU_} statement. */
public record Node(String name, String comment, Map<String, Object> attributes) {
  public Node {
    Objects.requireNonNull(name, "name");
    attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }
}
