package io.intellixity.dbckit.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Named raw-value to label mapping declared with {@code VAL_TABLE_}. */
public record ValueTable(String name, Map<Long, String> entries) {
  public ValueTable {
    Objects.requireNonNull(name, "name");
    entries = entries == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
  }

  /** Label for a raw value, or null when the table does not describe it. */
  public String label(long raw) {
    return entries.get(raw);
  }
}
