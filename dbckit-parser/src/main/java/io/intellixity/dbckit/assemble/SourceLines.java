package io.intellixity.dbckit.assemble;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Declaration line of each model object built by one assembly, keyed by instance.
 * Model records compare by value, so two equal messages declared on different lines keep their own line.
 */
public final class SourceLines {
  private final Map<Object, Integer> lines = new IdentityHashMap<>();

  void put(Object modelObject, int line) {
    lines.put(modelObject, line);
  }

  /** 1-based line, or 0 when the object was not produced by this assembly. */
  public int lineOf(Object modelObject) {
    Integer line = lines.get(modelObject);
    return line == null ? 0 : line;
  }

  public static SourceLines empty() {
    return new SourceLines();
  }
}
