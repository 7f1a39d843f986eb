package io.intellixity.dbckit.statement;

import java.util.HashMap;
import java.util.Map;

/** Every statement the parser understands, keyed by its leading keyword. */
public enum StatementKind {
  VERSION("VERSION"),
  NEW_SYMBOLS("NS_"),
  BIT_TIMING("BS_"),
  NODES("BU_"),
  MESSAGE("BO_"),
  SIGNAL("SG_"),
  VALUE_TABLE("VAL_TABLE_"),
  VALUE_DESCRIPTION("VAL_"),
  COMMENT("CM_"),
  ATTRIBUTE_DEFINITION("BA_DEF_"),
  ATTRIBUTE_DEFAULT("BA_DEF_DEF_"),
  ATTRIBUTE_VALUE("BA_"),
  SIGNAL_GROUP("SIG_GROUP_"),
  MULTIPLEX_RANGE("SG_MUL_VAL_"),
  SIGNAL_VALUE_TYPE("SIG_VALTYPE_"),
  MESSAGE_TRANSMITTERS("BO_TX_BU_");

  private static final Map<String, StatementKind> BY_KEYWORD = new HashMap<>();

  static {
    for (StatementKind k : values()) BY_KEYWORD.put(k.keyword, k);
  }

  private final String keyword;

  StatementKind(String keyword) {
    this.keyword = keyword;
  }

  public String keyword() {
    return keyword;
  }

  /** Kind for a leading keyword, or null when the keyword is not recognized. */
  public static StatementKind forKeyword(String keyword) {
    return keyword == null ? null : BY_KEYWORD.get(keyword);
  }
}
