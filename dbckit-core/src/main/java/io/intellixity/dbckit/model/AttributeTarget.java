package io.intellixity.dbckit.model;

/** Kind of object an attribute definition, attribute value or comment applies to. */
public enum AttributeTarget {
  NETWORK(""),
  NODE("BU_"),
  MESSAGE("BO_"),
  SIGNAL("SG_"),
  ENVIRONMENT_VARIABLE("EV_");

  private final String keyword;

  AttributeTarget(String keyword) {
    this.keyword = keyword;
  }

  /** Object-type keyword used in {@code BA_DEF_}, {@code BA_} and {@code CM_}; empty for the network. */
  public String keyword() {
    return keyword;
  }

  public static AttributeTarget fromKeyword(String keyword) {
    if (keyword == null || keyword.isEmpty()) return NETWORK;
    for (AttributeTarget t : values()) {
      if (t.keyword.equals(keyword)) return t;
    }
    return null;
  }
}
