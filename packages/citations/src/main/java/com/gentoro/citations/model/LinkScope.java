package com.gentoro.citations.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Whether a link points into its own document or into another file. */
public enum LinkScope {
  INTERNAL("internal"),
  CROSS_DOCUMENT("cross-document");

  private final String value;

  LinkScope(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static LinkScope fromValue(String value) {
    for (LinkScope t : LinkScope.values()) {
      if (t.value.equalsIgnoreCase(value)) {
        return t;
      }
    }
    throw new IllegalArgumentException("Unknown LinkScope: " + value);
  }
}
