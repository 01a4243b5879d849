package com.gentoro.citations.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Syntax a link was written in. */
public enum LinkType {
  MARKDOWN("markdown"),
  WIKI("wiki");

  private final String value;

  LinkType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static LinkType fromValue(String value) {
    for (LinkType t : LinkType.values()) {
      if (t.value.equalsIgnoreCase(value)) {
        return t;
      }
    }
    throw new IllegalArgumentException("Unknown LinkType: " + value);
  }
}
