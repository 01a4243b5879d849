package com.gentoro.citations.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of position an anchor or link fragment names. */
public enum AnchorType {
  HEADER("header"),
  BLOCK("block");

  private final String value;

  AnchorType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Caret-prefixed fragments name block anchors, any other non-empty fragment a heading. */
  public static AnchorType forFragment(String fragment) {
    if (fragment == null || fragment.isEmpty()) return null;
    return fragment.startsWith("^") ? BLOCK : HEADER;
  }

  @JsonCreator
  public static AnchorType fromValue(String value) {
    for (AnchorType t : AnchorType.values()) {
      if (t.value.equalsIgnoreCase(value)) {
        return t;
      }
    }
    throw new IllegalArgumentException("Unknown AnchorType: " + value);
  }
}
