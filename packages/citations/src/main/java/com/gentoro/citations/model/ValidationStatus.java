package com.gentoro.citations.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Outcome of validating a single link. */
public enum ValidationStatus {
  VALID("valid"),
  WARNING("warning"),
  ERROR("error");

  private final String value;

  ValidationStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static ValidationStatus fromValue(String value) {
    for (ValidationStatus t : ValidationStatus.values()) {
      if (t.value.equalsIgnoreCase(value)) {
        return t;
      }
    }
    throw new IllegalArgumentException("Unknown ValidationStatus: " + value);
  }
}
