package com.gentoro.citations.extraction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ProcessingStatus {
  SUCCESS("success"),
  SKIPPED("skipped"),
  ERROR("error");

  private final String value;

  ProcessingStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static ProcessingStatus fromValue(String value) {
    for (ProcessingStatus s : ProcessingStatus.values()) {
      if (s.value.equalsIgnoreCase(value)) {
        return s;
      }
    }
    throw new IllegalArgumentException("Unknown ProcessingStatus: " + value);
  }
}
