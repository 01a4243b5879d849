package com.gentoro.citations.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Objects;

/** Validation outcome attached to a link. {@code error} and {@code suggestion} are optional. */
public record ValidationVerdict(ValidationStatus status, String error, String suggestion) {

  public ValidationVerdict {
    Objects.requireNonNull(status, "status");
  }

  public static ValidationVerdict valid() {
    return new ValidationVerdict(ValidationStatus.VALID, null, null);
  }

  public static ValidationVerdict warning(String error, String suggestion) {
    return new ValidationVerdict(ValidationStatus.WARNING, error, suggestion);
  }

  public static ValidationVerdict error(String error, String suggestion) {
    return new ValidationVerdict(ValidationStatus.ERROR, error, suggestion);
  }

  @JsonIgnore
  public boolean isValid() {
    return status == ValidationStatus.VALID;
  }
}
