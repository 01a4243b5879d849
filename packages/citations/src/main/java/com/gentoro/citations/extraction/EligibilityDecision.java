package com.gentoro.citations.extraction;

/** Whether a validated link's content should be extracted, and why. */
public record EligibilityDecision(boolean eligible, String reason) {

  public static EligibilityDecision eligible(String reason) {
    return new EligibilityDecision(true, reason);
  }

  public static EligibilityDecision ineligible(String reason) {
    return new EligibilityDecision(false, reason);
  }
}
