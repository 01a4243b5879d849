package com.gentoro.citations.extraction.eligibility;

import com.gentoro.citations.extraction.EligibilityDecision;
import com.gentoro.citations.extraction.ExtractionFlags;
import com.gentoro.citations.model.Link;
import java.util.Optional;

/** A {@code force-extract} marker makes the link eligible regardless of flags. */
public class ForceMarkerStrategy implements ExtractionEligibilityStrategy {
  public static final String MARKER = "force-extract";

  @Override
  public Optional<EligibilityDecision> decide(Link link, ExtractionFlags flags) {
    if (link.hasMarker(MARKER)) {
      return Optional.of(EligibilityDecision.eligible(MARKER + " overrides defaults"));
    }
    return Optional.empty();
  }
}
