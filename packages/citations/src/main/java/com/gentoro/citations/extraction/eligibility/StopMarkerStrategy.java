package com.gentoro.citations.extraction.eligibility;

import com.gentoro.citations.extraction.EligibilityDecision;
import com.gentoro.citations.extraction.ExtractionFlags;
import com.gentoro.citations.model.Link;
import java.util.Optional;

/** A {@code stop-extract-link} marker keeps the link out of the extraction. */
public class StopMarkerStrategy implements ExtractionEligibilityStrategy {
  public static final String MARKER = "stop-extract-link";

  @Override
  public Optional<EligibilityDecision> decide(Link link, ExtractionFlags flags) {
    if (link.hasMarker(MARKER)) {
      return Optional.of(EligibilityDecision.ineligible(MARKER + " marker prevents extraction"));
    }
    return Optional.empty();
  }
}
