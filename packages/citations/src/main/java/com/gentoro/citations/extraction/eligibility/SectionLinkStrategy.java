package com.gentoro.citations.extraction.eligibility;

import com.gentoro.citations.extraction.EligibilityDecision;
import com.gentoro.citations.extraction.ExtractionFlags;
import com.gentoro.citations.model.Link;
import java.util.Optional;

public class SectionLinkStrategy implements ExtractionEligibilityStrategy {

  @Override
  public Optional<EligibilityDecision> decide(Link link, ExtractionFlags flags) {
    if (link.anchorType() != null) {
      return Optional.of(EligibilityDecision.eligible("Anchor links eligible by default"));
    }
    return Optional.empty();
  }
}
