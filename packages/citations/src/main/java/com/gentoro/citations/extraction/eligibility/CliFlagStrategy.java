package com.gentoro.citations.extraction.eligibility;

import com.gentoro.citations.extraction.EligibilityDecision;
import com.gentoro.citations.extraction.ExtractionFlags;
import com.gentoro.citations.model.Link;
import java.util.Optional;

/** Terminal rule: full-file links follow the {@code fullFiles} flag. */
public class CliFlagStrategy implements ExtractionEligibilityStrategy {

  @Override
  public Optional<EligibilityDecision> decide(Link link, ExtractionFlags flags) {
    if (flags.fullFiles()) {
      return Optional.of(EligibilityDecision.eligible("Full-files flag forces extraction"));
    }
    return Optional.of(
        EligibilityDecision.ineligible("Full-file link ineligible without full-files flag"));
  }
}
