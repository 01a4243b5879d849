package com.gentoro.citations.extraction.eligibility;

import com.gentoro.citations.extraction.EligibilityDecision;
import com.gentoro.citations.extraction.ExtractionFlags;
import com.gentoro.citations.model.Link;
import java.util.Optional;

/** One rule of the eligibility chain. An empty result defers to the next rule. */
public interface ExtractionEligibilityStrategy {
  Optional<EligibilityDecision> decide(Link link, ExtractionFlags flags);
}
