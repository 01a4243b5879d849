package com.gentoro.citations.extraction.eligibility;

import com.gentoro.citations.extraction.EligibilityDecision;
import com.gentoro.citations.extraction.ExtractionFlags;
import com.gentoro.citations.model.Link;
import java.util.List;
import java.util.Optional;

/**
 * Ordered chain of eligibility rules; the first rule with an opinion decides.
 *
 * <p>The default chain, highest precedence first: stop marker, force marker, anchored link, and
 * the terminal full-files flag.
 */
public class EligibilityAnalyzer {
  static final String NO_STRATEGY_MATCHED = "No strategy matched";

  private final List<ExtractionEligibilityStrategy> strategies;

  public EligibilityAnalyzer(List<ExtractionEligibilityStrategy> strategies) {
    this.strategies = List.copyOf(strategies);
  }

  public static EligibilityAnalyzer defaultChain() {
    return new EligibilityAnalyzer(
        List.of(
            new StopMarkerStrategy(),
            new ForceMarkerStrategy(),
            new SectionLinkStrategy(),
            new CliFlagStrategy()));
  }

  public EligibilityDecision analyze(Link link, ExtractionFlags flags) {
    for (ExtractionEligibilityStrategy strategy : strategies) {
      Optional<EligibilityDecision> decision = strategy.decide(link, flags);
      if (decision.isPresent()) {
        return decision.get();
      }
    }
    return EligibilityDecision.ineligible(NO_STRATEGY_MATCHED);
  }
}
