package com.gentoro.citations.validation;

import com.gentoro.citations.model.Link;
import java.util.List;

/** Counts of link verdicts in one validation run. */
public record ValidationSummary(int total, int valid, int warnings, int errors) {

  public static ValidationSummary of(List<Link> links) {
    int valid = 0;
    int warnings = 0;
    int errors = 0;
    for (Link link : links) {
      if (link.validation() == null) continue;
      switch (link.validation().status()) {
        case VALID -> valid++;
        case WARNING -> warnings++;
        case ERROR -> errors++;
      }
    }
    return new ValidationSummary(links.size(), valid, warnings, errors);
  }
}
