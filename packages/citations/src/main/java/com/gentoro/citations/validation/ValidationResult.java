package com.gentoro.citations.validation;

import com.gentoro.citations.model.Link;
import java.util.List;

/** Links of one file, each carrying its verdict, plus the aggregated counts. */
public record ValidationResult(String filePath, ValidationSummary summary, List<Link> links) {

  public ValidationResult {
    links = List.copyOf(links);
  }

  public boolean hasErrors() {
    return summary.errors() > 0;
  }
}
