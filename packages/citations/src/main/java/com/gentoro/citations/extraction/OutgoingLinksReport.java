package com.gentoro.citations.extraction;

import java.util.List;

public record OutgoingLinksReport(List<ProcessedLink> processedLinks) {

  public OutgoingLinksReport {
    processedLinks = List.copyOf(processedLinks);
  }
}
