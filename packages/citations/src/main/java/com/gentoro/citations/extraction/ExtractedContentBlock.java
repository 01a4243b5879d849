package com.gentoro.citations.extraction;

import java.util.List;

/** One unique piece of extracted text and every link that produced it. */
public record ExtractedContentBlock(
    String content, int contentLength, List<SourceLinkRef> sourceLinks) {

  public ExtractedContentBlock {
    sourceLinks = List.copyOf(sourceLinks);
  }
}
