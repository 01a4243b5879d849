package com.gentoro.citations.extraction;

/** Complete result of extracting the outgoing links of a document. */
public record OutgoingLinksExtractedContent(
    ExtractedContentBlocks extractedContentBlocks,
    OutgoingLinksReport outgoingLinksReport,
    ExtractionStats stats) {}
