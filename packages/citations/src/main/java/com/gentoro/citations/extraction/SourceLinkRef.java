package com.gentoro.citations.extraction;

/** Where a deduplicated block was cited from. */
public record SourceLinkRef(String rawSourceLink, int sourceLine) {}
