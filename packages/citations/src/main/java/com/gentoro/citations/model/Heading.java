package com.gentoro.citations.model;

/** Heading found in a document; {@code raw} is the heading's source text including markers. */
public record Heading(int level, String text, String raw) {}
