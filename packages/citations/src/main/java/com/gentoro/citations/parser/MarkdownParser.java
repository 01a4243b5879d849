package com.gentoro.citations.parser;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/** Reads and tokenizes a markdown file into links, headings and anchors. */
public interface MarkdownParser {

  /**
   * Parse the given file. The returned future fails with a {@link
   * com.gentoro.citations.exception.NotFoundException} when the file does not exist and with an
   * {@link com.gentoro.citations.exception.IoException} for any other read failure.
   */
  CompletableFuture<ParserOutput> parseFile(Path file);
}
