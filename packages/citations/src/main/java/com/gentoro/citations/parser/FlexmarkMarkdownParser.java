package com.gentoro.citations.parser;

import com.gentoro.citations.exception.CitationErrorCode;
import com.gentoro.citations.exception.CitationException;
import com.gentoro.citations.exception.IoException;
import com.gentoro.citations.exception.NotFoundException;
import com.gentoro.citations.model.Anchor;
import com.gentoro.citations.model.Heading;
import com.gentoro.citations.model.Link;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Document;
import com.vladsch.flexmark.util.data.MutableDataSet;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link MarkdownParser} backed by flexmark.
 *
 * <p>The file is read and tokenized on the supplied executor. Inline links and block anchors are
 * scanned line by line over the raw text; headings and reference-style links come from the flexmark
 * node tree so that setext headings and headings nested in lists or quotes are found as well.
 */
public class FlexmarkMarkdownParser implements MarkdownParser {
  private static final org.slf4j.Logger log =
      com.gentoro.citations.logging.LoggingService.getLogger(FlexmarkMarkdownParser.class);

  private final Executor executor;
  private final Parser parser;

  public FlexmarkMarkdownParser(Executor executor) {
    this.executor = executor;
    MutableDataSet options = new MutableDataSet();
    options.set(Parser.EXTENSIONS, Arrays.asList(TablesExtension.create()));
    this.parser = Parser.builder(options).build();
  }

  @Override
  public CompletableFuture<ParserOutput> parseFile(Path file) {
    return CompletableFuture.supplyAsync(() -> parse(file), executor);
  }

  /** Synchronous parse, used by {@link #parseFile(Path)} on the executor thread. */
  public ParserOutput parse(Path file) {
    Path absolute = file.toAbsolutePath().normalize();
    return parseContent(absolute, read(absolute));
  }

  /** Tokenize already loaded content as if it had been read from {@code file}. */
  public ParserOutput parseContent(Path file, String content) {
    Path absolute = file.toAbsolutePath().normalize();
    Document document;
    try {
      document = parser.parse(content);
    } catch (RuntimeException e) {
      throw new CitationException(
          CitationErrorCode.PARSE_ERROR,
          "Failed to tokenize markdown file: " + absolute,
          Map.of("path", absolute.toString()),
          e);
    }

    SourceLines lines = new SourceLines(content);
    List<com.vladsch.flexmark.ast.Heading> headingNodes = HeadingExtractor.headingNodes(document);
    List<Heading> headings = HeadingExtractor.extract(headingNodes);
    List<Anchor> anchors = AnchorExtractor.extract(lines, headingNodes);
    List<Link> links = new LinkExtractor(absolute).extract(lines, document);

    log.debug(
        "Parsed {}: {} links, {} headings, {} anchors",
        absolute,
        links.size(),
        headings.size(),
        anchors.size());
    return new ParserOutput(absolute.toString(), content, document, links, headings, anchors);
  }

  private static String read(Path file) {
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      throw new NotFoundException("File not found: " + file, Map.of("path", file.toString()), e);
    } catch (IOException e) {
      throw new IoException("Failed to read markdown file: " + file, e);
    }
  }
}
