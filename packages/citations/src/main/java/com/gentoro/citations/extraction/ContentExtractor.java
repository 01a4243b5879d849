package com.gentoro.citations.extraction;

import com.gentoro.citations.document.ParsedDocument;
import com.gentoro.citations.document.ParsedFileCache;
import com.gentoro.citations.exception.ExceptionUtil;
import com.gentoro.citations.exception.ExtractionException;
import com.gentoro.citations.extraction.eligibility.EligibilityAnalyzer;
import com.gentoro.citations.model.AnchorType;
import com.gentoro.citations.model.Link;
import com.gentoro.citations.model.ValidationVerdict;
import com.gentoro.citations.utility.JacksonUtility;
import com.gentoro.citations.utility.StringUtility;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Retrieves the content cited by already validated links and deduplicates it.
 *
 * <p>Links are processed one after another so the report keeps input order. A link that fails
 * validation or eligibility is skipped; a link whose content cannot be retrieved is reported as an
 * error and the run carries on. Target documents are resolved through {@link ParsedFileCache}, so
 * a file cited many times is parsed once.
 */
public class ContentExtractor {
  private static final org.slf4j.Logger log =
      com.gentoro.citations.logging.LoggingService.getLogger(ContentExtractor.class);

  private static final int CHARS_PER_TOKEN = 4;

  private final ParsedFileCache cache;
  private final EligibilityAnalyzer eligibility;

  public ContentExtractor(ParsedFileCache cache, EligibilityAnalyzer eligibility) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.eligibility = Objects.requireNonNull(eligibility, "eligibility");
  }

  public ContentExtractor(ParsedFileCache cache) {
    this(cache, EligibilityAnalyzer.defaultChain());
  }

  public CompletableFuture<OutgoingLinksExtractedContent> extractContent(
      List<Link> links, ExtractionFlags flags) {
    CompletableFuture<List<ProcessedLink>> chain =
        CompletableFuture.completedFuture(new ArrayList<>());
    for (Link link : links) {
      chain =
          chain.thenCompose(
              processed ->
                  processLink(link, flags)
                      .thenApply(
                          result -> {
                            processed.add(result);
                            return processed;
                          }));
    }
    return chain.thenApply(this::aggregate);
  }

  private CompletableFuture<ProcessedLink> processLink(Link link, ExtractionFlags flags) {
    ValidationVerdict verdict = link.validation();
    if (verdict == null) {
      return CompletableFuture.completedFuture(
          ProcessedLink.skipped(link, "Link has not been validated"));
    }
    switch (verdict.status()) {
      case ERROR:
        return CompletableFuture.completedFuture(
            ProcessedLink.skipped(link, "Link failed validation: " + verdict.error()));
      case WARNING:
        return CompletableFuture.completedFuture(
            ProcessedLink.skipped(link, "Link validation warning: " + verdict.error()));
      default:
        break;
    }

    EligibilityDecision decision = eligibility.analyze(link, flags);
    if (!decision.eligible()) {
      return CompletableFuture.completedFuture(
          ProcessedLink.skipped(link, "Link not eligible: " + decision.reason()));
    }

    return cache
        .resolveParsedFile(targetOf(link))
        .thenApply(document -> retrieve(link, document))
        .handle(
            (content, error) -> {
              if (error != null) {
                String reason = "Extraction failed: " + ExceptionUtil.rootMessage(error);
                log.warn("{} (line {}): {}", link.fullMatch(), link.line(), reason);
                return ProcessedLink.error(link, reason);
              }
              return ProcessedLink.success(
                  link, ContentIds.of(content), decision.reason(), content);
            });
  }

  private static Path targetOf(Link link) {
    if (link.isInternal() || link.target().path().absolute() == null) {
      return Path.of(link.source().path().absolute());
    }
    return Path.of(link.target().path().absolute());
  }

  private static String retrieve(Link link, ParsedDocument document) {
    String anchor = link.target().anchor();
    if (link.anchorType() == null) {
      return document.extractFullContent();
    }
    return switch (link.anchorType()) {
      case HEADER -> {
        String heading = StringUtility.decodePercent(anchor);
        yield document
            .extractSection(heading)
            .or(
                () ->
                    document
                        .findAnchor(heading)
                        .filter(a -> a.anchorType() == AnchorType.HEADER)
                        .flatMap(a -> document.extractSectionAt(a.line())))
            .orElseThrow(
                () ->
                    new ExtractionException(
                        "Heading not found: " + heading, Map.of("file", document.getFilePath())));
      }
      case BLOCK -> {
        String blockId = anchor.startsWith("^") ? anchor.substring(1) : anchor;
        yield document
            .extractBlock(blockId)
            .orElseThrow(
                () ->
                    new ExtractionException(
                        "Block not found: " + blockId, Map.of("file", document.getFilePath())));
      }
    };
  }

  /** Roughly four characters per token; any non-empty text counts as at least one. */
  static int estimateTokens(String text) {
    if (text == null || text.isEmpty()) return 0;
    return Math.max(1, text.length() / CHARS_PER_TOKEN);
  }

  private OutgoingLinksExtractedContent aggregate(List<ProcessedLink> processed) {
    Map<String, String> contents = new LinkedHashMap<>();
    Map<String, List<SourceLinkRef>> sources = new LinkedHashMap<>();
    int duplicates = 0;
    int charactersSaved = 0;
    int tokensSaved = 0;
    int extracted = 0;
    int skipped = 0;
    int failed = 0;

    for (ProcessedLink p : processed) {
      switch (p.status()) {
        case SKIPPED -> skipped++;
        case ERROR -> failed++;
        case SUCCESS -> {
          extracted++;
          String content = p.successDetails().extractedContent();
          if (contents.putIfAbsent(p.contentId(), content) != null) {
            duplicates++;
            charactersSaved += content.length();
            tokensSaved += estimateTokens(content);
          }
          sources
              .computeIfAbsent(p.contentId(), k -> new ArrayList<>())
              .add(new SourceLinkRef(p.sourceLink().fullMatch(), p.sourceLink().line()));
        }
      }
    }

    Map<String, ExtractedContentBlock> blocks = new LinkedHashMap<>();
    int uniqueCharacters = 0;
    for (Map.Entry<String, String> e : contents.entrySet()) {
      String content = e.getValue();
      uniqueCharacters += content.length();
      List<SourceLinkRef> refs = sources.get(e.getKey());
      blocks.put(e.getKey(), new ExtractedContentBlock(content, content.length(), refs));
    }

    int total = uniqueCharacters + charactersSaved;
    double ratio = total == 0 ? 0.0 : (double) charactersSaved / total;
    ExtractionStats stats =
        new ExtractionStats(
            processed.size(),
            blocks.size(),
            duplicates,
            tokensSaved,
            charactersSaved,
            ratio,
            extracted,
            skipped,
            failed);

    int jsonSize = JacksonUtility.toCompactJson(blocks).length();
    log.debug(
        "Extracted {} of {} links into {} unique blocks ({} duplicates)",
        extracted,
        processed.size(),
        blocks.size(),
        duplicates);
    return new OutgoingLinksExtractedContent(
        new ExtractedContentBlocks(jsonSize, blocks), new OutgoingLinksReport(processed), stats);
  }
}
