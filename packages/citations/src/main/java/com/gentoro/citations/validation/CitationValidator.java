package com.gentoro.citations.validation;

import com.gentoro.citations.document.ParsedDocument;
import com.gentoro.citations.document.ParsedFileCache;
import com.gentoro.citations.exception.ExceptionUtil;
import com.gentoro.citations.model.Anchor;
import com.gentoro.citations.model.Link;
import com.gentoro.citations.model.ValidationVerdict;
import com.gentoro.citations.utility.StringUtility;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Checks that every link of a document points to an existing file and anchor.
 *
 * <p>All file access goes through {@link ParsedFileCache}; the validator never reads files itself.
 * Links are validated one after another in source order and returned as enriched copies.
 */
public class CitationValidator {
  private static final org.slf4j.Logger log =
      com.gentoro.citations.logging.LoggingService.getLogger(CitationValidator.class);

  static final String FILE_NOT_FOUND_SUGGESTION = "Check if file exists or fix path";
  static final String NO_SIMILAR_ANCHORS = "No similar anchors found";
  private static final int MAX_SUGGESTIONS = 3;

  private final ParsedFileCache cache;

  public CitationValidator(ParsedFileCache cache) {
    this.cache = Objects.requireNonNull(cache, "cache");
  }

  /**
   * Validate all links of {@code sourceFile}. The returned future fails when the source itself
   * cannot be resolved.
   */
  public CompletableFuture<ValidationResult> validateFile(Path sourceFile) {
    return cache
        .resolveParsedFile(sourceFile)
        .thenCompose(
            source -> {
              CompletableFuture<List<Link>> chain =
                  CompletableFuture.completedFuture(new ArrayList<>());
              for (Link link : source.getLinks()) {
                chain =
                    chain.thenCompose(
                        acc ->
                            validateSingleLink(link, sourceFile)
                                .thenApply(
                                    enriched -> {
                                      acc.add(enriched);
                                      return acc;
                                    }));
              }
              return chain.thenApply(
                  links -> {
                    ValidationSummary summary = ValidationSummary.of(links);
                    log.debug("Validated {}: {}", source.getFilePath(), summary);
                    return new ValidationResult(source.getFilePath(), summary, links);
                  });
            });
  }

  /**
   * Validate one link, which may be synthetic. Internal links resolve against {@code contextFile};
   * cross-document links against their absolute target path. Never fails: resolution problems are
   * reported as an {@code error} verdict on the returned copy.
   */
  public CompletableFuture<Link> validateSingleLink(Link link, Path contextFile) {
    Path target;
    try {
      target =
          link.isInternal() || link.target().path().absolute() == null
              ? contextFile
              : Path.of(link.target().path().absolute());
    } catch (InvalidPathException e) {
      log.debug("Target of {} is not a valid path: {}", link.fullMatch(), e.getMessage());
      ValidationVerdict verdict =
          ValidationVerdict.error(
              "File not found: " + link.target().path().raw(), FILE_NOT_FOUND_SUGGESTION);
      return CompletableFuture.completedFuture(link.withValidation(verdict));
    }
    return cache
        .resolveParsedFile(target)
        .handle(
            (document, error) -> {
              if (error != null) {
                log.debug(
                    "Target of {} not resolvable: {}",
                    link.fullMatch(),
                    ExceptionUtil.rootMessage(error));
                String raw =
                    link.target().path().raw() != null
                        ? link.target().path().raw()
                        : target.toString();
                return ValidationVerdict.error("File not found: " + raw, FILE_NOT_FOUND_SUGGESTION);
              }
              if (link.target().anchor() == null) {
                return ValidationVerdict.valid();
              }
              return validateAnchorExists(link.target().anchor(), document);
            })
        .thenApply(link::withValidation);
  }

  /**
   * Resolve {@code anchor} against the anchors of {@code document}.
   *
   * <p>An exact id match (also after stripping a leading caret or percent-decoding) is valid. A
   * match on the loose key, which ignores case, punctuation, whitespace and markdown markers,
   * yields a warning suggesting the real anchor id. Anything else is an error listing up to three
   * similar anchors.
   */
  public ValidationVerdict validateAnchorExists(String anchor, ParsedDocument document) {
    for (String candidate : exactCandidates(anchor)) {
      if (document.hasAnchor(candidate)) {
        return ValidationVerdict.valid();
      }
    }

    String key = StringUtility.looseAnchorKey(anchor);
    if (!key.isEmpty()) {
      for (Anchor candidate : document.getAnchors()) {
        if (key.equals(StringUtility.looseAnchorKey(candidate.id()))) {
          return ValidationVerdict.warning(
              "Anchor #" + anchor + " matches \"" + candidate.id() + "\" only loosely",
              candidate.id());
        }
      }
    }

    List<String> similar = document.findSimilarAnchors(stripCaret(anchor), MAX_SUGGESTIONS);
    String suggestion =
        similar.isEmpty() ? NO_SIMILAR_ANCHORS : "Available anchors: " + String.join(", ", similar);
    return ValidationVerdict.error("Anchor not found: #" + anchor, suggestion);
  }

  /**
   * Standalone reference check such as {@code ^FR1} or a heading name against a file, resolved
   * through the cache.
   */
  public CompletableFuture<ValidationVerdict> validateReference(Path file, String anchorId) {
    return cache
        .resolveParsedFile(file)
        .handle(
            (document, error) -> {
              if (error != null) {
                return ValidationVerdict.error(
                    "File not found: " + file, FILE_NOT_FOUND_SUGGESTION);
              }
              return validateAnchorExists(anchorId, document);
            });
  }

  private static Set<String> exactCandidates(String anchor) {
    Set<String> candidates = new LinkedHashSet<>();
    candidates.add(anchor);
    candidates.add(stripCaret(anchor));
    String decoded = StringUtility.decodePercent(anchor);
    candidates.add(decoded);
    candidates.add(stripCaret(decoded));
    return candidates;
  }

  private static String stripCaret(String anchor) {
    return anchor.startsWith("^") ? anchor.substring(1) : anchor;
  }
}
