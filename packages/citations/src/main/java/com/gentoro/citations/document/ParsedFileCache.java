package com.gentoro.citations.document;

import com.gentoro.citations.exception.ExceptionUtil;
import com.gentoro.citations.parser.MarkdownParser;
import com.gentoro.citations.parser.ParserOutput;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-run cache of parsed documents, keyed by normalized absolute path.
 *
 * <p>The future for a path is stored before parsing starts, so concurrent requests for the same
 * file share a single parse and receive the same {@link ParsedDocument} instance. A failed parse
 * is evicted before its future completes; a caller that observes the failure and asks again
 * triggers a fresh parse.
 */
public class ParsedFileCache {
  private static final org.slf4j.Logger log =
      com.gentoro.citations.logging.LoggingService.getLogger(ParsedFileCache.class);

  private final MarkdownParser parser;
  private final ConcurrentMap<Path, CompletableFuture<ParsedDocument>> cache =
      new ConcurrentHashMap<>();

  public ParsedFileCache(MarkdownParser parser) {
    this.parser = Objects.requireNonNull(parser, "parser");
  }

  public CompletableFuture<ParsedDocument> resolveParsedFile(Path file) {
    Path key = normalize(file);
    CompletableFuture<ParsedDocument> existing = cache.get(key);
    if (existing != null) {
      log.debug("Parse cache hit: {}", key);
      return existing;
    }

    CompletableFuture<ParsedDocument> created = new CompletableFuture<>();
    existing = cache.putIfAbsent(key, created);
    if (existing != null) {
      log.debug("Parse cache hit (lost race): {}", key);
      return existing;
    }

    log.debug("Parse cache miss, parsing {}", key);
    CompletableFuture<ParserOutput> parsing;
    try {
      parsing = Objects.requireNonNull(parser.parseFile(key), "parser returned no future");
    } catch (RuntimeException e) {
      parsing = CompletableFuture.failedFuture(e);
    }
    parsing
        .thenApply(ParsedDocument::new)
        .whenComplete(
            (document, error) -> {
              if (error != null) {
                cache.remove(key, created);
                log.debug("Evicted failed parse of {}: {}", key, ExceptionUtil.rootMessage(error));
                created.completeExceptionally(ExceptionUtil.unwrap(error));
              } else {
                created.complete(document);
              }
            });
    return created;
  }

  public boolean contains(Path file) {
    return cache.containsKey(normalize(file));
  }

  /** Number of entries, pending or resolved. */
  public int size() {
    return cache.size();
  }

  private static Path normalize(Path file) {
    return file.toAbsolutePath().normalize();
  }
}
