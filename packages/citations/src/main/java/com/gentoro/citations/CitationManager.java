package com.gentoro.citations;

import com.gentoro.citations.document.ParsedFileCache;
import com.gentoro.citations.exception.ExceptionUtil;
import com.gentoro.citations.exception.ValidationException;
import com.gentoro.citations.extraction.ContentExtractor;
import com.gentoro.citations.extraction.ExtractionFlags;
import com.gentoro.citations.extraction.OutgoingLinksExtractedContent;
import com.gentoro.citations.logging.LoggingService;
import com.gentoro.citations.model.Link;
import com.gentoro.citations.model.LinkFactory;
import com.gentoro.citations.model.ValidationStatus;
import com.gentoro.citations.model.ValidationVerdict;
import com.gentoro.citations.parser.FlexmarkMarkdownParser;
import com.gentoro.citations.parser.ParserOutput;
import com.gentoro.citations.utility.JacksonUtility;
import com.gentoro.citations.validation.CitationValidator;
import com.gentoro.citations.validation.ValidationResult;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.configuration2.Configuration;

/**
 * Entry point wiring parser, parse cache, validator and extractor together.
 *
 * <p>One manager corresponds to one run: every operation shares the same {@link ParsedFileCache},
 * so a file is parsed at most once no matter how many operations touch it. Closing the manager
 * shuts down the parse executor.
 */
public class CitationManager implements AutoCloseable {
  private static final org.slf4j.Logger log = LoggingService.getLogger(CitationManager.class);

  public static final String PARSER_THREADS = "citations.parser.threads";
  public static final String FULL_FILES = "citations.extraction.fullFiles";

  private final ExecutorService executor;
  private final FlexmarkMarkdownParser parser;
  private final ParsedFileCache cache;
  private final CitationValidator validator;
  private final ContentExtractor extractor;
  private final LinkFactory linkFactory;
  private final boolean defaultFullFiles;

  public CitationManager(ConfigurationProvider configurationProvider) {
    this(configurationProvider.config(), new LinkFactory());
  }

  public CitationManager(Configuration config, LinkFactory linkFactory) {
    LoggingService.applyConfiguration(config);
    int threads = Math.max(1, config.getInt(PARSER_THREADS, 4));
    this.executor = Executors.newFixedThreadPool(threads, daemonThreads());
    this.parser = new FlexmarkMarkdownParser(executor);
    this.cache = new ParsedFileCache(parser);
    this.validator = new CitationValidator(cache);
    this.extractor = new ContentExtractor(cache);
    this.linkFactory = linkFactory;
    this.defaultFullFiles = config.getBoolean(FULL_FILES, false);
    log.debug("Citation manager ready ({} parser threads)", threads);
  }

  /** Flags built from configuration defaults. */
  public ExtractionFlags defaultFlags() {
    return new ExtractionFlags(defaultFullFiles, null);
  }

  /** Parse a file without going through the cache. */
  public ParserOutput ast(Path file) {
    return join(parser.parseFile(file));
  }

  public ValidationResult validate(Path file) {
    ValidationResult result = join(validator.validateFile(file));
    log.info(
        "Validated {}: {} links, {} valid, {} warnings, {} errors",
        result.filePath(),
        result.summary().total(),
        result.summary().valid(),
        result.summary().warnings(),
        result.summary().errors());
    return result;
  }

  public ValidationVerdict validateReference(Path file, String anchorId) {
    return join(validator.validateReference(file, anchorId));
  }

  /** Validate every link of {@code source} and extract the content they cite. */
  public OutgoingLinksExtractedContent extractLinks(Path source, ExtractionFlags flags) {
    requireInScope(source, flags);
    ValidationResult validation = validate(source);
    return join(extractor.extractContent(validation.links(), flags));
  }

  /** Extract the section under {@code heading} from {@code file}. */
  public OutgoingLinksExtractedContent extractHeader(
      Path file, String heading, ExtractionFlags flags) {
    Link link = linkFactory.createHeaderLink(file.toString(), heading);
    return extractSynthetic(link, flags);
  }

  /** Extract a whole file; the full-files flag is implied. */
  public OutgoingLinksExtractedContent extractFile(Path file) {
    Link link = linkFactory.createFileLink(file.toString());
    return extractSynthetic(link, ExtractionFlags.withFullFiles());
  }

  public String toJson(Object value) {
    return JacksonUtility.toJson(value);
  }

  public ParsedFileCache getCache() {
    return cache;
  }

  private OutgoingLinksExtractedContent extractSynthetic(Link link, ExtractionFlags flags) {
    Path target = Path.of(link.target().path().absolute());
    Link validated = join(validator.validateSingleLink(link, target));
    if (validated.validation().status() == ValidationStatus.ERROR) {
      String suggestion = validated.validation().suggestion();
      throw new ValidationException(
          validated.validation().error()
              + (suggestion == null ? "" : " (" + suggestion + ")"));
    }
    return join(extractor.extractContent(List.of(validated), flags));
  }

  private static void requireInScope(Path source, ExtractionFlags flags) {
    if (flags.scope() == null) return;
    Path scope = flags.scope().toAbsolutePath().normalize();
    Path normalized = source.toAbsolutePath().normalize();
    if (!normalized.startsWith(scope)) {
      throw new ValidationException(
          "Source file " + normalized + " is outside of the scope " + scope);
    }
  }

  private static <T> T join(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (RuntimeException e) {
      throw ExceptionUtil.asCitationException(e, "Citation operation failed");
    }
  }

  private static ThreadFactory daemonThreads() {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread t = new Thread(runnable, "citations-parser-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
