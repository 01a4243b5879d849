package com.gentoro.citations.extraction;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.citations.document.ParsedFileCache;
import com.gentoro.citations.model.Link;
import com.gentoro.citations.model.LinkFactory;
import com.gentoro.citations.model.ValidationVerdict;
import com.gentoro.citations.parser.FlexmarkMarkdownParser;
import com.gentoro.citations.parser.MarkdownParser;
import com.gentoro.citations.utility.JacksonUtility;
import com.gentoro.citations.validation.CitationValidator;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ContentExtractorTest {

  private static final String REFERENCE =
      "# Reference\n\n## Section A\nalpha\n\n## Section B\nbeta ^blk\n";

  private Path tempDir;
  private Map<Path, Integer> parseCounts;
  private CitationValidator validator;
  private ContentExtractor extractor;

  @BeforeEach
  void setUp() throws Exception {
    tempDir = Files.createTempDirectory("content_extractor_test_");
    Files.writeString(tempDir.resolve("reference.md"), REFERENCE);

    parseCounts = new ConcurrentHashMap<>();
    FlexmarkMarkdownParser flexmark = new FlexmarkMarkdownParser(Runnable::run);
    MarkdownParser counting =
        file -> {
          parseCounts.merge(file, 1, Integer::sum);
          return flexmark.parseFile(file);
        };
    ParsedFileCache cache = new ParsedFileCache(counting);
    validator = new CitationValidator(cache);
    extractor = new ContentExtractor(cache);
  }

  @AfterEach
  void tearDown() throws Exception {
    // Best-effort cleanup
    try (var s = Files.walk(tempDir)) {
      s.sorted((a, b) -> b.compareTo(a))
          .forEach(
              p -> {
                try {
                  Files.deleteIfExists(p);
                } catch (Exception ignored) {
                }
              });
    }
  }

  private OutgoingLinksExtractedContent extract(String markdown, ExtractionFlags flags)
      throws Exception {
    Path source = tempDir.resolve("source.md");
    Files.writeString(source, markdown);
    List<Link> links = validator.validateFile(source).join().links();
    return extractor.extractContent(links, flags).join();
  }

  @Test
  @DisplayName("Five links to one section parse the target once and collapse into one block")
  void duplicateLinksCollapse() throws Exception {
    StringBuilder md = new StringBuilder();
    for (int i = 1; i <= 5; i++) {
      md.append("- [ref ").append(i).append("](reference.md#Section A)\n");
    }

    OutgoingLinksExtractedContent out = extract(md.toString(), ExtractionFlags.defaults());

    assertEquals(1, parseCounts.get(tempDir.resolve("reference.md").toAbsolutePath().normalize()));
    assertEquals(1, out.extractedContentBlocks().size());
    String contentId = ContentIds.of("## Section A\nalpha\n\n");
    ExtractedContentBlock block = out.extractedContentBlocks().get(contentId);
    assertNotNull(block);
    assertEquals("## Section A\nalpha\n\n", block.content());
    assertEquals(block.content().length(), block.contentLength());
    assertEquals(5, block.sourceLinks().size());
    assertEquals(1, block.sourceLinks().get(0).sourceLine());
    assertEquals("[ref 5](reference.md#Section A)", block.sourceLinks().get(4).rawSourceLink());

    ExtractionStats stats = out.stats();
    assertEquals(5, stats.totalLinks());
    assertEquals(1, stats.uniqueContent());
    assertEquals(4, stats.duplicateContentDetected());
    assertEquals(5, stats.extractedLinks());
    assertEquals(4 * block.contentLength(), stats.charactersSaved());
    assertEquals(4 * (block.contentLength() / 4), stats.tokensSaved());
    assertEquals(0.8, stats.compressionRatio(), 1e-9);
    for (ProcessedLink p : out.outgoingLinksReport().processedLinks()) {
      assertEquals(ProcessingStatus.SUCCESS, p.status());
      assertEquals(contentId, p.contentId());
      assertNull(p.failureDetails());
    }
  }

  @Test
  @DisplayName("Token estimate is a quarter of the characters and at least one for any text")
  void estimateTokens() {
    assertEquals(0, ContentExtractor.estimateTokens(null));
    assertEquals(0, ContentExtractor.estimateTokens(""));
    assertEquals(1, ContentExtractor.estimateTokens("abc"));
    assertEquals(2, ContentExtractor.estimateTokens("abcdefgh"));
  }

  @Test
  @DisplayName("A heading addressed by its explicit id extracts that heading's section")
  void explicitHeadingId() throws Exception {
    Files.writeString(
        tempDir.resolve("ids.md"), "# Top\n\n## Setup {#setup-id}\nsteps\n\n## Next\nmore\n");

    OutgoingLinksExtractedContent out =
        extract("[s](ids.md#setup-id)\n", ExtractionFlags.defaults());

    ProcessedLink processed = out.outgoingLinksReport().processedLinks().get(0);
    assertEquals(ProcessingStatus.SUCCESS, processed.status());
    assertEquals(
        "## Setup {#setup-id}\nsteps\n\n", processed.successDetails().extractedContent());
  }

  @Test
  @DisplayName("Missing target is skipped and the block map holds only the size field")
  void missingTargetSkipped() throws Exception {
    OutgoingLinksExtractedContent out =
        extract("[x](missing.md#Intro)\n", ExtractionFlags.defaults());

    ProcessedLink p = out.outgoingLinksReport().processedLinks().get(0);
    assertEquals(ProcessingStatus.SKIPPED, p.status());
    assertEquals(
        "Link failed validation: File not found: missing.md", p.failureDetails().reason());
    assertNull(p.contentId());
    assertNull(p.successDetails());
    assertEquals(0, out.extractedContentBlocks().size());
    assertEquals(2, out.extractedContentBlocks().getTotalContentCharacterLength());

    JsonNode json = JacksonUtility.getJsonMapper().readTree(JacksonUtility.toJson(out));
    JsonNode blocks = json.get("extractedContentBlocks");
    assertEquals(1, blocks.size());
    assertEquals(2, blocks.get("_totalContentCharacterLength").asInt());
    assertEquals("skipped", json.at("/outgoingLinksReport/processedLinks/0/status").asText());
  }

  @Test
  @DisplayName("Size field comes first and equals the compact JSON length of the blocks")
  void totalContentCharacterLength() throws Exception {
    OutgoingLinksExtractedContent out =
        extract("[a](reference.md#Section B)\n", ExtractionFlags.defaults());

    ExtractedContentBlocks blocks = out.extractedContentBlocks();
    assertEquals(
        JacksonUtility.toCompactJson(blocks.getBlocks()).length(),
        blocks.getTotalContentCharacterLength());
    JsonNode json = JacksonUtility.getJsonMapper().readTree(JacksonUtility.toJson(blocks));
    assertEquals("_totalContentCharacterLength", json.fieldNames().next());
  }

  @Test
  @DisplayName("Full-file links need the full-files flag")
  void fullFileLinks() throws Exception {
    OutgoingLinksExtractedContent without =
        extract("[whole](reference.md)\n", ExtractionFlags.defaults());
    ProcessedLink skipped = without.outgoingLinksReport().processedLinks().get(0);
    assertEquals(ProcessingStatus.SKIPPED, skipped.status());
    assertEquals(
        "Link not eligible: Full-file link ineligible without full-files flag",
        skipped.failureDetails().reason());

    OutgoingLinksExtractedContent with =
        extract("[whole](reference.md)\n", ExtractionFlags.withFullFiles());
    ProcessedLink extracted = with.outgoingLinksReport().processedLinks().get(0);
    assertEquals(ProcessingStatus.SUCCESS, extracted.status());
    assertEquals(REFERENCE, extracted.successDetails().extractedContent());
    assertEquals(REFERENCE, with.extractedContentBlocks().get(extracted.contentId()).content());
  }

  @Test
  @DisplayName("Warning links are excluded from extraction")
  void warningLinksSkipped() throws Exception {
    OutgoingLinksExtractedContent out =
        extract("[a](reference.md#section-a)\n", ExtractionFlags.defaults());

    ProcessedLink p = out.outgoingLinksReport().processedLinks().get(0);
    assertEquals(ProcessingStatus.SKIPPED, p.status());
    assertTrue(p.failureDetails().reason().startsWith("Link validation warning: "));
  }

  @Test
  @DisplayName("Block, internal and marker-controlled links")
  void blockInternalAndMarkers() throws Exception {
    OutgoingLinksExtractedContent out =
        extract(
            "[b](reference.md#^blk)\n"
                + "[s](reference.md#Section A) %% stop-extract-link %%\n"
                + "[f](reference.md) <!-- force-extract -->\n"
                + "[i](#Local)\n"
                + "\n"
                + "# Local\n"
                + "local text\n",
            ExtractionFlags.defaults());

    List<ProcessedLink> processed = out.outgoingLinksReport().processedLinks();
    assertEquals("beta ^blk", processed.get(0).successDetails().extractedContent());
    assertEquals(ProcessingStatus.SKIPPED, processed.get(1).status());
    assertEquals(
        "Link not eligible: stop-extract-link marker prevents extraction",
        processed.get(1).failureDetails().reason());
    assertEquals(REFERENCE, processed.get(2).successDetails().extractedContent());
    assertEquals(
        "force-extract overrides defaults", processed.get(2).successDetails().decisionReason());
    assertEquals("# Local\nlocal text\n", processed.get(3).successDetails().extractedContent());
    assertEquals(3, out.stats().extractedLinks());
    assertEquals(1, out.stats().skippedLinks());
  }

  @Test
  @DisplayName("A retrieval failure is reported per link and the batch continues")
  void extractionErrorDoesNotAbort() {
    LinkFactory factory = new LinkFactory(tempDir);
    Link missingHeading =
        factory.createHeaderLink("reference.md", "Nope").withValidation(ValidationVerdict.valid());
    Link good =
        factory
            .createHeaderLink("reference.md", "Section B")
            .withValidation(ValidationVerdict.valid());
    Link unvalidated = factory.createHeaderLink("reference.md", "Section A");

    OutgoingLinksExtractedContent out =
        extractor
            .extractContent(List.of(missingHeading, good, unvalidated), ExtractionFlags.defaults())
            .join();

    List<ProcessedLink> processed = out.outgoingLinksReport().processedLinks();
    assertEquals(ProcessingStatus.ERROR, processed.get(0).status());
    assertEquals(
        "Extraction failed: Heading not found: Nope", processed.get(0).failureDetails().reason());
    assertEquals(ProcessingStatus.SUCCESS, processed.get(1).status());
    assertEquals("## Section B\nbeta ^blk\n", processed.get(1).successDetails().extractedContent());
    assertEquals("Link has not been validated", processed.get(2).failureDetails().reason());
    assertEquals(1, out.stats().failedLinks());
  }

  @Test
  @DisplayName("No links gives empty output with zero ratio")
  void emptyInput() {
    OutgoingLinksExtractedContent out =
        extractor.extractContent(List.of(), ExtractionFlags.defaults()).join();

    assertEquals(0, out.stats().totalLinks());
    assertEquals(0.0, out.stats().compressionRatio());
    assertEquals(2, out.extractedContentBlocks().getTotalContentCharacterLength());
  }
}
