package com.gentoro.citations.model;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.citations.exception.ValidationException;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LinkFactoryTest {

  private final Path workingDirectory = Path.of("work").toAbsolutePath().normalize();
  private final LinkFactory factory = new LinkFactory(workingDirectory);

  @Test
  @DisplayName("Header link points at the heading of a file relative to the working directory")
  void headerLink() {
    Link link = factory.createHeaderLink("docs/guide.md", "Section A");

    assertEquals(AnchorType.HEADER, link.anchorType());
    assertEquals(LinkScope.CROSS_DOCUMENT, link.scope());
    assertEquals("Section A", link.target().anchor());
    assertEquals("docs/guide.md", link.target().path().raw());
    assertEquals(
        workingDirectory.resolve("docs/guide.md").toString(), link.target().path().absolute());
    assertEquals("docs/guide.md", link.target().path().relative());
    assertEquals(workingDirectory.toString(), link.source().path().absolute());
    assertEquals("[Section A](docs/guide.md#Section A)", link.fullMatch());
    assertEquals(0, link.line());
    assertNull(link.validation());
  }

  @Test
  @DisplayName("File link has no anchor and uses the file name as text")
  void fileLink() {
    Link link = factory.createFileLink("docs/guide.md");

    assertNull(link.anchorType());
    assertNull(link.target().anchor());
    assertEquals("guide.md", link.text());
    assertEquals("[guide.md](docs/guide.md)", link.fullMatch());
    assertTrue(link.extractionMarkers().isEmpty());
  }

  @Test
  @DisplayName("Blank inputs are rejected")
  void blankInputs() {
    assertThrows(ValidationException.class, () -> factory.createHeaderLink(" ", "A"));
    assertThrows(ValidationException.class, () -> factory.createHeaderLink("a.md", ""));
    assertThrows(ValidationException.class, () -> factory.createFileLink(null));
  }

  @Test
  @DisplayName("withValidation returns an enriched copy and leaves the source link untouched")
  void withValidationCopies() {
    Link link = factory.createFileLink("a.md");
    Link validated = link.withValidation(ValidationVerdict.valid());

    assertNull(link.validation());
    assertEquals(ValidationStatus.VALID, validated.validation().status());
    assertEquals(link.fullMatch(), validated.fullMatch());
  }

  @Test
  @DisplayName("anchorType must agree with the presence of an anchor")
  void anchorInvariant() {
    LinkTarget noAnchor = new LinkTarget(LinkTarget.TargetPath.NONE, null);
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new Link(
                LinkType.WIKI,
                LinkScope.INTERNAL,
                AnchorType.HEADER,
                LinkSource.of("/a.md"),
                noAnchor,
                "x",
                "[[x]]",
                1,
                0,
                null,
                null));
  }

  @Test
  @DisplayName("Fragment shape determines the anchor type")
  void anchorTypeForFragment() {
    assertEquals(AnchorType.BLOCK, AnchorType.forFragment("^FR1"));
    assertEquals(AnchorType.HEADER, AnchorType.forFragment("Intro"));
    assertNull(AnchorType.forFragment(""));
    assertNull(AnchorType.forFragment(null));
    assertEquals(LinkScope.CROSS_DOCUMENT, LinkScope.fromValue("cross-document"));
  }
}
