package com.gentoro.citations.model;

import com.gentoro.citations.exception.ValidationException;
import java.nio.file.Path;

/**
 * Builds unvalidated synthetic links for extraction requests that do not originate from a
 * document, such as "extract this heading from that file".
 *
 * <p>Synthetic links report the working directory as their source and line/column 0.
 */
public final class LinkFactory {
  private final Path workingDirectory;

  public LinkFactory() {
    this(Path.of("").toAbsolutePath());
  }

  public LinkFactory(Path workingDirectory) {
    this.workingDirectory = workingDirectory.toAbsolutePath().normalize();
  }

  public Link createHeaderLink(String targetPath, String headingText) {
    requireText(targetPath, "targetPath");
    requireText(headingText, "headingText");
    return new Link(
        LinkType.MARKDOWN,
        LinkScope.CROSS_DOCUMENT,
        AnchorType.HEADER,
        LinkSource.of(workingDirectory.toString()),
        new LinkTarget(targetPathOf(targetPath), headingText),
        headingText,
        "[" + headingText + "](" + targetPath + "#" + headingText + ")",
        0,
        0,
        null,
        null);
  }

  public Link createFileLink(String targetPath) {
    requireText(targetPath, "targetPath");
    Path fileName = Path.of(targetPath).getFileName();
    String text = fileName == null ? targetPath : fileName.toString();
    return new Link(
        LinkType.MARKDOWN,
        LinkScope.CROSS_DOCUMENT,
        null,
        LinkSource.of(workingDirectory.toString()),
        new LinkTarget(targetPathOf(targetPath), null),
        text,
        "[" + text + "](" + targetPath + ")",
        0,
        0,
        null,
        null);
  }

  private LinkTarget.TargetPath targetPathOf(String raw) {
    Path absolute = workingDirectory.resolve(raw).normalize();
    String relative = workingDirectory.relativize(absolute).toString().replace('\\', '/');
    return new LinkTarget.TargetPath(raw, absolute.toString(), relative);
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(name + " cannot be empty");
    }
  }
}
