package com.gentoro.citations.parser;

import com.gentoro.citations.model.AnchorType;
import com.gentoro.citations.model.ExtractionMarker;
import com.gentoro.citations.model.Link;
import com.gentoro.citations.model.LinkScope;
import com.gentoro.citations.model.LinkSource;
import com.gentoro.citations.model.LinkTarget;
import com.gentoro.citations.model.LinkType;
import com.gentoro.citations.utility.StringUtility;
import com.vladsch.flexmark.ast.LinkRef;
import com.vladsch.flexmark.ast.Reference;
import com.vladsch.flexmark.util.ast.Document;
import com.vladsch.flexmark.util.ast.Node;
import java.io.File;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line based link scanner.
 *
 * <p>Recognizes {@code [text](path#anchor)} (anchors may contain spaces, colons and two levels of
 * nested parentheses), {@code [cite: path]} and the wiki forms {@code [[path#anchor|alias]]}.
 * Links on fenced-code lines or inside inline code spans are ignored, as are URLs with a scheme
 * and images. Reference-style links ({@code [text][ref]} with a {@code [ref]: path#anchor}
 * definition) are taken from the flexmark tree, where the references are already resolved.
 */
final class LinkExtractor {
  private static final Pattern MARKDOWN_LINK =
      Pattern.compile("\\[([^\\]]+)\\]\\(((?:[^()]|\\((?:[^()]|\\([^)]*\\))*\\))+)\\)");
  private static final Pattern CITE_LINK = Pattern.compile("\\[cite:\\s*([^\\]]+)\\]");
  private static final Pattern WIKI_LINK =
      Pattern.compile("\\[\\[([^\\[\\]|#]*)(?:#([^\\[\\]|]+))?(?:\\|([^\\[\\]]+))?\\]\\]");
  private static final Pattern URI_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:");
  private static final Pattern LINK_TITLE = Pattern.compile("\\s+\"[^\"]*\"$");
  private static final Pattern MARKER = Pattern.compile("^\\s*(%%(.+?)%%|<!--\\s*(.+?)\\s*-->)");

  private final Path sourceFile;
  private final Path sourceDir;

  LinkExtractor(Path sourceFile) {
    this.sourceFile = sourceFile.toAbsolutePath().normalize();
    Path parent = this.sourceFile.getParent();
    this.sourceDir = parent == null ? this.sourceFile : parent;
  }

  List<Link> extract(SourceLines lines, Document document) {
    List<Link> links = new ArrayList<>();
    for (int i = 0; i < lines.size(); i++) {
      if (lines.isFenced(i)) continue;
      links.addAll(extractFromLine(lines.get(i), i + 1));
    }
    if (document == null) return links;

    Set<String> seen = new HashSet<>();
    for (Link link : links) {
      seen.add(link.line() + ":" + link.column());
    }
    String text = document.getChars().toString();
    List<Link> merged = new ArrayList<>(links);
    for (Link link : extractReferenceLinks(document, lines, text)) {
      if (seen.add(link.line() + ":" + link.column())) merged.add(link);
    }
    merged.sort(Comparator.comparingInt(Link::line).thenComparingInt(Link::column));
    return merged;
  }

  /** Defined {@link LinkRef} nodes; code spans and code blocks never contain them. */
  private List<Link> extractReferenceLinks(Document document, SourceLines lines, String text) {
    List<Link> found = new ArrayList<>();
    for (Node node : document.getDescendants()) {
      if (!(node instanceof LinkRef ref) || !ref.isDefined()) continue;
      Reference reference = ref.getReferenceNode(document);
      if (reference == null) continue;
      String destination = destination(reference.getUrl().toString());
      if (destination.isEmpty() || URI_SCHEME.matcher(destination).find()) continue;

      int hash = destination.indexOf('#');
      String rawPath = hash < 0 ? destination : destination.substring(0, hash);
      String anchor = hash < 0 ? null : destination.substring(hash + 1);
      if (rawPath.isEmpty() && (anchor == null || anchor.isEmpty())) continue;

      int start = ref.getStartOffset();
      int lineIndex = ref.getStartLineNumber();
      int column = start - (text.lastIndexOf('\n', start - 1) + 1);
      String line = lineIndex < lines.size() ? lines.get(lineIndex) : "";
      String fullMatch = ref.getChars().toString();
      String label =
          ref.getText().isBlank() ? ref.getReference().toString() : ref.getText().toString();
      int end = Math.min(line.length(), column + fullMatch.length());
      found.add(
          build(
              LinkType.MARKDOWN,
              rawPath,
              anchor,
              label,
              fullMatch,
              line,
              lineIndex + 1,
              column,
              end));
    }
    return found;
  }

  private List<Link> extractFromLine(String line, int lineNumber) {
    List<Link> found = new ArrayList<>();

    Matcher m = MARKDOWN_LINK.matcher(line);
    while (m.find()) {
      if (SourceLines.isInsideInlineCode(line, m.start())) continue;
      if (m.start() > 0 && line.charAt(m.start() - 1) == '!') continue;
      String destination = destination(m.group(2));
      if (destination.isEmpty() || URI_SCHEME.matcher(destination).find()) continue;

      int hash = destination.indexOf('#');
      String rawPath = hash < 0 ? destination : destination.substring(0, hash);
      String anchor = hash < 0 ? null : destination.substring(hash + 1);
      if (rawPath.isEmpty() && (anchor == null || anchor.isEmpty())) continue;
      found.add(build(LinkType.MARKDOWN, rawPath, anchor, m.group(1), line, lineNumber, m));
    }

    m = CITE_LINK.matcher(line);
    while (m.find()) {
      if (SourceLines.isInsideInlineCode(line, m.start())) continue;
      // [cite: x](...) is an ordinary markdown link
      if (m.end() < line.length() && line.charAt(m.end()) == '(') continue;
      String rawPath = m.group(1).trim();
      String text = "cite: " + rawPath;
      found.add(build(LinkType.MARKDOWN, rawPath, null, text, line, lineNumber, m));
    }

    m = WIKI_LINK.matcher(line);
    while (m.find()) {
      if (SourceLines.isInsideInlineCode(line, m.start())) continue;
      String rawPath = m.group(1).trim();
      String anchor = m.group(2);
      if (rawPath.isEmpty() && anchor == null) continue;
      String inner = m.group().substring(2, m.group().length() - 2);
      String text = m.group(3) != null ? m.group(3) : inner;
      found.add(build(LinkType.WIKI, rawPath, anchor, text, line, lineNumber, m));
    }

    found.sort(Comparator.comparingInt(Link::column));
    return found;
  }

  private Link build(
      LinkType linkType,
      String rawPath,
      String anchor,
      String text,
      String line,
      int lineNumber,
      Matcher match) {
    String fullMatch = match.group();
    return build(
        linkType, rawPath, anchor, text, fullMatch, line, lineNumber, match.start(), match.end());
  }

  private Link build(
      LinkType linkType,
      String rawPath,
      String anchor,
      String text,
      String fullMatch,
      String line,
      int lineNumber,
      int column,
      int end) {
    if (anchor != null && anchor.isEmpty()) anchor = null;
    boolean internal = rawPath.isEmpty();
    LinkTarget.TargetPath path =
        internal ? LinkTarget.TargetPath.NONE : resolve(rawPath, linkType == LinkType.WIKI);
    return new Link(
        linkType,
        internal ? LinkScope.INTERNAL : LinkScope.CROSS_DOCUMENT,
        AnchorType.forFragment(anchor),
        LinkSource.of(sourceFile.toString()),
        new LinkTarget(path, anchor),
        text,
        fullMatch,
        lineNumber,
        column,
        markersAfter(line, end),
        null);
  }

  private LinkTarget.TargetPath resolve(String rawPath, boolean appendMarkdownExtension) {
    String decoded = StringUtility.decodePercent(rawPath);
    if (appendMarkdownExtension && !hasExtension(decoded)) {
      decoded = decoded + ".md";
    }
    Path absolute;
    try {
      absolute = sourceDir.resolve(decoded).normalize();
    } catch (InvalidPathException e) {
      // not a usable path; keep the link so that validation reports it
      return new LinkTarget.TargetPath(rawPath, sourceDir + File.separator + rawPath, rawPath);
    }
    String relative;
    try {
      relative = sourceDir.relativize(absolute).toString().replace('\\', '/');
    } catch (IllegalArgumentException e) {
      relative = absolute.toString();
    }
    return new LinkTarget.TargetPath(rawPath, absolute.toString(), relative);
  }

  private static boolean hasExtension(String path) {
    int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    return path.lastIndexOf('.') > slash + 1;
  }

  private static String destination(String raw) {
    String destination = LINK_TITLE.matcher(raw.trim()).replaceFirst("");
    if (destination.length() >= 2 && destination.startsWith("<") && destination.endsWith(">")) {
      destination = destination.substring(1, destination.length() - 1);
    }
    return destination.trim();
  }

  /** Every {@code %%text%%} or {@code <!-- text -->} directly following the link. */
  private static List<ExtractionMarker> markersAfter(String line, int linkEnd) {
    List<ExtractionMarker> markers = new ArrayList<>();
    String rest = line.substring(linkEnd);
    Matcher marker = MARKER.matcher(rest);
    while (marker.find()) {
      String inner = marker.group(2) != null ? marker.group(2) : marker.group(3);
      markers.add(new ExtractionMarker(marker.group(1), inner.trim()));
      rest = rest.substring(marker.end());
      marker = MARKER.matcher(rest);
    }
    return markers;
  }
}
