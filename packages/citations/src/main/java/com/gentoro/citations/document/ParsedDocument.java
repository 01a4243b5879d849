package com.gentoro.citations.document;

import com.gentoro.citations.model.Anchor;
import com.gentoro.citations.model.AnchorType;
import com.gentoro.citations.model.Heading;
import com.gentoro.citations.model.Link;
import com.gentoro.citations.parser.ParserOutput;
import com.gentoro.citations.utility.StringUtility;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Immutable query facade over one parsed markdown file.
 *
 * <p>Instances are shared by every caller that resolves the same path through {@link
 * ParsedFileCache}, so nothing here mutates the underlying {@link ParserOutput}.
 */
public final class ParsedDocument {
  private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");
  private static final double SIMILARITY_THRESHOLD = 0.3;

  private final ParserOutput data;
  private final List<TokenFlattener.FlatToken> flatTokens;

  public ParsedDocument(ParserOutput data) {
    this.data = data;
    this.flatTokens = data.tokens() == null ? List.of() : TokenFlattener.flatten(data.tokens());
  }

  public String getFilePath() {
    return data.filePath();
  }

  public List<Link> getLinks() {
    return data.links();
  }

  public List<Anchor> getAnchors() {
    return data.anchors();
  }

  public List<Heading> getHeadings() {
    return data.headings();
  }

  /** Distinct anchor ids in document order. */
  public Set<String> getAnchorIds() {
    return data.anchors().stream()
        .map(Anchor::id)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  public boolean hasAnchor(String id) {
    return findAnchor(id).isPresent();
  }

  public Optional<Anchor> findAnchor(String id) {
    return data.anchors().stream().filter(a -> a.id().equals(id)).findFirst();
  }

  /** Up to {@code limit} anchor ids whose similarity to {@code anchor} is above 0.3, best first. */
  public List<String> findSimilarAnchors(String anchor, int limit) {
    List<Scored> scored = new ArrayList<>();
    for (String id : getAnchorIds()) {
      double score = StringUtility.similarity(anchor, id);
      if (score > SIMILARITY_THRESHOLD) {
        scored.add(new Scored(id, score));
      }
    }
    return scored.stream()
        .sorted(Comparator.comparingDouble(Scored::score).reversed())
        .limit(limit)
        .map(Scored::id)
        .toList();
  }

  /**
   * Raw source text of the section opened by the first heading whose text equals {@code
   * headingText}. The section runs up to the next heading of the same or a higher level (a lower
   * or equal level number), or to the end of the file, so nested subsections, code fences and
   * tables are kept byte for byte.
   */
  public Optional<String> extractSection(String headingText) {
    return sectionOf(h -> h.getText().toString().equals(headingText));
  }

  /** Section opened by the heading on 1-based {@code line}, as located by its header anchor. */
  public Optional<String> extractSectionAt(int line) {
    return sectionOf(h -> h.getStartLineNumber() + 1 == line);
  }

  private Optional<String> sectionOf(Predicate<com.vladsch.flexmark.ast.Heading> matcher) {
    int targetIndex = -1;
    com.vladsch.flexmark.ast.Heading target = null;
    for (int i = 0; i < flatTokens.size(); i++) {
      if (flatTokens.get(i).node() instanceof com.vladsch.flexmark.ast.Heading h
          && matcher.test(h)) {
        target = h;
        targetIndex = i;
        break;
      }
    }
    if (target == null) return Optional.empty();

    String content = data.content();
    int end = content.length();
    for (int i = targetIndex + 1; i < flatTokens.size(); i++) {
      if (flatTokens.get(i).node() instanceof com.vladsch.flexmark.ast.Heading next
          && next.getLevel() <= target.getLevel()) {
        end = next.getStartOffset();
        break;
      }
    }
    return Optional.of(content.substring(target.getStartOffset(), end));
  }

  /** The single source line carrying the block anchor {@code anchorId}. */
  public Optional<String> extractBlock(String anchorId) {
    Optional<Anchor> anchor =
        data.anchors().stream()
            .filter(a -> a.anchorType() == AnchorType.BLOCK && a.id().equals(anchorId))
            .findFirst();
    if (anchor.isEmpty()) return Optional.empty();

    String[] lines = LINE_BREAK.split(data.content(), -1);
    int index = anchor.get().line() - 1;
    if (index < 0 || index >= lines.length) return Optional.empty();
    return Optional.of(lines[index]);
  }

  public String extractFullContent() {
    return data.content();
  }

  private static record Scored(String id, double score) {}
}
