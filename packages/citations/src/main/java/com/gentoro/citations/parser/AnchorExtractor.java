package com.gentoro.citations.parser;

import com.gentoro.citations.model.Anchor;
import com.gentoro.citations.utility.StringUtility;
import com.vladsch.flexmark.ast.Heading;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the positions a link fragment can target.
 *
 * <p>Block anchors come from {@code ^id} markers (at the end of a line or inline) and from
 * {@code ==**text**==} emphasis. Header anchors come from the flexmark heading nodes: the literal
 * heading text plus its Obsidian-style encoded form, or the id of an explicit {@code {#id}} suffix.
 * Lines inside fenced code are ignored.
 */
final class AnchorExtractor {
  private static final Pattern TRAILING_CARET = Pattern.compile("\\^([a-zA-Z0-9\\-_]+)$");
  private static final Pattern INLINE_CARET = Pattern.compile("\\^([A-Za-z0-9-]+)");
  private static final Pattern SEMVER_TAIL = Pattern.compile("^\\.\\d");
  private static final Pattern EMPHASIS = Pattern.compile("==\\*\\*([^*]+)\\*\\*==");
  private static final Pattern EXPLICIT_ID = Pattern.compile("^(.+?)\\s*\\{#([^}]+)\\}$");

  private AnchorExtractor() {}

  static List<Anchor> extract(SourceLines lines, List<Heading> headingNodes) {
    List<Anchor> anchors = new ArrayList<>();
    for (int i = 0; i < lines.size(); i++) {
      if (lines.isFenced(i)) continue;
      collectBlockAnchors(lines.get(i), i + 1, anchors);
    }
    for (Heading node : headingNodes) {
      collectHeaderAnchors(node, lines, anchors);
    }
    return anchors;
  }

  private static void collectBlockAnchors(String line, int lineNumber, List<Anchor> anchors) {
    int trailingStart = -1;
    Matcher trailing = TRAILING_CARET.matcher(line);
    if (trailing.find()) {
      trailingStart = trailing.start();
      anchors.add(Anchor.block(trailing.group(1), trailing.group(), lineNumber, trailingStart));
    }

    Matcher caret = INLINE_CARET.matcher(line);
    while (caret.find()) {
      if (caret.start() == trailingStart || line.endsWith(caret.group())) continue;
      if (SEMVER_TAIL.matcher(line.substring(caret.end())).find()) continue;
      anchors.add(Anchor.block(caret.group(1), caret.group(), lineNumber, caret.start()));
    }

    Matcher emphasis = EMPHASIS.matcher(line);
    while (emphasis.find()) {
      anchors.add(Anchor.block(emphasis.group(1), emphasis.group(), lineNumber, emphasis.start()));
    }
  }

  private static void collectHeaderAnchors(Heading node, SourceLines lines, List<Anchor> anchors) {
    String text = node.getText().toString();
    if (text.isBlank()) return;
    int index = node.getStartLineNumber();
    int lineNumber = index + 1;
    String fullMatch = index < lines.size() ? lines.get(index) : node.getChars().toString();

    Matcher explicit = EXPLICIT_ID.matcher(text);
    if (explicit.matches()) {
      String title = explicit.group(1).trim();
      anchors.add(Anchor.header(explicit.group(2), title, fullMatch, lineNumber));
      return;
    }
    anchors.add(Anchor.header(text, text, fullMatch, lineNumber));
    String encoded = StringUtility.encodeHeadingReference(text);
    if (!encoded.equals(text)) {
      anchors.add(Anchor.header(encoded, text, fullMatch, lineNumber));
    }
  }
}
