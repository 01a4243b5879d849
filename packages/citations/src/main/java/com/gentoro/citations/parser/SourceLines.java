package com.gentoro.citations.parser;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/** Line-oriented view over a markdown file, shared by the regex based extractors. */
final class SourceLines {
  private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");

  private final String[] lines;
  private final Set<Integer> fencedLines;

  SourceLines(String content) {
    this.lines = LINE_BREAK.split(content, -1);
    this.fencedLines = fencedLineIndexes(lines);
  }

  int size() {
    return lines.length;
  }

  /** Line by 0-based index. */
  String get(int index) {
    return lines[index];
  }

  /** True for fence delimiters and every line between them. */
  boolean isFenced(int index) {
    return fencedLines.contains(index);
  }

  private static Set<Integer> fencedLineIndexes(String[] lines) {
    Set<Integer> fenced = new HashSet<>();
    boolean inFence = false;
    for (int i = 0; i < lines.length; i++) {
      String trimmed = lines[i].trim();
      if (trimmed.startsWith("```") || trimmed.startsWith("~~~")) {
        fenced.add(i);
        inFence = !inFence;
      } else if (inFence) {
        fenced.add(i);
      }
    }
    return fenced;
  }

  /** Whether {@code position} sits inside an inline code span, counting unescaped backticks. */
  static boolean isInsideInlineCode(String line, int position) {
    boolean inCode = false;
    for (int i = 0; i < line.length() && i < position; i++) {
      if (line.charAt(i) == '`' && (i == 0 || line.charAt(i - 1) != '\\')) {
        inCode = !inCode;
      }
    }
    return inCode;
  }
}
