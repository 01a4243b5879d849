package com.gentoro.citations.parser;

import com.gentoro.citations.model.Heading;
import com.vladsch.flexmark.util.ast.Node;
import java.util.ArrayList;
import java.util.List;

/** Collects heading nodes, ATX and setext, in document order. */
final class HeadingExtractor {
  private HeadingExtractor() {}

  static List<com.vladsch.flexmark.ast.Heading> headingNodes(Node root) {
    List<com.vladsch.flexmark.ast.Heading> out = new ArrayList<>();
    collect(root, out);
    return out;
  }

  static List<Heading> extract(List<com.vladsch.flexmark.ast.Heading> nodes) {
    List<Heading> headings = new ArrayList<>(nodes.size());
    for (com.vladsch.flexmark.ast.Heading h : nodes) {
      headings.add(new Heading(h.getLevel(), h.getText().toString(), h.getChars().toString()));
    }
    return headings;
  }

  private static void collect(Node node, List<com.vladsch.flexmark.ast.Heading> out) {
    Node child = node.getFirstChild();
    while (child != null) {
      if (child instanceof com.vladsch.flexmark.ast.Heading h) {
        out.add(h);
      }
      collect(child, out);
      child = child.getNext();
    }
  }
}
