package com.gentoro.citations.document;

import com.vladsch.flexmark.util.ast.Node;
import java.util.ArrayList;
import java.util.List;

/** Flattens a flexmark node tree depth-first, children before following siblings. */
public final class TokenFlattener {
  private TokenFlattener() {}

  /** A node together with its nesting depth; direct children of the root have depth 0. */
  public record FlatToken(Node node, int depth) {}

  public static List<FlatToken> flatten(Node root) {
    List<FlatToken> out = new ArrayList<>();
    walk(root, 0, out);
    return out;
  }

  private static void walk(Node parent, int depth, List<FlatToken> out) {
    Node node = parent.getFirstChild();
    while (node != null) {
      out.add(new FlatToken(node, depth));
      walk(node, depth + 1, out);
      node = node.getNext();
    }
  }
}
