package com.gentoro.citations.model;

import java.util.Objects;

/**
 * Named position inside a document that a link fragment can target.
 *
 * <p>Header anchors use the heading text (or an explicit {@code {#id}}) as {@code id} and report
 * column 0. Block anchors use the caret-less identifier of a {@code ^id} marker, or the inner text
 * of an {@code ==**text**==} emphasis marker.
 */
public record Anchor(
    AnchorType anchorType, String id, String rawText, String fullMatch, int line, int column) {

  public Anchor {
    Objects.requireNonNull(anchorType, "anchorType");
    Objects.requireNonNull(id, "id");
  }

  public static Anchor header(String id, String rawText, String fullMatch, int line) {
    return new Anchor(AnchorType.HEADER, id, rawText, fullMatch, line, 0);
  }

  public static Anchor block(String id, String fullMatch, int line, int column) {
    return new Anchor(AnchorType.BLOCK, id, null, fullMatch, line, column);
  }
}
