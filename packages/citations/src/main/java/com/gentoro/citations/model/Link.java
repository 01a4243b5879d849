package com.gentoro.citations.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Objects;

/**
 * A citation found in a markdown document.
 *
 * <p>Links are immutable. The parser never sets {@link #validation()}; the validator attaches a
 * verdict through {@link #withValidation(ValidationVerdict)}, which returns an enriched copy and
 * leaves the cached parse result untouched.
 *
 * @param line 1-based line of the link in its source document, 0 for synthetic links
 * @param column 0-based column where the link starts
 */
public record Link(
    LinkType linkType,
    LinkScope scope,
    AnchorType anchorType,
    LinkSource source,
    LinkTarget target,
    String text,
    String fullMatch,
    int line,
    int column,
    List<ExtractionMarker> extractionMarkers,
    ValidationVerdict validation) {

  public Link {
    Objects.requireNonNull(linkType, "linkType");
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
    if ((target.anchor() == null) != (anchorType == null)) {
      throw new IllegalArgumentException(
          "anchorType must be set exactly when the target has an anchor: " + fullMatch);
    }
    extractionMarkers = extractionMarkers == null ? List.of() : List.copyOf(extractionMarkers);
  }

  /** Copy of this link carrying the given validation verdict. */
  public Link withValidation(ValidationVerdict verdict) {
    return new Link(
        linkType,
        scope,
        anchorType,
        source,
        target,
        text,
        fullMatch,
        line,
        column,
        extractionMarkers,
        verdict);
  }

  /** True when one of the markers following the link has exactly this inner text. */
  public boolean hasMarker(String innerText) {
    for (ExtractionMarker marker : extractionMarkers) {
      if (marker.innerText().equals(innerText)) {
        return true;
      }
    }
    return false;
  }

  @JsonIgnore
  public boolean isInternal() {
    return scope == LinkScope.INTERNAL;
  }
}
