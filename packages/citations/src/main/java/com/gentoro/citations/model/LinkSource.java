package com.gentoro.citations.model;

/** Document a link was written in. */
public record LinkSource(SourcePath path) {

  public static LinkSource of(String absolute) {
    return new LinkSource(new SourcePath(absolute));
  }

  public record SourcePath(String absolute) {}
}
