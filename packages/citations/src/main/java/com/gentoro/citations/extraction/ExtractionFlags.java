package com.gentoro.citations.extraction;

import java.nio.file.Path;

/**
 * Switches for one extraction run.
 *
 * @param fullFiles extract links without an anchor as whole files
 * @param scope directory the source document must live in; {@code null} for no restriction
 */
public record ExtractionFlags(boolean fullFiles, Path scope) {

  public static ExtractionFlags defaults() {
    return new ExtractionFlags(false, null);
  }

  public static ExtractionFlags withFullFiles() {
    return new ExtractionFlags(true, null);
  }
}
