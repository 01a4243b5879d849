package com.gentoro.citations.model;

/**
 * Where a link points to. Internal links carry a path whose three forms are all {@code null}.
 *
 * @param path target file as written, resolved and relative to the source directory
 * @param anchor fragment after {@code #}, without the hash; {@code null} for full-file links
 */
public record LinkTarget(TargetPath path, String anchor) {

  /**
   * @param raw exactly as written in the document
   * @param absolute percent-decoded and resolved against the source file's directory
   * @param relative recomputed from the source directory, always with {@code /} separators
   */
  public record TargetPath(String raw, String absolute, String relative) {
    public static final TargetPath NONE = new TargetPath(null, null, null);
  }
}
