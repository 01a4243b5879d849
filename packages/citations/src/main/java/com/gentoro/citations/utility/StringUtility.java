package com.gentoro.citations.utility;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

public class StringUtility {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]");

  /**
   * Decode percent-escapes ({@code %20}, {@code %3A}) without turning {@code +} into a space.
   * Returns the input unchanged when it is not a valid escape sequence.
   */
  public static String decodePercent(String input) {
    if (input == null || input.indexOf('%') < 0) return input;
    try {
      return URLDecoder.decode(input.replace("+", "%2B"), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      return input;
    }
  }

  /** Obsidian-style heading reference: colons dropped, whitespace runs replaced with %20. */
  public static String encodeHeadingReference(String headingText) {
    if (headingText == null) return null;
    return WHITESPACE.matcher(headingText.replace(":", "")).replaceAll("%20");
  }

  /**
   * Loose comparison key for anchors: decoded, caret and markdown markers stripped, lower-cased,
   * with every non letter/digit removed.
   */
  public static String looseAnchorKey(String anchor) {
    if (anchor == null) return "";
    String key = decodePercent(anchor);
    if (key.startsWith("^")) key = key.substring(1);
    key = key.replace("`", "").replace("*", "").replace("==", "");
    return NON_ALPHANUMERIC.matcher(key.toLowerCase(Locale.ROOT)).replaceAll("");
  }

  /** Similarity in [0, 1] derived from the case-insensitive Levenshtein distance. */
  public static double similarity(String left, String right) {
    if (left.equals(right)) return 1.0;
    if (left.isEmpty() || right.isEmpty()) return 0.0;
    String a = left.toLowerCase(Locale.ROOT);
    String b = right.toLowerCase(Locale.ROOT);

    int[] previous = new int[a.length() + 1];
    int[] current = new int[a.length() + 1];
    for (int j = 0; j <= a.length(); j++) previous[j] = j;
    for (int i = 1; i <= b.length(); i++) {
      current[0] = i;
      for (int j = 1; j <= a.length(); j++) {
        int cost = b.charAt(i - 1) == a.charAt(j - 1) ? 0 : 1;
        current[j] =
            Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    int distance = previous[a.length()];
    return 1.0 - (double) distance / Math.max(a.length(), b.length());
  }
}
