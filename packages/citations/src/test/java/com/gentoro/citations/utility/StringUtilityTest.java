package com.gentoro.citations.utility;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StringUtilityTest {

  @Test
  @DisplayName("decodePercent decodes escapes, keeps plus signs and tolerates bad input")
  void decodePercent() {
    assertEquals("My Header", StringUtility.decodePercent("My%20Header"));
    assertEquals("a+b", StringUtility.decodePercent("a+b"));
    assertEquals("100%", StringUtility.decodePercent("100%"));
    assertNull(StringUtility.decodePercent(null));
  }

  @Test
  @DisplayName("Heading references drop colons and encode whitespace")
  void encodeHeadingReference() {
    assertEquals("Step%201%20Setup", StringUtility.encodeHeadingReference("Step 1: Setup"));
    assertEquals("Plain", StringUtility.encodeHeadingReference("Plain"));
  }

  @Test
  @DisplayName("Loose anchor key ignores case, punctuation, carets and markdown markers")
  void looseAnchorKey() {
    assertEquals("myheader", StringUtility.looseAnchorKey("my-header"));
    assertEquals("myheader", StringUtility.looseAnchorKey("My Header"));
    assertEquals("myheader", StringUtility.looseAnchorKey("My%20Header"));
    assertEquals("blockid", StringUtility.looseAnchorKey("^Block_ID"));
    assertEquals("code", StringUtility.looseAnchorKey("`code`"));
    assertEquals("key", StringUtility.looseAnchorKey("==**Key**=="));
  }

  @Test
  @DisplayName("similarity is 1 for equal strings and shrinks with edit distance")
  void similarity() {
    assertEquals(1.0, StringUtility.similarity("abc", "abc"));
    assertEquals(1.0, StringUtility.similarity("ABC", "abc"));
    assertEquals(0.0, StringUtility.similarity("abc", ""));
    assertEquals(0.75, StringUtility.similarity("abcd", "abce"), 1e-9);
  }
}
