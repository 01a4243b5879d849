package com.gentoro.citations.extraction;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Content-addressed map of extracted blocks.
 *
 * <p>Serializes as a flat JSON object: {@code _totalContentCharacterLength} first, then one entry
 * per content id in first-seen order.
 */
public final class ExtractedContentBlocks {
  private final int totalContentCharacterLength;
  private final Map<String, ExtractedContentBlock> blocks;

  public ExtractedContentBlocks(
      int totalContentCharacterLength, Map<String, ExtractedContentBlock> blocks) {
    this.totalContentCharacterLength = totalContentCharacterLength;
    this.blocks = Collections.unmodifiableMap(new LinkedHashMap<>(blocks));
  }

  /** Length of the compact JSON form of the block map, computed before this field was added. */
  @JsonProperty("_totalContentCharacterLength")
  public int getTotalContentCharacterLength() {
    return totalContentCharacterLength;
  }

  @JsonAnyGetter
  public Map<String, ExtractedContentBlock> getBlocks() {
    return blocks;
  }

  public ExtractedContentBlock get(String contentId) {
    return blocks.get(contentId);
  }

  public int size() {
    return blocks.size();
  }
}
