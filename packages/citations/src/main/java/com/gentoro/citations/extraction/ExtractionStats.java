package com.gentoro.citations.extraction;

/**
 * Aggregated figures for one extraction run.
 *
 * @param charactersSaved characters not repeated thanks to deduplication
 * @param tokensSaved the same saving in estimated tokens, four characters to a token
 * @param compressionRatio {@code charactersSaved / (uniqueCharacters + charactersSaved)}, 0 when
 *     nothing was extracted
 */
public record ExtractionStats(
    int totalLinks,
    int uniqueContent,
    int duplicateContentDetected,
    int tokensSaved,
    int charactersSaved,
    double compressionRatio,
    int extractedLinks,
    int skippedLinks,
    int failedLinks) {}
