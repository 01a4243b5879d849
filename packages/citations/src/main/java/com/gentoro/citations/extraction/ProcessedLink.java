package com.gentoro.citations.extraction;

import com.gentoro.citations.model.Link;

/**
 * Outcome of one link in an extraction run. Exactly one of {@code successDetails} and {@code
 * failureDetails} is present; {@code contentId} is set only on success.
 */
public record ProcessedLink(
    Link sourceLink,
    String contentId,
    ProcessingStatus status,
    SuccessDetails successDetails,
    FailureDetails failureDetails) {

  public record SuccessDetails(String decisionReason, String extractedContent) {}

  public record FailureDetails(String reason) {}

  public static ProcessedLink success(
      Link link, String contentId, String decisionReason, String content) {
    return new ProcessedLink(
        link,
        contentId,
        ProcessingStatus.SUCCESS,
        new SuccessDetails(decisionReason, content),
        null);
  }

  public static ProcessedLink skipped(Link link, String reason) {
    return new ProcessedLink(
        link, null, ProcessingStatus.SKIPPED, null, new FailureDetails(reason));
  }

  public static ProcessedLink error(Link link, String reason) {
    return new ProcessedLink(link, null, ProcessingStatus.ERROR, null, new FailureDetails(reason));
  }
}
