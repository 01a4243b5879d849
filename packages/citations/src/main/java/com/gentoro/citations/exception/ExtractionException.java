package com.gentoro.citations.exception;

import java.util.Map;

/** Content could not be retrieved from an already validated link target. */
public class ExtractionException extends CitationException {
  public ExtractionException(String message) {
    super(CitationErrorCode.EXTRACTION_ERROR, message);
  }

  public ExtractionException(String message, Map<String, ?> context) {
    super(CitationErrorCode.EXTRACTION_ERROR, message, context);
  }
}
