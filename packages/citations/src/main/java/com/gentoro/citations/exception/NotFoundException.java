package com.gentoro.citations.exception;

import java.util.Map;

/** Requested file, heading or anchor does not exist. */
public class NotFoundException extends CitationException {
  public NotFoundException(String message) {
    super(CitationErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(CitationErrorCode.NOT_FOUND, message, cause);
  }

  public NotFoundException(String message, Map<String, ?> context, Throwable cause) {
    super(CitationErrorCode.NOT_FOUND, message, context, cause);
  }
}
