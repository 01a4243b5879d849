package com.gentoro.citations.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends CitationException {
  public ValidationException(String message) {
    super(CitationErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(CitationErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
