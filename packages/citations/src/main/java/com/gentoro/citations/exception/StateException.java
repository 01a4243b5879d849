package com.gentoro.citations.exception;

/** Component used in an invalid state. */
public class StateException extends CitationException {
  public StateException(String message) {
    super(CitationErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(CitationErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
