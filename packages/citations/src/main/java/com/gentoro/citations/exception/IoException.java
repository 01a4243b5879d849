package com.gentoro.citations.exception;

/** I/O operation failed (filesystem or classpath streams). */
public class IoException extends CitationException {
  public IoException(String message) {
    super(CitationErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(CitationErrorCode.IO_ERROR, message, cause);
  }
}
