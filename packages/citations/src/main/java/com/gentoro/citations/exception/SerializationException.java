package com.gentoro.citations.exception;

/** Failed to serialize or deserialize a payload. */
public class SerializationException extends CitationException {
  public SerializationException(String message) {
    super(CitationErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(CitationErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
