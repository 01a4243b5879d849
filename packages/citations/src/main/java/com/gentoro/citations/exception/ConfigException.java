package com.gentoro.citations.exception;

/** Configuration could not be loaded or is invalid. */
public class ConfigException extends CitationException {
  public ConfigException(String message) {
    super(CitationErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(CitationErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
