package com.gentoro.citations.exception;

/**
 * Canonical error codes for the citation toolkit. Codes are stable and suitable for logs and
 * machine-readable reports. Prefer the most specific code that reflects the failure origin.
 */
public enum CitationErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  PARSE_ERROR,
  EXTRACTION_ERROR,
}
