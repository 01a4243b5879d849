package com.gentoro.citations.exception;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Utility helpers for dealing with exceptions raised through asynchronous pipelines. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Strip the {@link CompletionException} and {@link ExecutionException} wrappers that {@link
   * java.util.concurrent.CompletableFuture} adds around the underlying failure.
   */
  public static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /** Message of the unwrapped failure, falling back to its simple class name. */
  public static String rootMessage(Throwable t) {
    if (t == null) return "";
    Throwable cause = unwrap(t);
    String message = cause.getMessage();
    return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
  }

  /**
   * Return {@code t} unchanged when it already is a {@link CitationException}, otherwise wrap it as
   * the provided fallback.
   */
  public static CitationException asCitationException(Throwable t, String fallbackMessage) {
    Throwable cause = unwrap(t);
    if (cause instanceof CitationException ce) {
      return ce;
    }
    return new CitationException(CitationErrorCode.UNKNOWN, fallbackMessage, cause);
  }
}
