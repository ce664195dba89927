package com.onthegomap.tilestash.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Exception-handling utilities.
 */
public class Exceptions {
  private Exceptions() {}

  /**
   * Re-throw a caught exception, handling interrupts and wrapping in a {@link FatalTilestashException} if checked.
   *
   * @param exception The original exception
   * @param <T>       Return type if caller requires it
   */
  public static <T> T throwFatalException(Throwable exception) {
    if (exception instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
    if (exception instanceof RuntimeException runtimeException) {
      throw runtimeException;
    } else if (exception instanceof IOException ioe) {
      throw new UncheckedIOException(ioe);
    } else if (exception instanceof Error error) {
      throw error;
    }
    throw new FatalTilestashException(exception);
  }

  /** Returns the exception that caused a future to fail, without the {@link CompletionException} wrappers. */
  public static Throwable unwrap(Throwable exception) {
    Throwable result = exception;
    while ((result instanceof CompletionException || result instanceof ExecutionException) &&
      result.getCause() != null) {
      result = result.getCause();
    }
    return result;
  }

  /** Returns a short one-line description of {@code exception} suitable for debug logs. */
  public static String describe(Throwable exception) {
    Throwable cause = unwrap(exception);
    return cause.getClass().getSimpleName() + (cause.getMessage() == null ? "" : (": " + cause.getMessage()));
  }

  /**
   * Unexpected checked exception that a caller cannot handle.
   */
  public static class FatalTilestashException extends RuntimeException {
    public FatalTilestashException(Throwable exception) {
      super(exception);
    }
  }
}
