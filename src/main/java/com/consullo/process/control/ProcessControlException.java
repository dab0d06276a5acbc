package com.consullo.process.control;

/**
 * Base of the checked failures a {@link ProcessController} surfaces to callers.
 *
 * @since 1.0
 */
public class ProcessControlException extends Exception {

  private static final long serialVersionUID = 1L;

  public ProcessControlException(final String message) {
    super(message);
  }

  public ProcessControlException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
