package io.github.matryoshka.exception;

/**
 * Superclass for every failure raised by the virtual file system.
 *
 * <p>Each subclass groups the failures of one kind of operation and tags them with a reason, so callers can
 * either catch the whole family or switch on {@code reason()}. The message is always human readable and is what
 * boundary code reports to its callers.
 */
public abstract class MatryoshkaException extends RuntimeException {

  /**
   * Instantiates a new exception.
   *
   * @param message the message
   */
  protected MatryoshkaException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  protected MatryoshkaException(final String message, final Throwable cause) {
    super(message, cause);
  }

}
