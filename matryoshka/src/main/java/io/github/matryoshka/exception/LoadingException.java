package io.github.matryoshka.exception;

/**
 * Raised while loading a file from the virtual file system, by path or by handle.
 */
public class LoadingException extends MatryoshkaException {

  private static final String PREFIX = "Error during file loading: ";

  private final Reason reason;

  private LoadingException(final Reason reason, final String detail, final Throwable cause) {
    super(PREFIX + detail, cause);
    this.reason = reason;
  }

  public static LoadingException fileNotFound() {
    return new LoadingException(Reason.FILE_NOT_FOUND, "The requested file does not exist", null);
  }

  public static LoadingException databaseError(final DatabaseException cause) {
    return new LoadingException(Reason.DATABASE_ERROR,
        "The underlying database failed ('" + cause.getMessage() + "')", cause);
  }

  public Reason reason() {
    return reason;
  }

  public enum Reason {
    FILE_NOT_FOUND,
    DATABASE_ERROR
  }

}
