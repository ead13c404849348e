package io.github.matryoshka.exception;

import java.io.IOException;

/**
 * Raised while creating a file in the virtual file system.
 */
public class CreationException extends MatryoshkaException {

  private static final String PREFIX = "Error during file creation: ";

  private final Reason reason;

  private CreationException(final Reason reason, final String detail, final Throwable cause) {
    super(PREFIX + detail, cause);
    this.reason = reason;
  }

  /**
   * A file already exists under the path.
   *
   * @param path the normalized path
   * @return the exception
   */
  public static CreationException fileExists(final String path) {
    return new CreationException(Reason.FILE_EXISTS, "File '" + path + "' does already exist", null);
  }

  /**
   * Reading the data source failed.
   *
   * @param cause the cause
   * @return the exception
   */
  public static CreationException sourceError(final IOException cause) {
    return new CreationException(Reason.SOURCE_ERROR,
        "The data source failed ('" + cause.getMessage() + "')", cause);
  }

  /**
   * Database failure.
   *
   * @param cause the cause
   * @return the exception
   */
  public static CreationException databaseError(final DatabaseException cause) {
    return new CreationException(Reason.DATABASE_ERROR,
        "The underlying database failed ('" + cause.getMessage() + "')", cause);
  }

  public Reason reason() {
    return reason;
  }

  /**
   * Why creation failed.
   */
  public enum Reason {
    FILE_EXISTS,
    SOURCE_ERROR,
    DATABASE_ERROR
  }

}
