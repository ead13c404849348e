package io.github.matryoshka.exception;

import java.io.IOException;

/**
 * Raised while reading a byte range of a file.
 */
public class ReadException extends MatryoshkaException {

  private static final String PREFIX = "Error during file reading: ";

  private final Reason reason;

  private ReadException(final Reason reason, final String detail, final Throwable cause) {
    super(PREFIX + detail, cause);
    this.reason = reason;
  }

  /**
   * The range is not covered by the stored content.
   *
   * @return the exception
   */
  public static ReadException outOfBounds() {
    return new ReadException(Reason.OUT_OF_BOUNDS, "The specified indices are out of bounds", null);
  }

  /**
   * The range cannot be addressed by the database.
   *
   * @return the exception
   */
  public static ReadException fileSystemLimits() {
    return new ReadException(Reason.FILE_SYSTEM_LIMITS,
        "The underlying database does not allow files of such size", null);
  }

  /**
   * Writing to the destination failed.
   *
   * @param cause the cause
   * @return the exception
   */
  public static ReadException sinkError(final IOException cause) {
    return new ReadException(Reason.SINK_ERROR,
        "The data destination failed ('" + cause.getMessage() + "')", cause);
  }

  /**
   * Database failure.
   *
   * @param cause the cause
   * @return the exception
   */
  public static ReadException databaseError(final DatabaseException cause) {
    return new ReadException(Reason.DATABASE_ERROR,
        "The underlying database failed ('" + cause.getMessage() + "')", cause);
  }

  /**
   * The reason.
   *
   * @return the reason
   */
  public Reason reason() {
    return reason;
  }

  /**
   * Why reading failed.
   */
  public enum Reason {
    OUT_OF_BOUNDS,
    FILE_SYSTEM_LIMITS,
    SINK_ERROR,
    DATABASE_ERROR
  }

}
