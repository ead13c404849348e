package io.github.matryoshka.exception;

/**
 * Raised while loading the virtual file system from a database.
 */
public class FileSystemException extends MatryoshkaException {

  private static final String PREFIX = "Error during loading of virtual file system from database: ";

  private final Reason reason;

  private FileSystemException(final Reason reason, final String detail, final Throwable cause) {
    super(PREFIX + detail, cause);
    this.reason = reason;
  }

  /**
   * The database holds no file system and none should be created.
   *
   * @return the exception
   */
  public static FileSystemException noFileSystem() {
    return new FileSystemException(Reason.NO_FILE_SYSTEM,
        "No virtual file system exists neither should it be created", null);
  }

  /**
   * One of the base statements could not be prepared. Should not occur in the wild.
   *
   * @param statement the name of the statement
   * @param sql       the sql of the statement
   * @param cause     the cause
   * @return the exception
   */
  public static FileSystemException invalidBaseCommand(final String statement,
                                                       final String sql,
                                                       final Throwable cause) {
    return new FileSystemException(Reason.INVALID_BASE_COMMAND,
        "Preparing the base SQL command " + statement + " '" + sql + "' failed", cause);
  }

  /**
   * The schema version found is not the one this library writes.
   *
   * @param version the version found
   * @return the exception
   */
  public static FileSystemException unsupportedVersion(final int version) {
    return new FileSystemException(Reason.UNSUPPORTED_VERSION,
        "The version of the virtual file system '" + version
            + "' is not compatible with the current library version", null);
  }

  /**
   * Database failure.
   *
   * @param cause the cause
   * @return the exception
   */
  public static FileSystemException databaseError(final DatabaseException cause) {
    return new FileSystemException(Reason.DATABASE_ERROR,
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
   * Why loading failed.
   */
  public enum Reason {
    NO_FILE_SYSTEM,
    INVALID_BASE_COMMAND,
    UNSUPPORTED_VERSION,
    DATABASE_ERROR
  }

}
