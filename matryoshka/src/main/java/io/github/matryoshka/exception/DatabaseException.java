package io.github.matryoshka.exception;

import java.sql.SQLException;
import java.util.Optional;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

/**
 * An error raised and described by the underlying database.
 */
public class DatabaseException extends MatryoshkaException {

  /**
   * Message used if the database does not describe the error.
   */
  public static final String MISSING_MESSAGE = "<Unknown SQLite error>";

  /**
   * Message of the failure raised when a database access fails without a database error.
   */
  public static final String LOGIC_ERROR_MESSAGE = "Logic error during database access";

  private static final int PRIMARY_CODE_MASK = 0xFF;

  private final int errorCode;
  private final String databaseMessage;

  /**
   * Instantiates a new database exception.
   *
   * @param errorCode       the (possibly extended) SQLite result code
   * @param databaseMessage the message of the database, may be null
   * @param cause           the cause
   */
  public DatabaseException(final int errorCode, final String databaseMessage, final Throwable cause) {
    super(databaseMessage == null ? MISSING_MESSAGE : databaseMessage, cause);
    this.errorCode = errorCode;
    this.databaseMessage = databaseMessage;
  }

  /**
   * Converts a failure of a database access.
   *
   * <p>The cause chain must contain an {@link SQLException}; anything else means the engine itself misused the
   * database, which is not a condition callers can handle.
   *
   * @param throwable the failure
   * @return the database exception
   * @throws IllegalStateException if no database error is found
   */
  public static DatabaseException from(final Throwable throwable) {
    if (throwable instanceof DatabaseException) {
      return (DatabaseException) throwable;
    }
    for (Throwable cause = throwable; cause != null; cause = cause.getCause()) {
      if (cause instanceof SQLiteException) {
        final SQLiteException sqliteException = (SQLiteException) cause;
        return new DatabaseException(sqliteException.getResultCode().code, describe(sqliteException), throwable);
      }
      if (cause instanceof SQLException) {
        final SQLException sqlException = (SQLException) cause;
        return new DatabaseException(sqlException.getErrorCode(), sqlException.getMessage(), throwable);
      }
    }
    throw new IllegalStateException(LOGIC_ERROR_MESSAGE, throwable);
  }

  private static String describe(final SQLiteException exception) {
    final String message = exception.getMessage();
    return message == null || message.isBlank() ? null : message;
  }

  /**
   * The SQLite result code, possibly extended.
   *
   * @return the error code
   */
  public int errorCode() {
    return errorCode;
  }

  /**
   * The primary SQLite result code (the low byte of the result code).
   *
   * @return the primary error code
   */
  public int primaryErrorCode() {
    return errorCode & PRIMARY_CODE_MASK;
  }

  /**
   * Checks if the database rejected a write because of a constraint.
   *
   * @return true for constraint violations
   */
  public boolean isConstraintViolation() {
    return primaryErrorCode() == SQLiteErrorCode.SQLITE_CONSTRAINT.code;
  }

  /**
   * The message of the database, if it gave one.
   *
   * @return the database message
   */
  public Optional<String> databaseMessage() {
    return Optional.ofNullable(databaseMessage);
  }

}
