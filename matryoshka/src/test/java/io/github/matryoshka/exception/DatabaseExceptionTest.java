package io.github.matryoshka.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.sql.SQLException;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.junit.jupiter.api.Test;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

class DatabaseExceptionTest {

  @Test
  void from_sqliteException() {
    final SQLiteException cause = new SQLiteException("UNIQUE constraint failed",
        SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE);

    final DatabaseException exception =
        DatabaseException.from(new UnableToExecuteStatementException(cause, null));

    assertThat(exception.errorCode()).isEqualTo(SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE.code);
    assertThat(exception.primaryErrorCode()).isEqualTo(SQLiteErrorCode.SQLITE_CONSTRAINT.code);
    assertThat(exception.isConstraintViolation()).isTrue();
    assertThat(exception.databaseMessage()).contains("UNIQUE constraint failed");
    assertThat(exception.getMessage()).isEqualTo("UNIQUE constraint failed");
  }

  @Test
  void from_plainSqlException() {
    final DatabaseException exception = DatabaseException.from(new SQLException(null, "HY000", 5));

    assertThat(exception.errorCode()).isEqualTo(5);
    assertThat(exception.isConstraintViolation()).isFalse();
    assertThat(exception.databaseMessage()).isEmpty();
    assertThat(exception.getMessage()).isEqualTo(DatabaseException.MISSING_MESSAGE);
  }

  @Test
  void from_databaseException_isUnchanged() {
    final DatabaseException existing = new DatabaseException(1, "boom", null);

    assertThat(DatabaseException.from(existing)).isSameAs(existing);
  }

  @Test
  void from_withoutSqlException_isALogicError() {
    assertThatThrownBy(() -> DatabaseException.from(new IllegalArgumentException("nope")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage(DatabaseException.LOGIC_ERROR_MESSAGE);
  }

  @Test
  void categoryMessages() {
    final DatabaseException cause = new DatabaseException(1, "boom", null);

    assertThat(CreationException.databaseError(cause))
        .hasMessage("Error during file creation: The underlying database failed ('boom')")
        .hasCause(cause);
    assertThat(LoadingException.fileNotFound().reason()).isEqualTo(LoadingException.Reason.FILE_NOT_FOUND);
    assertThat(ReadException.outOfBounds().getMessage()).startsWith("Error during file reading: ");
    assertThat(FileSystemException.unsupportedVersion(42).reason())
        .isEqualTo(FileSystemException.Reason.UNSUPPORTED_VERSION);
  }

}
