package io.github.matryoshka.dao;

/**
 * The fixed set of statements precompiled when a file system is loaded.
 */
public enum BaseStatement {
  GET_HANDLE(Schema.SQL_GET_HANDLE),
  CREATE_HANDLE(Schema.SQL_CREATE_HANDLE),
  LAST_ROW_ID(Schema.SQL_LAST_ROW_ID),
  CREATE_CHUNK(Schema.SQL_CREATE_CHUNK),
  GLOB(Schema.SQL_GLOB),
  SIZE(Schema.SQL_SIZE),
  DELETE(Schema.SQL_DELETE),
  GET_CHUNKS(Schema.SQL_GET_CHUNKS),
  READ_CHUNK(Schema.SQL_READ_CHUNK),
  STAT(Schema.SQL_STAT);

  private final String sql;

  BaseStatement(final String sql) {
    this.sql = sql;
  }

  /**
   * The sql.
   *
   * @return the sql
   */
  public String sql() {
    return sql;
  }
}
