package io.github.matryoshka.dao;

/**
 * Layout of a virtual file system inside an SQLite database.
 *
 * <p>The meta table carries the schema version in its name; discovery relies on that name alone. Every SQL
 * statement the engine executes is defined here. Parameters are positional so the text JDBI executes is
 * exactly the text that gets precompiled.
 */
public final class Schema {

  /**
   * The schema version this library reads and writes.
   */
  public static final int CURRENT_VERSION = 0;

  /**
   * Prefix of the meta table, followed by the schema version.
   */
  public static final String META_TABLE_PREFIX = "Matryoshka_Meta_";

  /**
   * The meta table of the current version.
   */
  public static final String META_TABLE = META_TABLE_PREFIX + CURRENT_VERSION;

  /**
   * The table holding the chunks.
   */
  public static final String DATA_TABLE = "Matryoshka_Data";

  /**
   * Entry type of regular files. Other values are reserved for future entry kinds.
   */
  public static final int FILE_TYPE = 1;

  public static final String SQL_CREATE_META = "CREATE TABLE " + META_TABLE
      + " (id INTEGER PRIMARY KEY, path TEXT UNIQUE NOT NULL, type INTEGER, flags INTEGER,"
      + " chunk_size INTEGER NOT NULL)";

  public static final String SQL_CREATE_DATA = "CREATE TABLE IF NOT EXISTS " + DATA_TABLE
      + " (chunk_id INTEGER PRIMARY KEY, file_id INTEGER NOT NULL, chunk_num INTEGER NOT NULL,"
      + " data BLOB NOT NULL, CONSTRAINT unq UNIQUE (file_id, chunk_num),"
      + " FOREIGN KEY(file_id) REFERENCES " + META_TABLE + " (id) ON DELETE CASCADE ON UPDATE CASCADE)";

  public static final String SQL_FIND_META_TABLES =
      "SELECT name FROM sqlite_master WHERE type = 'table' AND name LIKE ?";

  public static final String SQL_ENABLE_FOREIGN_KEYS = "PRAGMA foreign_keys = ON";

  public static final String SQL_GET_HANDLE = "SELECT id FROM " + META_TABLE + " WHERE path = ? AND type = ?";

  public static final String SQL_CREATE_HANDLE = "INSERT INTO " + META_TABLE
      + " (path, type, chunk_size) VALUES (?, ?, ?)";

  public static final String SQL_LAST_ROW_ID = "SELECT last_insert_rowid()";

  public static final String SQL_CREATE_CHUNK = "INSERT INTO " + DATA_TABLE
      + " (file_id, chunk_num, data) VALUES (?, ?, ?)";

  public static final String SQL_GLOB = "SELECT path FROM " + META_TABLE
      + " WHERE path GLOB ? AND type = ? ORDER BY path ASC";

  // -1 marks a handle without any chunk, i.e. an absent file.
  public static final String SQL_SIZE = "SELECT COALESCE(SUM(LENGTH(data)), -1) FROM " + DATA_TABLE
      + " WHERE file_id = ?";

  public static final String SQL_DELETE = "DELETE FROM " + META_TABLE + " WHERE id = ?";

  // Parameters: handle, index, index, length.
  public static final String SQL_GET_CHUNKS = "SELECT d.chunk_id AS chunk_id, d.chunk_num AS chunk_num,"
      + " m.chunk_size AS chunk_size, LENGTH(d.data) AS blob_length"
      + " FROM " + DATA_TABLE + " d INNER JOIN " + META_TABLE + " m ON m.id = d.file_id"
      + " WHERE d.file_id = ?"
      + " AND d.chunk_num BETWEEN CAST(? / m.chunk_size AS INTEGER) AND CAST((? + ? - 1) / m.chunk_size AS INTEGER)"
      + " ORDER BY d.chunk_num ASC";

  // Parameters: zero based offset, length, chunk id.
  public static final String SQL_READ_CHUNK = "SELECT SUBSTR(data, ? + 1, ?) FROM " + DATA_TABLE
      + " WHERE chunk_id = ?";

  public static final String SQL_STAT = "SELECT id, path, type, COALESCE(flags, 0) AS flags, chunk_size FROM "
      + META_TABLE + " WHERE path = ? AND type = ?";

  private Schema() {
  }

}
