package io.github.matryoshka.dao;

import io.github.matryoshka.model.ChunkLocation;
import io.github.matryoshka.model.FileEntry;
import java.util.List;
import java.util.Optional;
import org.jdbi.v3.core.result.ResultIterator;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Primitive statements on the meta and data tables. Attached to the single handle of a file system, so every
 * call runs on its connection and inside its current transaction.
 */
public interface FileSystemDao {

  /**
   * Looks up the handle of an entry.
   *
   * @param path the normalized path
   * @param type the entry type
   * @return the handle value, if any
   */
  @SqlQuery(Schema.SQL_GET_HANDLE)
  Optional<Long> findHandle(String path, int type);

  /**
   * Inserts a meta entry.
   *
   * @param path      the normalized path
   * @param type      the entry type
   * @param chunkSize the chunk size
   * @return the number of rows inserted
   */
  @SqlUpdate(Schema.SQL_CREATE_HANDLE)
  int insertEntry(String path, int type, int chunkSize);

  /**
   * The row id of the last insert on this connection.
   *
   * @return the row id
   */
  @SqlQuery(Schema.SQL_LAST_ROW_ID)
  long lastInsertRowId();

  /**
   * Inserts one chunk.
   *
   * @param fileId   the owning entry
   * @param chunkNum the zero based chunk number
   * @param data     the content
   * @return the number of rows inserted
   */
  @SqlUpdate(Schema.SQL_CREATE_CHUNK)
  int insertChunk(long fileId, long chunkNum, byte[] data);

  /**
   * Paths matching a glob pattern, ascending.
   *
   * @param pattern the glob pattern
   * @param type    the entry type
   * @return the paths
   */
  @SqlQuery(Schema.SQL_GLOB)
  List<String> glob(String pattern, int type);

  /**
   * Total number of bytes of an entry, or -1 if it has no chunks.
   *
   * @param fileId the entry
   * @return the size
   */
  @SqlQuery(Schema.SQL_SIZE)
  long size(long fileId);

  /**
   * Deletes an entry; its chunks cascade.
   *
   * @param fileId the entry
   * @return the number of rows deleted
   */
  @SqlUpdate(Schema.SQL_DELETE)
  int delete(long fileId);

  /**
   * The chunks intersecting a byte range, ascending by chunk number. The iterator must be closed.
   *
   * @param fileId     the entry
   * @param index      first byte of the range
   * @param rangeStart first byte of the range, again
   * @param length     length of the range, at least one
   * @return the chunk locations
   */
  @SqlQuery(Schema.SQL_GET_CHUNKS)
  @RegisterRowMapper(ChunkLocationMapper.class)
  ResultIterator<ChunkLocation> chunks(long fileId, long index, long rangeStart, long length);

  /**
   * The meta entry of a path.
   *
   * @param path the normalized path
   * @param type the entry type
   * @return the entry
   */
  @SqlQuery(Schema.SQL_STAT)
  @RegisterRowMapper(FileEntryMapper.class)
  Optional<FileEntry> stat(String path, int type);

}
