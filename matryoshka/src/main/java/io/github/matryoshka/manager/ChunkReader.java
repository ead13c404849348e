package io.github.matryoshka.manager;

import io.github.matryoshka.dao.Schema;
import io.github.matryoshka.exception.ReadException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.Handle;

/**
 * Copies spans of chunk content into a sink through one scratch buffer.
 *
 * <p>A reader is opened once per read call and repositioned on each chunk with {@link #reopen(long)}; the
 * buffer is allocated once and reused for every chunk. It must not outlive the call that opened it.
 */
public class ChunkReader implements AutoCloseable {

  private final Handle handle;
  private byte[] buffer;
  private long chunkId = -1;

  /**
   * Instantiates a new chunk reader.
   *
   * @param handle   the handle of the file system
   * @param capacity the largest span that will be copied
   */
  public ChunkReader(final Handle handle, final int capacity) {
    this.handle = handle;
    this.buffer = new byte[capacity];
  }

  /**
   * Positions the reader on another chunk.
   *
   * @param chunkId the chunk id
   */
  public void reopen(final long chunkId) {
    ensureOpen();
    this.chunkId = chunkId;
  }

  /**
   * Copies a span of the current chunk into the sink.
   *
   * @param offset zero based offset inside the chunk
   * @param count  number of bytes
   * @param sink   the sink
   * @throws IOException if the sink fails
   */
  public void transfer(final long offset, final int count, final OutputStream sink) throws IOException {
    ensureOpen();
    if (chunkId < 0) {
      throw new IllegalStateException("No chunk selected");
    }
    if (count > buffer.length) {
      throw new IllegalStateException("Chunk " + chunkId + " exceeds the chunk size of its file");
    }
    final int read = handle.createQuery(Schema.SQL_READ_CHUNK)
        .bind(0, offset)
        .bind(1, count)
        .bind(2, chunkId)
        .map((rs, ctx) -> fill(rs, count))
        .findOne()
        .orElse(0);
    if (read != count) {
      throw ReadException.outOfBounds();
    }
    sink.write(buffer, 0, count);
  }

  private int fill(final ResultSet rs, final int count) throws SQLException {
    try (InputStream content = rs.getBinaryStream(1)) {
      return content == null ? 0 : content.readNBytes(buffer, 0, count);
    } catch (IOException e) {
      throw new SQLException("Unable to read chunk " + chunkId, e);
    }
  }

  private void ensureOpen() {
    if (buffer == null) {
      throw new IllegalStateException("Chunk reader is closed");
    }
  }

  @Override
  public void close() {
    buffer = null;
    chunkId = -1;
  }

}
