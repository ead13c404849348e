package io.github.matryoshka;

import io.github.matryoshka.dao.BaseStatement;
import io.github.matryoshka.dao.FileSystemDao;
import io.github.matryoshka.dao.Schema;
import io.github.matryoshka.dbu.statement.CachingStatementBuilder;
import io.github.matryoshka.exception.CreationException;
import io.github.matryoshka.exception.DatabaseException;
import io.github.matryoshka.exception.FileSystemException;
import io.github.matryoshka.exception.ReadException;
import io.github.matryoshka.manager.ChunkReader;
import io.github.matryoshka.manager.SchemaManager;
import io.github.matryoshka.model.ChunkLocation;
import io.github.matryoshka.model.Configuration;
import io.github.matryoshka.model.FileEntry;
import io.github.matryoshka.model.FileHandle;
import io.github.matryoshka.model.MetaData;
import io.github.matryoshka.util.VirtualPath;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import org.jdbi.v3.core.CloseException;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.result.ResultIterator;
import org.jdbi.v3.core.statement.SqlStatements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConnection;
import org.sqlite.SQLiteLimits;

/**
 * A virtual file system stored in an SQLite database.
 *
 * <p>The file system exclusively owns the handle it was loaded from and precompiles its statements on it.
 * All operations are synchronous and run on that single connection; the file system is not thread safe.
 * Mutating operations run in one transaction each, so a failure never leaves a partially written file.
 * {@link VirtualFile} is the convenient view on a single file; the primitives here work on raw handles.
 */
public class VirtualFileSystem implements AutoCloseable {

  /**
   * Chunk size used when the requested one is not usable: 32 MiB.
   */
  public static final int DEFAULT_CHUNK_SIZE = 32 * 1024 * 1024;

  private static final Logger log = LoggerFactory.getLogger(VirtualFileSystem.class);

  private final Handle handle;
  private final FileSystemDao dao;
  private final CachingStatementBuilder statementCache;
  private final MetaData metaData;
  private final int maxBlobLength;
  private boolean closed;

  private VirtualFileSystem(final Handle handle,
                            final CachingStatementBuilder statementCache,
                            final MetaData metaData,
                            final int maxBlobLength) {
    this.handle = handle;
    this.dao = handle.attach(FileSystemDao.class);
    this.statementCache = statementCache;
    this.metaData = metaData;
    this.maxBlobLength = maxBlobLength;
  }

  /**
   * Loads the virtual file system, bounding chunks by the blob limit of the connection.
   *
   * @param handle          the handle, owned by the file system on success
   * @param createIfMissing create the tables if the database has none
   * @return the virtual file system
   * @throws FileSystemException if there is no usable file system
   */
  public static VirtualFileSystem load(final Handle handle, final boolean createIfMissing) {
    return load(handle, createIfMissing, Configuration.SQLITE_MAX_LENGTH);
  }

  /**
   * Loads the virtual file system.
   *
   * <p>An existing file system must have the current version; there is no migration. On failure the handle
   * stays with the caller.
   *
   * @param handle          the handle, owned by the file system on success
   * @param createIfMissing create the tables if the database has none
   * @param maxBlobLength   an upper bound on chunk sizes, applied on top of the connection's blob limit
   * @return the virtual file system
   * @throws FileSystemException if there is no usable file system
   */
  public static VirtualFileSystem load(final Handle handle,
                                       final boolean createIfMissing,
                                       final int maxBlobLength) {
    Objects.requireNonNull(handle, "handle");
    log.debug("load({}, {})", createIfMissing, maxBlobLength);
    try {
      handle.execute(Schema.SQL_ENABLE_FOREIGN_KEYS);
      handle.getConfig(SqlStatements.class).setUnusedBindingAllowed(true);

      final SchemaManager schemaManager = new SchemaManager(handle);
      final Optional<MetaData> discovered = schemaManager.discover();
      final MetaData metaData;
      if (discovered.isPresent()) {
        metaData = discovered.get();
        if (metaData.version() != Schema.CURRENT_VERSION) {
          throw FileSystemException.unsupportedVersion(metaData.version());
        }
      } else if (createIfMissing) {
        metaData = schemaManager.create();
      } else {
        throw FileSystemException.noFileSystem();
      }

      final int blobLimit = Math.min(maxBlobLength, storeBlobLimit(handle));
      final CachingStatementBuilder statementCache = precompile(handle);
      handle.setStatementBuilder(statementCache);
      log.info("Loaded virtual file system (version {}, blob limit {})", metaData.version(), blobLimit);
      return new VirtualFileSystem(handle, statementCache, metaData, blobLimit);
    } catch (JdbiException e) {
      throw FileSystemException.databaseError(DatabaseException.from(e));
    }
  }

  private static int storeBlobLimit(final Handle handle) {
    try {
      final SQLiteConnection connection = handle.getConnection().unwrap(SQLiteConnection.class);
      // A negative value queries the limit without changing it.
      return connection.getDatabase().limit(SQLiteLimits.SQLITE_LIMIT_LENGTH.getId(), -1);
    } catch (SQLException e) {
      throw FileSystemException.databaseError(DatabaseException.from(e));
    }
  }

  private static CachingStatementBuilder precompile(final Handle handle) {
    final CachingStatementBuilder statementCache = new CachingStatementBuilder(BaseStatement.values().length);
    for (BaseStatement statement : BaseStatement.values()) {
      try {
        statementCache.prepare(handle.getConnection(), statement.sql());
      } catch (SQLException e) {
        final FileSystemException failure =
            FileSystemException.invalidBaseCommand(statement.name(), statement.sql(), e);
        try {
          statementCache.close(handle.getConnection());
        } catch (CloseException closeFailure) {
          failure.addSuppressed(closeFailure);
        }
        throw failure;
      }
    }
    return statementCache;
  }

  /**
   * The meta data of the loaded file system.
   *
   * @return the meta data
   */
  public MetaData metaData() {
    return metaData;
  }

  /**
   * The largest chunk size new files may get: the smaller of the connection's blob limit and the configured cap.
   *
   * @return the max blob length
   */
  public int maxBlobLength() {
    return maxBlobLength;
  }

  /**
   * The number of precompiled statements.
   *
   * @return the cache capacity
   */
  public int statementCacheCapacity() {
    return statementCache.capacity();
  }

  /**
   * Finds the paths matching a glob pattern. {@code ?} matches one character and {@code *} any run of
   * characters, including separators. The pattern is normalized like a path first.
   *
   * @param pattern the glob pattern
   * @return matching paths in ascending order
   * @throws DatabaseException if the query fails
   */
  public List<String> find(final String pattern) {
    ensureOpen();
    final VirtualPath glob = VirtualPath.of(pattern);
    try {
      return dao.glob(glob.value(), Schema.FILE_TYPE);
    } catch (JdbiException e) {
      throw DatabaseException.from(e);
    }
  }

  /**
   * Creates a file from a data source, split into chunks.
   *
   * <p>The requested chunk size is advisory: values that are not positive or exceed the database's blob limit
   * fall back to {@link #DEFAULT_CHUNK_SIZE}. The source is read until it is exhausted.
   *
   * @param path               the path
   * @param source             the data source, not closed by this method
   * @param requestedChunkSize the requested chunk size
   * @return the handle of the new file
   * @throws CreationException if the path is taken, the source fails or the database fails
   */
  public FileHandle create(final String path, final InputStream source, final int requestedChunkSize) {
    ensureOpen();
    Objects.requireNonNull(source, "source");
    final VirtualPath virtualPath = VirtualPath.of(path);
    final int chunkSize = resolveChunkSize(requestedChunkSize);
    log.debug("create({}, {})", virtualPath, chunkSize);
    try {
      final FileHandle fileHandle = handle.inTransaction(transaction -> {
        insertEntry(virtualPath, chunkSize);
        final long id = dao.lastInsertRowId();
        writeChunks(id, source, chunkSize);
        return FileHandle.of(id);
      });
      log.debug("Created {} as {}", virtualPath, fileHandle);
      return fileHandle;
    } catch (JdbiException e) {
      throw CreationException.databaseError(DatabaseException.from(e));
    }
  }

  /**
   * The chunk size a new file gets for a requested chunk size.
   *
   * @param requestedChunkSize the requested chunk size
   * @return the effective chunk size
   */
  public int resolveChunkSize(final int requestedChunkSize) {
    if (requestedChunkSize > 0 && requestedChunkSize <= maxBlobLength) {
      return requestedChunkSize;
    }
    return DEFAULT_CHUNK_SIZE;
  }

  private void insertEntry(final VirtualPath path, final int chunkSize) {
    try {
      dao.insertEntry(path.value(), Schema.FILE_TYPE, chunkSize);
    } catch (JdbiException e) {
      final DatabaseException databaseException = DatabaseException.from(e);
      if (databaseException.isConstraintViolation()) {
        throw CreationException.fileExists(path.value());
      }
      throw CreationException.databaseError(databaseException);
    }
  }

  private void writeChunks(final long id, final InputStream source, final int chunkSize) {
    final byte[] buffer = new byte[chunkSize];
    long chunkNum = 0;
    while (true) {
      final int size;
      try {
        size = fill(source, buffer);
      } catch (IOException e) {
        throw CreationException.sourceError(e);
      }
      // A short chunk ends the file; an empty source still gets one empty chunk.
      dao.insertChunk(id, chunkNum, size == chunkSize ? buffer : Arrays.copyOf(buffer, size));
      if (size != chunkSize) {
        return;
      }
      chunkNum++;
    }
  }

  private static int fill(final InputStream source, final byte[] buffer) throws IOException {
    int filled = 0;
    while (filled < buffer.length) {
      final int read;
      try {
        read = source.read(buffer, filled, buffer.length - filled);
      } catch (InterruptedIOException e) {
        filled += Math.max(0, e.bytesTransferred);
        continue;
      }
      if (read < 0) {
        break;
      }
      filled += read;
    }
    return filled;
  }

  /**
   * Looks up the handle of a path.
   *
   * @param path the path
   * @return the handle, or empty if there is no such file
   * @throws DatabaseException if the query fails
   */
  public Optional<FileHandle> open(final String path) {
    ensureOpen();
    final VirtualPath virtualPath = VirtualPath.of(path);
    try {
      return dao.findHandle(virtualPath.value(), Schema.FILE_TYPE).map(FileHandle::of);
    } catch (JdbiException e) {
      throw DatabaseException.from(e);
    }
  }

  /**
   * The meta entry of a path.
   *
   * @param path the path
   * @return the entry, or empty if there is no such file
   * @throws DatabaseException if the query fails
   */
  public Optional<FileEntry> stat(final String path) {
    ensureOpen();
    final VirtualPath virtualPath = VirtualPath.of(path);
    try {
      return dao.stat(virtualPath.value(), Schema.FILE_TYPE);
    } catch (JdbiException e) {
      throw DatabaseException.from(e);
    }
  }

  /**
   * The size of a file. Every stored file has at least one chunk, so an empty result means the handle does not
   * refer to a file (anymore), while an empty file has size zero.
   *
   * @param fileHandle the handle
   * @return the size, or empty for a dangling handle
   * @throws DatabaseException if the query fails
   */
  public OptionalLong size(final FileHandle fileHandle) {
    ensureOpen();
    try {
      final long size = dao.size(fileHandle.id());
      return size >= 0 ? OptionalLong.of(size) : OptionalLong.empty();
    } catch (JdbiException e) {
      throw DatabaseException.from(e);
    }
  }

  /**
   * Deletes a file with all its chunks.
   *
   * @param fileHandle the handle
   * @return the number of deleted entries, zero for a dangling handle
   * @throws DatabaseException if the delete fails
   */
  public int delete(final FileHandle fileHandle) {
    ensureOpen();
    try {
      final int deleted = dao.delete(fileHandle.id());
      log.debug("delete({}): {}", fileHandle, deleted);
      return deleted;
    } catch (JdbiException e) {
      throw DatabaseException.from(e);
    }
  }

  /**
   * Copies a byte range of a file into a sink.
   *
   * <p>One query selects the chunks intersecting {@code [index, index + length)}. The first chunk is read from
   * the offset of {@code index} within it, every following chunk from its start, until {@code length} bytes
   * are copied. Content is streamed chunk by chunk through a single scratch buffer.
   *
   * @param fileHandle the handle
   * @param sink       the destination
   * @param index      the first byte
   * @param length     the number of bytes
   * @return the number of bytes written, always {@code length}
   * @throws ReadException if the range is not addressable or out of bounds, the sink fails or the database fails
   */
  public long read(final FileHandle fileHandle, final OutputStream sink, final long index, final long length) {
    ensureOpen();
    Objects.requireNonNull(sink, "sink");
    if (index < 0 || length < 0 || index > Long.MAX_VALUE - length) {
      throw ReadException.fileSystemLimits();
    }
    if (length == 0) {
      return 0;
    }
    try (ResultIterator<ChunkLocation> chunks = dao.chunks(fileHandle.id(), index, index, length)) {
      if (!chunks.hasNext()) {
        throw ReadException.outOfBounds();
      }
      final ChunkLocation first = chunks.next();
      final long offset = index - first.chunkNum() * first.chunkSize();
      if (offset < 0) {
        throw ReadException.outOfBounds();
      }
      long written = 0;
      try (ChunkReader reader = new ChunkReader(handle, (int) Math.min(first.chunkSize(), length))) {
        ChunkLocation chunk = first;
        long start = offset;
        while (true) {
          reader.reopen(chunk.chunkId());
          long count = Math.min(chunk.blobLength(), length - written);
          if (chunk == first) {
            count = Math.min(chunk.blobLength() - offset, count);
            if (count <= 0) {
              throw ReadException.outOfBounds();
            }
          }
          reader.transfer(start, (int) count, sink);
          written += count;
          if (written == length || !chunks.hasNext()) {
            break;
          }
          chunk = chunks.next();
          start = 0;
        }
      }
      if (written != length) {
        throw ReadException.outOfBounds();
      }
      return written;
    } catch (IOException e) {
      throw ReadException.sinkError(e);
    } catch (JdbiException e) {
      throw ReadException.databaseError(DatabaseException.from(e));
    }
  }

  /**
   * Checks if the file system was closed.
   *
   * @return true if closed
   */
  public boolean isClosed() {
    return closed;
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Virtual file system is closed");
    }
  }

  /**
   * Releases the precompiled statements and the connection.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    log.debug("close()");
    try {
      statementCache.close(handle.getConnection());
    } finally {
      handle.close();
    }
  }

}
