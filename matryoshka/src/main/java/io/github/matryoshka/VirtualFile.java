package io.github.matryoshka;

import io.github.matryoshka.exception.CreationException;
import io.github.matryoshka.exception.DatabaseException;
import io.github.matryoshka.exception.LoadingException;
import io.github.matryoshka.exception.ReadException;
import io.github.matryoshka.model.FileHandle;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * A view on one file of a {@link VirtualFileSystem}.
 *
 * <p>The size is fetched once when the view is built. Besides random reads the view keeps a cursor for
 * sequential reads. A view borrows its file system and must not be used after the file system is closed.
 */
public class VirtualFile {

  private final VirtualFileSystem fileSystem;
  private final FileHandle handle;
  private final long length;
  private long position;

  private VirtualFile(final VirtualFileSystem fileSystem, final FileHandle handle, final long length) {
    this.fileSystem = fileSystem;
    this.handle = handle;
    this.length = length;
  }

  /**
   * Creates a new file.
   *
   * @param fileSystem the file system
   * @param path       the path
   * @param source     the content, read until exhausted
   * @param chunkSize  the requested chunk size, see {@link VirtualFileSystem#resolveChunkSize(int)}
   * @return the file
   * @throws CreationException if the file cannot be created
   */
  public static VirtualFile create(final VirtualFileSystem fileSystem,
                                   final String path,
                                   final InputStream source,
                                   final int chunkSize) {
    final FileHandle handle = fileSystem.create(path, source, chunkSize);
    try {
      final OptionalLong size = fileSystem.size(handle);
      return new VirtualFile(fileSystem, handle, size.orElse(0));
    } catch (DatabaseException e) {
      throw CreationException.databaseError(e);
    }
  }

  /**
   * Opens an existing file by path.
   *
   * @param fileSystem the file system
   * @param path       the path
   * @return the file
   * @throws LoadingException if there is no such file or the database fails
   */
  public static VirtualFile load(final VirtualFileSystem fileSystem, final String path) {
    try {
      final FileHandle handle = fileSystem.open(path).orElseThrow(LoadingException::fileNotFound);
      return fromHandle(fileSystem, handle);
    } catch (DatabaseException e) {
      throw LoadingException.databaseError(e);
    }
  }

  /**
   * Rebuilds the view of a handle obtained earlier. The handle is revalidated.
   *
   * @param fileSystem the file system
   * @param handle     the handle
   * @return the file
   * @throws LoadingException if the handle dangles or the database fails
   */
  public static VirtualFile fromHandle(final VirtualFileSystem fileSystem, final FileHandle handle) {
    Objects.requireNonNull(handle, "handle");
    try {
      final long size = fileSystem.size(handle).orElseThrow(LoadingException::fileNotFound);
      return new VirtualFile(fileSystem, handle, size);
    } catch (DatabaseException e) {
      throw LoadingException.databaseError(e);
    }
  }

  /**
   * The handle of the file.
   *
   * @return the handle
   */
  public FileHandle handle() {
    return handle;
  }

  /**
   * The size in bytes, as fetched when the view was built.
   *
   * @return the length
   */
  public long length() {
    return length;
  }

  /**
   * Checks if the file has no content.
   *
   * @return true if the length is zero
   */
  public boolean isEmpty() {
    return length == 0;
  }

  /**
   * The cursor of sequential reads.
   *
   * @return the position
   */
  public long position() {
    return position;
  }

  /**
   * Moves the cursor.
   *
   * @param newPosition the new position, at most {@link #length()}
   */
  public void seek(final long newPosition) {
    if (newPosition < 0 || newPosition > length) {
      throw new IllegalArgumentException("Position " + newPosition + " outside of [0, " + length + "]");
    }
    this.position = newPosition;
  }

  /**
   * Copies a byte range into a sink. The cursor is not touched.
   *
   * @param sink   the sink
   * @param index  the first byte
   * @param count  the number of bytes
   * @return the number of bytes written
   * @throws ReadException if the range is out of bounds or reading fails
   */
  public long randomRead(final OutputStream sink, final long index, final long count) {
    return fileSystem.read(handle, sink, index, count);
  }

  /**
   * Copies the whole file into a sink.
   *
   * @param sink the sink
   * @return the number of bytes written
   */
  public long transferTo(final OutputStream sink) {
    return randomRead(sink, 0, length);
  }

  /**
   * Reads from the cursor and advances it.
   *
   * @param buffer the destination
   * @param offset the first index to fill
   * @param len    the maximum number of bytes
   * @return the number of bytes read, zero at the end of the file
   */
  public int read(final byte[] buffer, final int offset, final int len) {
    Objects.checkFromIndexSize(offset, len, buffer.length);
    final int count = (int) Math.min(len, length - position);
    if (count <= 0) {
      return 0;
    }
    randomRead(new ArraySink(buffer, offset), position, count);
    position += count;
    return count;
  }

  /**
   * Reads from the cursor into a whole array and advances the cursor.
   *
   * @param buffer the destination
   * @return the number of bytes read, zero at the end of the file
   */
  public int read(final byte[] buffer) {
    return read(buffer, 0, buffer.length);
  }

  /**
   * Reads everything from the cursor to the end of the file.
   *
   * @return the remaining bytes, empty at the end of the file
   */
  public byte[] readToEnd() {
    final long remaining = length - position;
    if (remaining <= 0) {
      return new byte[0];
    }
    if (remaining > Integer.MAX_VALUE - 8) {
      throw ReadException.fileSystemLimits();
    }
    final ByteArrayOutputStream out = new ByteArrayOutputStream((int) remaining);
    randomRead(out, position, remaining);
    position = length;
    return out.toByteArray();
  }

  /**
   * A stream over the cursor. Reading the stream advances this view's cursor.
   *
   * @return the input stream
   */
  public InputStream inputStream() {
    return new VirtualFileInputStream(this);
  }

  /**
   * Deletes the file. The view must not be read afterwards.
   *
   * @return true if an entry was deleted
   */
  public boolean delete() {
    return fileSystem.delete(handle) == 1;
  }

  @Override
  public String toString() {
    return "VirtualFile{" + handle.id() + ", length=" + length + ", position=" + position + "}";
  }

  /**
   * Writes into a fixed region of an array.
   */
  private static class ArraySink extends OutputStream {

    private final byte[] target;
    private int next;

    ArraySink(final byte[] target, final int offset) {
      this.target = target;
      this.next = offset;
    }

    @Override
    public void write(final int b) {
      target[next++] = (byte) b;
    }

    @Override
    public void write(final byte[] b, final int off, final int len) {
      System.arraycopy(b, off, target, next, len);
      next += len;
    }
  }

}
