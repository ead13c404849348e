package io.github.matryoshka;

import io.github.matryoshka.exception.MatryoshkaException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Adapts the cursor of a {@link VirtualFile} to an {@link InputStream}. Engine failures surface as
 * {@link IOException}.
 */
public class VirtualFileInputStream extends InputStream {

  private final VirtualFile file;

  /**
   * Instantiates a new stream over a file's cursor.
   *
   * @param file the file
   */
  public VirtualFileInputStream(final VirtualFile file) {
    this.file = file;
  }

  @Override
  public int read() throws IOException {
    final byte[] single = new byte[1];
    return read(single, 0, 1) < 0 ? -1 : single[0] & 0xFF;
  }

  @Override
  public int read(final byte[] b, final int off, final int len) throws IOException {
    if (len == 0) {
      return 0;
    }
    if (available() == 0) {
      return -1;
    }
    try {
      return file.read(b, off, len);
    } catch (MatryoshkaException e) {
      throw new IOException(e.getMessage(), e);
    }
  }

  @Override
  public int available() {
    return (int) Math.min(Integer.MAX_VALUE, file.length() - file.position());
  }

  @Override
  public long skip(final long n) {
    if (n <= 0) {
      return 0;
    }
    final long skipped = Math.min(n, file.length() - file.position());
    file.seek(file.position() + skipped);
    return skipped;
  }

}
