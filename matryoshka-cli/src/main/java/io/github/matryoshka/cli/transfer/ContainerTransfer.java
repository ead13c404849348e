package io.github.matryoshka.cli.transfer;

import io.github.matryoshka.VirtualFile;
import io.github.matryoshka.VirtualFileSystem;
import io.github.matryoshka.exception.CreationException;
import io.github.matryoshka.exception.LoadingException;
import io.github.matryoshka.exception.ReadException;
import io.github.matryoshka.model.FileHandle;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.nio.channels.Channels;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies files between the host file system and a container.
 */
public class ContainerTransfer {

  private static final Logger log = LoggerFactory.getLogger(ContainerTransfer.class);

  private final VirtualFileSystem fileSystem;

  /**
   * Instantiates a new Container transfer.
   *
   * @param fileSystem the file system
   */
  public ContainerTransfer(final VirtualFileSystem fileSystem) {
    this.fileSystem = fileSystem;
  }

  /**
   * Streams a host file into a new file of the container.
   *
   * @param localFile the host file
   * @param innerPath the path inside the container
   * @param chunkSize the requested chunk size, zero or negative for the default
   * @return the handle of the new file
   * @throws IOException       if the host file cannot be opened
   * @throws CreationException if the container rejects the file
   */
  public FileHandle push(final Path localFile, final String innerPath, final int chunkSize) throws IOException {
    log.debug("push({}, {}, {})", localFile, innerPath, chunkSize);
    try (InputStream in = new BufferedInputStream(Files.newInputStream(localFile))) {
      return fileSystem.create(innerPath, in, Math.max(0, chunkSize));
    }
  }

  /**
   * Copies a file of the container to the host. The host file is created or truncated and sized up front.
   *
   * @param innerPath the path inside the container
   * @param localFile the host file
   * @return the number of bytes copied
   * @throws IOException      if the host file cannot be written or fewer bytes than expected were written
   * @throws LoadingException if there is no such file
   * @throws ReadException    if reading the file fails
   */
  public long pull(final String innerPath, final Path localFile) throws IOException {
    log.debug("pull({}, {})", innerPath, localFile);
    final VirtualFile file = VirtualFile.load(fileSystem, innerPath);
    final long written;
    try (RandomAccessFile target = new RandomAccessFile(localFile.toFile(), "rw")) {
      target.setLength(0);
      target.setLength(file.length());
      final OutputStream out = new BufferedOutputStream(Channels.newOutputStream(target.getChannel()));
      written = file.transferTo(out);
      out.flush();
    }
    if (written != file.length()) {
      throw new IOException("Less than expected bytes were written: " + written + " of " + file.length());
    }
    return written;
  }

}
