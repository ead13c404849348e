package io.github.matryoshka.cli.transfer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.matryoshka.VirtualFileSystem;
import io.github.matryoshka.dbu.factory.JdbiFactory;
import io.github.matryoshka.dbu.model.Database;
import io.github.matryoshka.exception.CreationException;
import io.github.matryoshka.exception.LoadingException;
import io.github.matryoshka.model.FileHandle;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ContainerTransferTest {

  @TempDir Path tempDir;

  @Mock private VirtualFileSystem mockFileSystem;

  private VirtualFileSystem fileSystem;
  private ContainerTransfer containerTransfer;

  @BeforeEach
  void setUp() {
    final Database database = Database.forSqliteFile(tempDir.resolve("container.db").toString());
    fileSystem = VirtualFileSystem.load(new JdbiFactory(database).createJdbi().open(), true);
    containerTransfer = new ContainerTransfer(fileSystem);
  }

  @AfterEach
  void tearDown() {
    fileSystem.close();
  }

  private static byte[] content(final int size) {
    final byte[] bytes = new byte[size];
    for (int i = 0; i < size; i++) {
      bytes[i] = (byte) (i * 31);
    }
    return bytes;
  }

  @Test
  void pushThenPull_roundTrips() throws IOException {
    final byte[] data = content(10_000);
    final Path source = Files.write(tempDir.resolve("source.bin"), data);

    final FileHandle handle = containerTransfer.push(source, "folder/data.bin", 1024);
    final long written = containerTransfer.pull("folder/data.bin", tempDir.resolve("copy.bin"));

    assertThat(fileSystem.open("folder/data.bin")).contains(handle);
    assertThat(fileSystem.stat("folder/data.bin").orElseThrow().chunkSize()).isEqualTo(1024);
    assertThat(written).isEqualTo(10_000);
    assertThat(Files.readAllBytes(tempDir.resolve("copy.bin"))).isEqualTo(data);
  }

  @Test
  void pull_truncatesExistingHostFile() throws IOException {
    containerTransfer.push(Files.write(tempDir.resolve("small.bin"), content(3)), "small", 2);
    final Path target = Files.write(tempDir.resolve("target.bin"), content(100));

    containerTransfer.pull("small", target);

    assertThat(Files.readAllBytes(target)).isEqualTo(content(3));
  }

  @Test
  void pull_emptyFile() throws IOException {
    containerTransfer.push(Files.write(tempDir.resolve("empty.bin"), new byte[0]), "empty", -1);

    assertThat(containerTransfer.pull("empty", tempDir.resolve("out.bin"))).isZero();
    assertThat(Files.size(tempDir.resolve("out.bin"))).isZero();
  }

  @Test
  void pull_missing() {
    assertThatThrownBy(() -> containerTransfer.pull("missing", tempDir.resolve("out.bin")))
        .isInstanceOf(LoadingException.class);
  }

  @Test
  void push_missingHostFile() {
    assertThatThrownBy(() -> containerTransfer.push(tempDir.resolve("nope"), "inner", 1))
        .isInstanceOf(NoSuchFileException.class);
  }

  @Test
  void push_existing() throws IOException {
    final Path source = Files.write(tempDir.resolve("source.bin"), content(3));
    containerTransfer.push(source, "inner", 1);

    assertThatThrownBy(() -> containerTransfer.push(source, "inner", 1))
        .isInstanceOf(CreationException.class)
        .extracting("reason").isEqualTo(CreationException.Reason.FILE_EXISTS);
  }

  @Test
  void push_negativeChunkSizeLetsContainerChoose() throws IOException {
    final Path source = Files.write(tempDir.resolve("source.bin"), content(3));
    when(mockFileSystem.create(eq("inner"), any(InputStream.class), eq(0))).thenReturn(FileHandle.of(7));

    final FileHandle handle = new ContainerTransfer(mockFileSystem).push(source, "inner", -5);

    assertThat(handle).isEqualTo(FileHandle.of(7));
    verify(mockFileSystem).create(eq("inner"), any(InputStream.class), eq(0));
  }

}
