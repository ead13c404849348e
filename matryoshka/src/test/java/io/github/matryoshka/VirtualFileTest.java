package io.github.matryoshka;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.matryoshka.exception.CreationException;
import io.github.matryoshka.exception.LoadingException;
import io.github.matryoshka.exception.ReadException;
import io.github.matryoshka.model.FileHandle;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VirtualFileTest extends BaseJdbiTest {

  private VirtualFileSystem fileSystem;

  @BeforeEach
  void setup() {
    fileSystem = loadFileSystem(true);
  }

  private VirtualFile create(final String path, final byte[] data, final int chunkSize) {
    return VirtualFile.create(fileSystem, path, new ByteArrayInputStream(data), chunkSize);
  }

  @Test
  void sequentialRead() {
    final VirtualFile file = create("file", new byte[]{1, 2, 3, 4, 5}, 3);
    final byte[] buffer = new byte[3];

    assertThat(file.read(buffer)).isEqualTo(3);
    assertThat(buffer).containsExactly(1, 2, 3);
    assertThat(file.position()).isEqualTo(3);

    assertThat(file.readToEnd()).containsExactly(4, 5);

    assertThat(file.read(buffer)).isZero();
    assertThat(file.readToEnd()).isEmpty();
  }

  @Test
  void sequentialRead_matchesRandomRead() {
    final byte[] data = VirtualFileSystemTest.content(1000);
    final VirtualFile file = create("file", data, 64);
    final ByteArrayOutputStream sequential = new ByteArrayOutputStream();
    final byte[] buffer = new byte[37];

    int read;
    while ((read = file.read(buffer, 0, buffer.length)) > 0) {
      sequential.write(buffer, 0, read);
    }

    final ByteArrayOutputStream whole = new ByteArrayOutputStream();
    assertThat(file.transferTo(whole)).isEqualTo(1000);
    assertThat(sequential.toByteArray()).isEqualTo(whole.toByteArray()).isEqualTo(data);
  }

  @Test
  void read_intoOffset() {
    final VirtualFile file = create("file", new byte[]{7, 8, 9}, 2);
    final byte[] buffer = new byte[5];

    assertThat(file.read(buffer, 1, 4)).isEqualTo(3);
    assertThat(buffer).containsExactly(0, 7, 8, 9, 0);
  }

  @Test
  void randomRead_doesNotMoveCursor() {
    final VirtualFile file = create("file", new byte[]{1, 2, 3, 4}, 2);
    final ByteArrayOutputStream sink = new ByteArrayOutputStream();

    file.randomRead(sink, 1, 2);

    assertThat(sink.toByteArray()).containsExactly(2, 3);
    assertThat(file.position()).isZero();
  }

  @Test
  void seek() {
    final VirtualFile file = create("file", new byte[]{1, 2, 3, 4}, 2);

    file.seek(3);
    assertThat(file.readToEnd()).containsExactly(4);
    file.seek(0);
    assertThat(file.readToEnd()).containsExactly(1, 2, 3, 4);
    assertThatThrownBy(() -> file.seek(5)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void emptyFile() {
    final VirtualFile file = create("empty", new byte[0], 0);

    assertThat(file.isEmpty()).isTrue();
    assertThat(file.length()).isZero();
    assertThat(file.readToEnd()).isEmpty();
    assertThat(VirtualFile.load(fileSystem, "empty").isEmpty()).isTrue();
  }

  @Test
  void load() {
    final VirtualFile created = create("folder/file", new byte[]{1, 2, 3}, 2);

    final VirtualFile loaded = VirtualFile.load(fileSystem, "/folder/../folder/file");

    assertThat(loaded.handle()).isEqualTo(created.handle());
    assertThat(loaded.length()).isEqualTo(3);
  }

  @Test
  void load_missing() {
    assertThatThrownBy(() -> VirtualFile.load(fileSystem, "missing"))
        .isInstanceOf(LoadingException.class)
        .hasMessage("Error during file loading: The requested file does not exist")
        .extracting("reason").isEqualTo(LoadingException.Reason.FILE_NOT_FOUND);
  }

  @Test
  void fromHandle() {
    final VirtualFile created = create("file", new byte[]{1, 2, 3}, 2);

    assertThat(VirtualFile.fromHandle(fileSystem, created.handle()).length()).isEqualTo(3);
    assertThatThrownBy(() -> VirtualFile.fromHandle(fileSystem, FileHandle.of(42)))
        .isInstanceOf(LoadingException.class)
        .extracting("reason").isEqualTo(LoadingException.Reason.FILE_NOT_FOUND);
  }

  @Test
  void create_existing() {
    create("file", new byte[]{1}, 1);

    assertThatThrownBy(() -> create("file", new byte[]{2}, 1))
        .isInstanceOf(CreationException.class)
        .extracting("reason").isEqualTo(CreationException.Reason.FILE_EXISTS);
  }

  @Test
  void delete() {
    final VirtualFile file = create("file", new byte[]{1, 2, 3}, 2);

    assertThat(file.delete()).isTrue();
    assertThat(file.delete()).isFalse();

    assertThatThrownBy(() -> VirtualFile.load(fileSystem, "file"))
        .extracting("reason").isEqualTo(LoadingException.Reason.FILE_NOT_FOUND);
    assertThatThrownBy(file::readToEnd)
        .isInstanceOf(ReadException.class)
        .extracting("reason").isEqualTo(ReadException.Reason.OUT_OF_BOUNDS);
    assertThat(create("file", new byte[]{4}, 2).length()).isEqualTo(1);
  }

  @Test
  void inputStream() throws IOException {
    final byte[] data = VirtualFileSystemTest.content(300);
    final VirtualFile file = create("file", data, 100);

    try (InputStream in = file.inputStream()) {
      assertThat(in.read()).isEqualTo(0);
      assertThat(in.skip(9)).isEqualTo(9);
      assertThat(in.available()).isEqualTo(290);
      final byte[] rest = in.readAllBytes();
      assertThat(rest).hasSize(290);
      assertThat(rest[0]).isEqualTo(data[10]);
      assertThat(in.read()).isEqualTo(-1);
      assertThat(in.read(new byte[4], 0, 4)).isEqualTo(-1);
    }
    assertThat(file.position()).isEqualTo(300);
  }

  @Test
  void inputStream_wrapsEngineFailures() {
    final VirtualFile file = create("file", new byte[]{1, 2}, 1);
    file.delete();

    assertThatThrownBy(() -> file.inputStream().read())
        .isInstanceOf(IOException.class)
        .hasCauseInstanceOf(ReadException.class);
  }

}
