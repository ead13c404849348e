package io.github.matryoshka.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.matryoshka.BaseJdbiTest;
import io.github.matryoshka.dao.Schema;
import io.github.matryoshka.exception.ReadException;
import java.io.ByteArrayOutputStream;
import org.jdbi.v3.core.Handle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChunkReaderTest extends BaseJdbiTest {

  private Handle handle;
  private long first;
  private long second;

  @BeforeEach
  void setup() {
    handle = openHandle();
    new SchemaManager(handle).create();
    handle.execute(Schema.SQL_CREATE_HANDLE, "file", Schema.FILE_TYPE, 4);
    handle.execute(Schema.SQL_CREATE_CHUNK, 1L, 0L, new byte[]{1, 2, 3, 4});
    handle.execute(Schema.SQL_CREATE_CHUNK, 1L, 1L, new byte[]{5, 6});
    first = chunkId(0);
    second = chunkId(1);
  }

  private long chunkId(final long chunkNum) {
    return handle.createQuery("SELECT chunk_id FROM " + Schema.DATA_TABLE + " WHERE chunk_num = ?")
        .bind(0, chunkNum)
        .mapTo(Long.class)
        .one();
  }

  @Test
  void transfer_reusesBufferAcrossChunks() throws Exception {
    final ByteArrayOutputStream sink = new ByteArrayOutputStream();

    try (ChunkReader reader = new ChunkReader(handle, 4)) {
      reader.reopen(first);
      reader.transfer(1, 3, sink);
      reader.reopen(second);
      reader.transfer(0, 2, sink);
    }

    assertThat(sink.toByteArray()).containsExactly(2, 3, 4, 5, 6);
  }

  @Test
  void transfer_beyondBlob() {
    try (ChunkReader reader = new ChunkReader(handle, 4)) {
      reader.reopen(second);
      assertThatThrownBy(() -> reader.transfer(1, 2, new ByteArrayOutputStream()))
          .isInstanceOf(ReadException.class)
          .extracting("reason").isEqualTo(ReadException.Reason.OUT_OF_BOUNDS);
    }
  }

  @Test
  void transfer_afterClose() {
    final ChunkReader reader = new ChunkReader(handle, 4);
    reader.close();

    assertThatThrownBy(() -> reader.reopen(first)).isInstanceOf(IllegalStateException.class);
  }

}
