package io.github.matryoshka.model;

import org.immutables.value.Value;

/**
 * Where a chunk of a file lives, without its content.
 */
@Value.Immutable
public interface ChunkLocation {

  /**
   * Row id of the chunk, used to fetch its content.
   *
   * @return the chunk id
   */
  long chunkId();

  /**
   * Zero based position of the chunk within its file.
   *
   * @return the chunk num
   */
  long chunkNum();

  /**
   * The chunk size of the owning file.
   *
   * @return the chunk size
   */
  int chunkSize();

  /**
   * The actual number of bytes stored in this chunk.
   *
   * @return the blob length
   */
  int blobLength();

}
