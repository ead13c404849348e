package io.github.matryoshka.model;

import org.immutables.value.Value;

/**
 * The persisted meta entry of a file.
 */
@Value.Immutable
public interface FileEntry {

  /**
   * The handle value (row id).
   *
   * @return the id
   */
  long id();

  /**
   * The normalized path.
   *
   * @return the path
   */
  String path();

  /**
   * The entry type discriminator.
   *
   * @return the type
   */
  int type();

  /**
   * Flags, reserved. Zero when unset.
   *
   * @return the flags
   */
  int flags();

  /**
   * The chunk size fixed at creation.
   *
   * @return the chunk size
   */
  int chunkSize();

  /**
   * The handle of this entry.
   *
   * @return the handle
   */
  @Value.Derived
  default FileHandle handle() {
    return FileHandle.of(id());
  }

}
