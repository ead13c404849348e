package io.github.matryoshka.model;

import org.immutables.value.Value;

/**
 * An opaque reference to one file entry: the row id of its meta entry.
 *
 * <p>Handles can be copied freely but do not keep the entry alive. Once the entry is deleted the handle
 * dangles; revalidate with {@code VirtualFileSystem#size(FileHandle)} before trusting an old handle.
 */
@Value.Immutable
public interface FileHandle {

  /**
   * Wraps a raw handle value.
   *
   * @param id the row id
   * @return the handle
   */
  static FileHandle of(final long id) {
    return ImmutableFileHandle.of(id);
  }

  /**
   * The raw handle value.
   *
   * @return the id
   */
  @Value.Parameter
  long id();

}
