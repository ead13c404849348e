package io.github.matryoshka.model;

import org.immutables.value.Value;

/**
 * Describes the schema generation of a virtual file system. It is discovered from the table names of the
 * database, never stored separately.
 */
@Value.Immutable
public interface MetaData {

  /**
   * Meta data of a specific version.
   *
   * @param version the version
   * @return the meta data
   */
  static MetaData of(final int version) {
    return ImmutableMetaData.of(version);
  }

  /**
   * The schema version.
   *
   * @return the version
   */
  @Value.Parameter
  int version();

}
