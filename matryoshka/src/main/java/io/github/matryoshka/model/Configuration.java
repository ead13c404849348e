package io.github.matryoshka.model;

import io.github.matryoshka.dbu.model.Database;
import org.immutables.value.Value;

/**
 * The configuration of a virtual file system.
 */
@Value.Immutable
public interface Configuration {

  /**
   * SQLite's compiled-in maximum length of a blob (SQLITE_MAX_LENGTH).
   */
  int SQLITE_MAX_LENGTH = 1_000_000_000;

  /**
   * The database holding the file system.
   *
   * @return the database
   */
  Database database();

  /**
   * Create the file system tables if the database has none.
   *
   * @return true to create
   */
  @Value.Default
  default boolean createIfMissing() {
    return true;
  }

  /**
   * A cap on the chunk size of new files. The connection's own blob limit applies as well; the smaller wins.
   *
   * @return the max blob length in bytes
   */
  @Value.Default
  default int maxBlobLength() {
    return SQLITE_MAX_LENGTH;
  }

  /**
   * Validates the configuration.
   */
  @Value.Check
  default void check() {
    if (maxBlobLength() < 1) {
      throw new IllegalStateException("maxBlobLength must be positive: " + maxBlobLength());
    }
  }

}
