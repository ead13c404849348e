package io.github.matryoshka.dbu.model;

import org.immutables.value.Value;

/**
 * Connection details for the database holding a virtual file system.
 */
@Value.Immutable
public interface Database {

  /**
   * The JDBC url, e.g. {@code jdbc:sqlite:/path/to/container.db}.
   *
   * @return the url
   */
  String url();

  /**
   * Username. SQLite ignores it.
   *
   * @return the username
   */
  @Value.Default
  default String username() {
    return "";
  }

  /**
   * Password. SQLite ignores it.
   *
   * @return the password
   */
  @Value.Default
  default String password() {
    return "";
  }

  /**
   * Builds the url for an SQLite container file.
   *
   * @param containerPath path of the database file on the host file system
   * @return the database
   */
  static Database forSqliteFile(final String containerPath) {
    return ImmutableDatabase.builder().url("jdbc:sqlite:" + containerPath).build();
  }

}
