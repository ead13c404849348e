package io.github.matryoshka.cli.command;

import io.github.matryoshka.dbu.model.Database;
import io.github.matryoshka.model.Configuration;
import io.github.matryoshka.model.ImmutableConfiguration;
import picocli.CommandLine.Option;

/**
 * Options selecting the container, shared by every command.
 */
public class ContainerOptions {

  @Option(
      names = {"--db", "-d"},
      description = "Path of the container database (default: env MATRYOSHKA_DB)",
      defaultValue = "${MATRYOSHKA_DB}")
  String database;

  @Option(
      names = {"--no-create"},
      description = "Fail instead of creating the virtual file system if the container has none")
  boolean noCreate;

  /**
   * Checks if a container was given.
   *
   * @return true if present
   */
  public boolean isPresent() {
    return database != null && !database.isEmpty();
  }

  /**
   * Builds the configuration of the selected container.
   *
   * @param createIfMissing whether the command may create the file system
   * @return the configuration
   */
  public Configuration configuration(final boolean createIfMissing) {
    return ImmutableConfiguration.builder()
        .database(Database.forSqliteFile(database))
        .createIfMissing(createIfMissing && !noCreate)
        .build();
  }

}
