package io.github.matryoshka.manager;

import io.github.matryoshka.dao.Schema;
import io.github.matryoshka.model.MetaData;
import java.util.Comparator;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jdbi.v3.core.Handle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers and creates the tables of a virtual file system.
 *
 * <p>The schema version is purely structural: it is the number suffixed to the meta table name. If several
 * meta tables exist, the highest version wins.
 */
public class SchemaManager {

  private static final Logger log = LoggerFactory.getLogger(SchemaManager.class);

  private static final Pattern META_TABLE_PATTERN =
      Pattern.compile(Pattern.quote(Schema.META_TABLE_PREFIX) + "([0-9]+)");

  private final Handle handle;

  /**
   * Instantiates a new schema manager.
   *
   * @param handle the handle of the database
   */
  public SchemaManager(final Handle handle) {
    this.handle = handle;
  }

  /**
   * Extracts the schema version from a table name.
   *
   * @param tableName the table name
   * @return the version, if the name is a meta table name
   */
  public static Optional<Integer> extractVersion(final String tableName) {
    final Matcher matcher = META_TABLE_PATTERN.matcher(tableName);
    if (!matcher.lookingAt()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Integer.parseInt(matcher.group(1)));
    } catch (NumberFormatException e) {
      log.debug("Ignoring meta table with unparsable version: {}", tableName);
      return Optional.empty();
    }
  }

  /**
   * The name of the meta table of a version.
   *
   * @param version the version
   * @return the table name
   */
  public static String metaTableName(final int version) {
    return Schema.META_TABLE_PREFIX + version;
  }

  /**
   * Scans the catalog for meta tables.
   *
   * @return the meta data of the most recent version, or empty if the database holds no file system
   */
  public Optional<MetaData> discover() {
    log.trace("discover()");
    return handle.createQuery(Schema.SQL_FIND_META_TABLES)
        .bind(0, Schema.META_TABLE_PREFIX + "%")
        .mapTo(String.class)
        .list()
        .stream()
        .map(SchemaManager::extractVersion)
        .flatMap(Optional::stream)
        .max(Comparator.naturalOrder())
        .map(MetaData::of);
  }

  /**
   * Creates the meta and data tables of the current version in one transaction.
   *
   * @return the meta data of the created file system
   */
  public MetaData create() {
    log.info("Creating virtual file system (version {})", Schema.CURRENT_VERSION);
    handle.useTransaction(transaction -> {
      transaction.execute(Schema.SQL_CREATE_META);
      transaction.execute(Schema.SQL_CREATE_DATA);
    });
    return MetaData.of(Schema.CURRENT_VERSION);
  }

}
