package io.github.matryoshka.dbu.factory;

import io.github.matryoshka.dbu.model.Database;
import java.util.Properties;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the {@link Jdbi} instance for a configured database.
 */
@Singleton
public class JdbiFactory {

  private static final Logger log = LoggerFactory.getLogger(JdbiFactory.class);

  private final Database database;

  /**
   * Instantiates a new Jdbi factory.
   *
   * @param database the database
   */
  @Inject
  public JdbiFactory(final Database database) {
    log.info("JdbiFactory({})", database.url());
    this.database = database;
  }

  /**
   * Creates the jdbi with the sql object plugin installed.
   *
   * @return the jdbi
   */
  public Jdbi createJdbi() {
    log.trace("createJdbi()");
    final Jdbi jdbi = Jdbi.create(database.url(), connectionProperties());
    jdbi.installPlugin(new SqlObjectPlugin());
    return jdbi;
  }

  private Properties connectionProperties() {
    final Properties properties = new Properties();
    if (!database.username().isEmpty()) {
      properties.setProperty("user", database.username());
    }
    if (!database.password().isEmpty()) {
      properties.setProperty("password", database.password());
    }
    return properties;
  }

}
