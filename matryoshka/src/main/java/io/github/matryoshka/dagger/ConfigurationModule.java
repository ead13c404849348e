package io.github.matryoshka.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.matryoshka.dbu.model.Database;
import io.github.matryoshka.model.Configuration;
import javax.inject.Singleton;

/**
 * Supplies the caller's configuration to the graph.
 */
@Module
public class ConfigurationModule {

  private final Configuration configuration;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final Configuration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration.
   *
   * @return the configuration
   */
  @Provides
  @Singleton
  public Configuration configuration() {
    return configuration;
  }

  /**
   * Database.
   *
   * @param configuration the configuration
   * @return the database
   */
  @Provides
  @Singleton
  public Database database(final Configuration configuration) {
    return configuration.database();
  }

}
