package io.github.matryoshka.dagger;

import dagger.Component;
import io.github.matryoshka.VirtualFileSystem;
import io.github.matryoshka.model.Configuration;
import javax.inject.Singleton;

/**
 * The interface Matryoshka component.
 */
@Singleton
@Component(modules = {MatryoshkaModule.class, ConfigurationModule.class})
public interface MatryoshkaComponent {

  /**
   * Instance matryoshka component.
   *
   * @param configuration the configuration
   * @return the matryoshka component
   */
  static MatryoshkaComponent instance(final Configuration configuration) {
    return DaggerMatryoshkaComponent.builder().configurationModule(new ConfigurationModule(configuration)).build();
  }

  /**
   * The virtual file system of the configured database. Loaded on first access; the caller closes it.
   *
   * @return the virtual file system
   */
  VirtualFileSystem virtualFileSystem();

  /**
   * Configuration.
   *
   * @return the configuration
   */
  Configuration configuration();

}
