package io.github.matryoshka.cli.dagger;

import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Component;
import io.github.matryoshka.VirtualFileSystem;
import io.github.matryoshka.cli.transfer.ContainerTransfer;
import io.github.matryoshka.dagger.ConfigurationModule;
import io.github.matryoshka.dagger.MatryoshkaModule;
import io.github.matryoshka.model.Configuration;
import javax.inject.Singleton;

/**
 * Dagger component for CLI tool.
 */
@Singleton
@Component(modules = {CliModule.class, MatryoshkaModule.class, ConfigurationModule.class})
public interface CliComponent {

  /**
   * Create CLI component with configuration.
   *
   * @param configuration the configuration
   * @return the CLI component
   */
  static CliComponent create(final Configuration configuration) {
    return DaggerCliComponent.builder()
        .configurationModule(new ConfigurationModule(configuration))
        .build();
  }

  /**
   * The virtual file system of the container.
   *
   * @return the virtual file system
   */
  VirtualFileSystem virtualFileSystem();

  /**
   * Container transfer.
   *
   * @return the container transfer
   */
  ContainerTransfer containerTransfer();

  /**
   * Object mapper.
   *
   * @return the object mapper
   */
  ObjectMapper objectMapper();

  /**
   * Configuration.
   *
   * @return the configuration
   */
  Configuration configuration();
}
