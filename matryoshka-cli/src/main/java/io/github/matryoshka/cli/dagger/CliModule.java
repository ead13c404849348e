package io.github.matryoshka.cli.dagger;

import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Module;
import dagger.Provides;
import io.github.matryoshka.VirtualFileSystem;
import io.github.matryoshka.cli.transfer.ContainerTransfer;
import javax.inject.Singleton;

/**
 * Dagger module providing CLI dependencies.
 */
@Module
public class CliModule {

  /**
   * Object mapper for JSON output.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    return new ObjectMapper();
  }

  /**
   * Provide container transfer.
   *
   * @param virtualFileSystem the virtual file system
   * @return the container transfer
   */
  @Provides
  @Singleton
  public ContainerTransfer containerTransfer(final VirtualFileSystem virtualFileSystem) {
    return new ContainerTransfer(virtualFileSystem);
  }
}
