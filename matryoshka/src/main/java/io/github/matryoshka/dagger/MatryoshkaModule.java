package io.github.matryoshka.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.matryoshka.VirtualFileSystem;
import io.github.matryoshka.dbu.factory.JdbiFactory;
import io.github.matryoshka.exception.DatabaseException;
import io.github.matryoshka.exception.FileSystemException;
import io.github.matryoshka.model.Configuration;
import javax.inject.Singleton;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;

/**
 * The type Matryoshka module.
 */
@Module
public class MatryoshkaModule {

  /**
   * Instantiates a new Matryoshka module.
   */
  public MatryoshkaModule() {
    // Default constructor
  }

  /**
   * Jdbi.
   *
   * @param factory the factory
   * @return the jdbi
   */
  @Provides
  @Singleton
  public Jdbi jdbi(final JdbiFactory factory) {
    return factory.createJdbi();
  }

  /**
   * Loads the virtual file system on a dedicated handle.
   *
   * @param jdbi          the jdbi
   * @param configuration the configuration
   * @return the virtual file system, owning the handle
   * @throws FileSystemException if the database cannot be opened or holds no usable file system
   */
  @Provides
  @Singleton
  public VirtualFileSystem virtualFileSystem(final Jdbi jdbi, final Configuration configuration) {
    final Handle handle;
    try {
      handle = jdbi.open();
    } catch (JdbiException e) {
      throw FileSystemException.databaseError(DatabaseException.from(e));
    }
    try {
      return VirtualFileSystem.load(handle, configuration.createIfMissing(), configuration.maxBlobLength());
    } catch (RuntimeException e) {
      handle.close();
      throw e;
    }
  }

}
