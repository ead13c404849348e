package io.github.matryoshka.cli.command;

import io.github.matryoshka.VirtualFileSystem;
import io.github.matryoshka.cli.dagger.CliComponent;
import io.github.matryoshka.exception.MatryoshkaException;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Base of the commands working on one container. Opens the virtual file system, runs the command and turns every
 * failure into a message on the error stream and exit code 1.
 */
public abstract class ContainerCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(ContainerCommand.class);

  @Mixin
  ContainerOptions container;

  @Spec
  CommandSpec spec;

  /**
   * Whether the command may create a missing file system. Reading commands do not.
   *
   * @return true to create
   */
  protected boolean createsFileSystem() {
    return false;
  }

  /**
   * Runs the command.
   *
   * @param component  the wiring of the container
   * @param fileSystem the loaded file system
   * @param out        the standard output of the command line
   * @return the exit code
   * @throws IOException if the host file system fails
   */
  protected abstract int execute(CliComponent component, VirtualFileSystem fileSystem, PrintWriter out)
      throws IOException;

  @Override
  public Integer call() {
    final PrintWriter err = spec.commandLine().getErr();
    if (!container.isPresent()) {
      log.error("Container is required. Set --db or MATRYOSHKA_DB environment variable.");
      err.println("Container is required. Set --db or MATRYOSHKA_DB environment variable.");
      return 1;
    }
    final CliComponent component = CliComponent.create(container.configuration(createsFileSystem()));
    try (VirtualFileSystem fileSystem = component.virtualFileSystem()) {
      return execute(component, fileSystem, spec.commandLine().getOut());
    } catch (MatryoshkaException e) {
      log.error("{} failed: {}", spec.name(), e.getMessage());
      err.println(e.getMessage());
      return 1;
    } catch (IOException e) {
      log.error("{} failed on the host file system", spec.name(), e);
      err.println("Host file system error: " + e.getMessage());
      return 1;
    }
  }

}
