package io.github.matryoshka.cli.command;

import io.github.matryoshka.VirtualFileSystem;
import io.github.matryoshka.cli.dagger.CliComponent;
import java.io.PrintWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;

/**
 * Creates the virtual file system in a container, or verifies the existing one.
 */
@Command(
    name = "init",
    description = "Create the virtual file system in a container or verify the existing one")
public class InitCommand extends ContainerCommand {

  private static final Logger log = LoggerFactory.getLogger(InitCommand.class);

  @Override
  protected boolean createsFileSystem() {
    return true;
  }

  @Override
  protected int execute(final CliComponent component, final VirtualFileSystem fileSystem, final PrintWriter out) {
    log.info("Container {} ready", component.configuration().database().url());
    out.println("Virtual file system version " + fileSystem.metaData().version());
    return 0;
  }

}
