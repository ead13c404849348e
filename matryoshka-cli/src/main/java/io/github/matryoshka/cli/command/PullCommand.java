package io.github.matryoshka.cli.command;

import io.github.matryoshka.VirtualFileSystem;
import io.github.matryoshka.cli.dagger.CliComponent;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Copies a file of the container to the host.
 */
@Command(
    name = "pull",
    description = "Copy a file of the container to the host, replacing the host file")
public class PullCommand extends ContainerCommand {

  private static final Logger log = LoggerFactory.getLogger(PullCommand.class);

  @Parameters(index = "0", description = "Path inside the container")
  private String innerPath;

  @Parameters(index = "1", description = "Host file to write")
  private Path localFile;

  @Override
  protected int execute(final CliComponent component, final VirtualFileSystem fileSystem, final PrintWriter out)
      throws IOException {
    final long bytes = component.containerTransfer().pull(innerPath, localFile);
    log.info("Pulled {} to {} ({} bytes)", innerPath, localFile, bytes);
    out.println(bytes);
    return 0;
  }

}
