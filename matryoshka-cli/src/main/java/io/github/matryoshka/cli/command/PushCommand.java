package io.github.matryoshka.cli.command;

import io.github.matryoshka.VirtualFileSystem;
import io.github.matryoshka.cli.dagger.CliComponent;
import io.github.matryoshka.model.FileHandle;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Copies a host file into the container.
 */
@Command(
    name = "push",
    description = "Copy a host file into the container")
public class PushCommand extends ContainerCommand {

  private static final Logger log = LoggerFactory.getLogger(PushCommand.class);

  @Parameters(index = "0", description = "Host file to copy")
  private Path localFile;

  @Parameters(index = "1", description = "Path inside the container")
  private String innerPath;

  @Option(
      names = {"--chunk-size", "-c"},
      description = "Chunk size in bytes; zero or negative lets the container choose (default: ${DEFAULT-VALUE})",
      defaultValue = "-1")
  private int chunkSize;

  @Override
  protected boolean createsFileSystem() {
    return true;
  }

  @Override
  protected int execute(final CliComponent component, final VirtualFileSystem fileSystem, final PrintWriter out)
      throws IOException {
    final FileHandle handle = component.containerTransfer().push(localFile, innerPath, chunkSize);
    log.info("Pushed {} to {}", localFile, innerPath);
    out.println(handle.id());
    return 0;
  }

}
