package io.github.matryoshka.cli.command;

import io.github.matryoshka.VirtualFile;
import io.github.matryoshka.VirtualFileSystem;
import io.github.matryoshka.cli.dagger.CliComponent;
import java.io.PrintWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Deletes a file of the container.
 */
@Command(
    name = "delete",
    description = "Delete a file of the container")
public class DeleteCommand extends ContainerCommand {

  private static final Logger log = LoggerFactory.getLogger(DeleteCommand.class);

  @Parameters(index = "0", description = "Path inside the container")
  private String path;

  @Override
  protected int execute(final CliComponent component, final VirtualFileSystem fileSystem, final PrintWriter out) {
    final VirtualFile file = VirtualFile.load(fileSystem, path);
    if (!file.delete()) {
      out.println("Nothing deleted");
      return 1;
    }
    log.info("Deleted {}", path);
    out.println("Deleted " + path);
    return 0;
  }

}
