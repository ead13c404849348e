package io.github.matryoshka.cli.command;

import io.github.matryoshka.VirtualFileSystem;
import io.github.matryoshka.cli.dagger.CliComponent;
import io.github.matryoshka.exception.LoadingException;
import io.github.matryoshka.model.FileEntry;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Prints the meta entry and size of a file as JSON.
 */
@Command(
    name = "stat",
    description = "Print the meta entry and size of a file as JSON")
public class StatCommand extends ContainerCommand {

  @Parameters(index = "0", description = "Path inside the container")
  private String path;

  @Override
  protected int execute(final CliComponent component, final VirtualFileSystem fileSystem, final PrintWriter out)
      throws IOException {
    final FileEntry entry = fileSystem.stat(path).orElseThrow(LoadingException::fileNotFound);
    final Map<String, Object> document = new LinkedHashMap<>();
    document.put("handle", entry.id());
    document.put("path", entry.path());
    document.put("type", entry.type());
    document.put("flags", entry.flags());
    document.put("chunkSize", entry.chunkSize());
    document.put("size", fileSystem.size(entry.handle()).orElse(0));
    out.println(component.objectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(document));
    return 0;
  }

}
