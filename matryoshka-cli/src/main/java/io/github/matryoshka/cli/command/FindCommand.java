package io.github.matryoshka.cli.command;

import io.github.matryoshka.VirtualFileSystem;
import io.github.matryoshka.cli.dagger.CliComponent;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Lists the paths matching a glob pattern.
 */
@Command(
    name = "find",
    description = "List the paths matching a glob pattern ('?' one character, '*' any text)")
public class FindCommand extends ContainerCommand {

  @Parameters(index = "0", description = "Glob pattern", defaultValue = "*")
  private String pattern;

  @Option(names = {"--json"}, description = "Print a JSON array")
  private boolean json;

  @Override
  protected int execute(final CliComponent component, final VirtualFileSystem fileSystem, final PrintWriter out)
      throws IOException {
    final List<String> paths = fileSystem.find(pattern);
    if (json) {
      out.println(component.objectMapper().writeValueAsString(paths));
    } else {
      paths.forEach(out::println);
    }
    return 0;
  }

}
