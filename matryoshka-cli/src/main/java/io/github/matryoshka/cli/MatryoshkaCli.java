package io.github.matryoshka.cli;

import io.github.matryoshka.cli.command.DeleteCommand;
import io.github.matryoshka.cli.command.FindCommand;
import io.github.matryoshka.cli.command.InitCommand;
import io.github.matryoshka.cli.command.PullCommand;
import io.github.matryoshka.cli.command.PushCommand;
import io.github.matryoshka.cli.command.StatCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Main CLI entry point for Matryoshka containers.
 */
@Command(
    name = "matryoshka",
    description = "Stores files inside a single SQLite container",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        InitCommand.class,
        PushCommand.class,
        PullCommand.class,
        FindCommand.class,
        StatCommand.class,
        DeleteCommand.class})
public class MatryoshkaCli implements Runnable {

  /**
   * Main entry point.
   *
   * @param args command line arguments
   */
  public static void main(String[] args) {
    final int exitCode = new CommandLine(new MatryoshkaCli()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public void run() {
    // Show help when no subcommand is specified
    CommandLine.usage(this, System.out);
  }
}
