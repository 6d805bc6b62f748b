package io.cmdtree.shell;

import io.cmdtree.core.grammar.Grammar;
import io.cmdtree.core.parse.Parser;
import io.cmdtree.shell.xml.XmlGrammarException;
import io.cmdtree.shell.xml.XmlGrammarLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "cmdtree",
    description = "Interactive shell for XML command grammars",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {
  @CommandLine.Option(
      names = {"-g", "--grammar"},
      required = true,
      description = "XML grammar to load")
  private Path grammarFile;

  @CommandLine.Option(
      names = {"--config"},
      description = "Shell properties (default: ~/.cmdtree/shell.properties)")
  private Path configFile;

  @CommandLine.Option(
      names = {"-c", "--command"},
      description = "Run a command and exit; may be repeated")
  private List<String> commands;

  @CommandLine.Option(
      names = {"-q", "--quiet"},
      description = "Suppress banner")
  private boolean quiet;

  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  private final CallbackRegistry registry;

  public Main() {
    this(CallbackRegistry.withBuiltins());
  }

  /** A launcher resolving grammar callbacks in {@code registry}. */
  public Main(CallbackRegistry registry) {
    this.registry = registry;
  }

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() throws Exception {
    if (!Files.exists(grammarFile)) {
      spec.commandLine().getErr().println("Error: grammar file not found: " + grammarFile);
      return 2;
    }
    ShellConfig config = configFile != null ? ShellConfig.load(configFile) : ShellConfig.load();
    Grammar grammar;
    try {
      grammar = new XmlGrammarLoader(registry).load(grammarFile);
    } catch (XmlGrammarException e) {
      spec.commandLine().getErr().println("Error: " + e.getMessage());
      return 2;
    }
    Parser parser = new Parser(grammar);

    if (commands != null && !commands.isEmpty()) {
      Shell shell =
          new Shell(
              parser,
              config,
              Shell.printing(spec.commandLine().getOut(), spec.commandLine().getErr()),
              null);
      for (String command : commands) {
        Shell.Status status = shell.handle(command);
        if (status == Shell.Status.FAILED) {
          return 1;
        }
        if (status == Shell.Status.EXIT) {
          break;
        }
      }
      return 0;
    }

    try (Shell shell = Shell.interactive(parser, config, null)) {
      shell.run(quiet);
    }
    return 0;
  }
}
