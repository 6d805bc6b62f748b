package io.cmdtree.shell;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Settings of the interactive shell. Loads from {@code ~/.cmdtree/shell.properties} by default.
 *
 * @param prompt text shown before each input line
 * @param historyFile where line history is kept; {@code null} keeps history in memory only
 * @param banner printed when the shell starts, unless quiet; empty for none
 * @param helpKey typing this at the end of a line shows what may follow
 * @param exitCommands lines that leave the shell
 */
public record ShellConfig(
    String prompt, Path historyFile, String banner, String helpKey, Set<String> exitCommands) {

  public ShellConfig {
    if (helpKey == null || helpKey.isBlank()) {
      throw new IllegalArgumentException("helpKey must not be blank");
    }
    exitCommands = Set.copyOf(exitCommands);
  }

  /**
   * Creates the default configuration.
   *
   * @return default configuration
   */
  public static ShellConfig defaults() {
    return new ShellConfig(
        "> ",
        defaultDirectory().resolve("history"),
        "Type '?' for help, 'exit' to quit",
        "?",
        Set.of("exit", "quit"));
  }

  /**
   * Loads configuration from the default location: {@code ~/.cmdtree/shell.properties}.
   *
   * @return loaded configuration, or defaults if the file doesn't exist
   * @throws IOException if the file exists but cannot be read
   */
  public static ShellConfig load() throws IOException {
    return load(defaultDirectory().resolve("shell.properties"));
  }

  /**
   * Loads configuration from {@code configPath}.
   *
   * @return loaded configuration, or defaults if the file doesn't exist
   * @throws IOException if the file exists but cannot be read
   */
  public static ShellConfig load(Path configPath) throws IOException {
    if (!Files.exists(configPath)) {
      return defaults();
    }
    Properties props = new Properties();
    try (var reader = Files.newBufferedReader(configPath)) {
      props.load(reader);
    }
    return fromProperties(props);
  }

  static ShellConfig fromProperties(Properties props) {
    ShellConfig defaults = defaults();
    String prompt = props.getProperty("prompt", defaults.prompt());
    String history = props.getProperty("historyFile");
    Path historyFile;
    if (history == null) {
      historyFile = defaults.historyFile();
    } else if (history.isBlank()) {
      historyFile = null;
    } else {
      historyFile = expandHome(history.strip());
    }
    String banner = props.getProperty("banner", defaults.banner());
    String helpKey = props.getProperty("helpKey", defaults.helpKey()).strip();
    Set<String> exitCommands =
        Stream.of(props.getProperty("exitCommands", "exit,quit").split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
    return new ShellConfig(prompt, historyFile, banner, helpKey, exitCommands);
  }

  private static Path expandHome(String path) {
    if (path.equals("~") || path.startsWith("~/")) {
      return Path.of(System.getProperty("user.home"), path.substring(1).replaceFirst("^/", ""));
    }
    return Path.of(path);
  }

  private static Path defaultDirectory() {
    return Path.of(System.getProperty("user.home"), ".cmdtree");
  }
}
