package io.cmdtree.shell;

import io.cmdtree.core.dispatch.DispatchResult;
import io.cmdtree.core.dispatch.IncompleteCommandException;
import io.cmdtree.core.help.HelpEntry;
import io.cmdtree.core.help.HelpFormatter;
import io.cmdtree.core.help.HelpSection;
import io.cmdtree.core.parse.Context;
import io.cmdtree.core.parse.ParseFailure;
import io.cmdtree.core.parse.ParseOutcome;
import io.cmdtree.core.parse.Parser;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import org.jline.reader.EndOfFileException;
import org.jline.reader.History;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-execute loop over a grammar. Each line is executed through the {@link Parser}; a line ending
 * with the configured help key lists what may follow instead.
 */
public final class Shell implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Shell.class);

  /** Where the shell writes. */
  public interface IO {
    void println(String s);

    void printf(String fmt, Object... args);

    void error(String s);
  }

  /** What became of a line. */
  public enum Status {
    OK,
    FAILED,
    EXIT
  }

  private final Parser parser;
  private final ShellConfig config;
  private final IO io;
  private final Object userObject;
  private final HelpFormatter formatter = new HelpFormatter();
  private final Terminal terminal;
  private final LineReader lineReader;
  private final History history;

  /** A shell without a terminal, driven through {@link #handle(String)}. */
  public Shell(Parser parser, ShellConfig config, IO io, Object userObject) {
    this(parser, config, io, userObject, null, null, null);
  }

  private Shell(
      Parser parser,
      ShellConfig config,
      IO io,
      Object userObject,
      Terminal terminal,
      LineReader lineReader,
      History history) {
    this.parser = parser;
    this.config = config;
    this.io = io;
    this.userObject = userObject;
    this.terminal = terminal;
    this.lineReader = lineReader;
    this.history = history;
  }

  /** A shell reading from the system terminal, with grammar completion and line history. */
  public static Shell interactive(Parser parser, ShellConfig config, Object userObject)
      throws IOException {
    Terminal terminal = TerminalBuilder.builder().system(true).build();
    DefaultHistory history = new DefaultHistory();
    LineReaderBuilder builder =
        LineReaderBuilder.builder()
            .terminal(terminal)
            .history(history)
            .completer(new GrammarCompleter(parser));
    if (config.historyFile() != null) {
      try {
        Files.createDirectories(config.historyFile().toAbsolutePath().getParent());
        builder.variable(LineReader.HISTORY_FILE, config.historyFile());
      } catch (IOException e) {
        log.warn("History disabled, cannot create {}: {}", config.historyFile(), e.getMessage());
      }
    }
    LineReader lineReader = builder.build();
    IO io = printing(terminal.writer(), terminal.writer());
    return new Shell(parser, config, io, userObject, terminal, lineReader, history);
  }

  /** IO writing to the given writers, flushing after each call. */
  public static IO printing(PrintWriter out, PrintWriter err) {
    return new IO() {
      @Override
      public void println(String s) {
        out.println(s);
        out.flush();
      }

      @Override
      public void printf(String fmt, Object... args) {
        out.printf(fmt, args);
        out.flush();
      }

      @Override
      public void error(String s) {
        err.println(s);
        err.flush();
      }
    };
  }

  public void run(boolean quiet) {
    if (lineReader == null) {
      throw new IllegalStateException("Shell has no terminal");
    }
    if (!quiet && !config.banner().isEmpty()) {
      io.println(config.banner());
    }
    while (true) {
      try {
        String line = lineReader.readLine(config.prompt());
        if (handle(line) == Status.EXIT) {
          break;
        }
      } catch (UserInterruptException e) {
        io.println("^C");
      } catch (EndOfFileException e) {
        io.println("");
        break;
      }
    }
  }

  /** Executes one line, or shows help when it ends with the help key. */
  public Status handle(String line) {
    String input = line == null ? "" : line.strip();
    if (input.isEmpty()) {
      return Status.OK;
    }
    if (config.exitCommands().contains(input)) {
      return Status.EXIT;
    }
    if (isHelpRequest(input)) {
      return help(input.substring(0, input.length() - config.helpKey().length()));
    }
    try {
      DispatchResult result = parser.execute(input, userObject);
      if (result.value() != null) {
        io.println(String.valueOf(result.value()));
      }
      return Status.OK;
    } catch (IncompleteCommandException e) {
      report(e.getContext(), e.getMessage());
      return Status.FAILED;
    } catch (Exception e) {
      log.debug("Command '{}' failed", input, e);
      io.error("Error: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
      return Status.FAILED;
    }
  }

  /**
   * A line asks for help when it ends with the help key outside quotes, and the key either stands
   * alone or does not complete a valid command as part of the last word.
   */
  private boolean isHelpRequest(String input) {
    String key = config.helpKey();
    if (!input.endsWith(key)) {
      return false;
    }
    String prefix = input.substring(0, input.length() - key.length());
    if (insideQuotes(prefix)) {
      return false;
    }
    if (prefix.isEmpty() || Character.isWhitespace(prefix.charAt(prefix.length() - 1))) {
      return true;
    }
    return !parser.parse(input, userObject).isComplete();
  }

  private static boolean insideQuotes(String text) {
    char quote = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\\') {
        i++;
      } else if (quote == 0 && (c == '"' || c == '\'')) {
        quote = c;
      } else if (c == quote) {
        quote = 0;
      }
    }
    return quote != 0;
  }

  private Status help(String prefix) {
    int split = prefix.length();
    while (split > 0 && !Character.isWhitespace(prefix.charAt(split - 1))) {
      split--;
    }
    String partial = prefix.substring(split);
    Context context = parser.parse(prefix.substring(0, split));
    if (context.outcome().isFailure()) {
      report(context, context.outcome() == ParseOutcome.NO_MATCH
          ? "Invalid input at column " + (context.cursor() + 1) + ": " + context.remaining()
          : "Invalid value: " + context.failure().map(ParseFailure::message).orElse(""));
      return Status.FAILED;
    }
    List<HelpSection> sections = new ArrayList<>();
    for (HelpSection section : parser.helpSections(context)) {
      List<HelpEntry> entries = new ArrayList<>();
      for (HelpEntry entry : section.entries()) {
        if (entry.key().startsWith(partial)) {
          entries.add(entry);
        }
      }
      if (!entries.isEmpty()) {
        sections.add(new HelpSection(section.group(), entries));
      }
    }
    if (sections.isEmpty()) {
      io.println("No completions");
    } else {
      io.printf("%s", formatter.format(sections));
    }
    return Status.OK;
  }

  private void report(Context context, String message) {
    io.error(message);
    if (context.outcome() == ParseOutcome.PARTIAL) {
      io.error("Type '" + (context.command().strip() + " " + config.helpKey()).strip()
          + "' to see what may follow");
      return;
    }
    int column =
        context.failure().map(ParseFailure::position).orElse(context.cursor());
    io.error("  " + context.command());
    io.error("  " + " ".repeat(column) + "^");
  }

  @Override
  public void close() {
    if (history != null) {
      try {
        history.save();
      } catch (IOException e) {
        log.warn("Cannot save history: {}", e.getMessage());
      }
    }
    if (terminal != null) {
      try {
        terminal.close();
      } catch (IOException e) {
        log.warn("Cannot close terminal: {}", e.getMessage());
      }
    }
  }
}
