package io.cmdtree.core.parse;

import io.cmdtree.core.completion.CompletionEngine;
import io.cmdtree.core.dispatch.DispatchResult;
import io.cmdtree.core.dispatch.Dispatcher;
import io.cmdtree.core.dispatch.IncompleteCommandException;
import io.cmdtree.core.grammar.Grammar;
import io.cmdtree.core.grammar.Node;
import io.cmdtree.core.help.HelpCollector;
import io.cmdtree.core.help.HelpEntry;
import io.cmdtree.core.help.HelpSection;
import io.cmdtree.core.types.VariableParseException;
import io.cmdtree.core.types.VariableType;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches input against a {@link Grammar}. The parser holds no per-parse state and may be shared;
 * each call works on a fresh {@link Context}.
 *
 * <p>Input is consumed token by token. At each step the children of the current node are tried in
 * declaration order and the first one whose pattern matches a whole token is entered; there is no
 * backtracking into other branches. A parse ends when the input is exhausted (completing at an
 * action if one is reachable) or when nothing matches.
 */
public final class Parser {
  private static final Logger log = LoggerFactory.getLogger(Parser.class);

  private final Grammar grammar;
  private final CompletionEngine completion;
  private final HelpCollector helpCollector;
  private final Dispatcher dispatcher;

  public Parser(Grammar grammar) {
    this(grammar, new CompletionEngine(), new HelpCollector(), new Dispatcher());
  }

  public Parser(
      Grammar grammar,
      CompletionEngine completion,
      HelpCollector helpCollector,
      Dispatcher dispatcher) {
    this.grammar = Objects.requireNonNull(grammar, "grammar");
    this.completion = completion;
    this.helpCollector = helpCollector;
    this.dispatcher = dispatcher;
  }

  public Grammar grammar() {
    return grammar;
  }

  /** Parses {@code text}. Invalid input is reported through the context, never thrown. */
  public Context parse(String text) {
    return parse(text, null);
  }

  public Context parse(String text, Object userObject) {
    String command = text == null ? "" : text;
    Context context = new Context(grammar, command, userObject);
    context.skipTo(skipWhitespace(command, 0));

    while (true) {
      Node current = context.currentNode();
      if (context.cursor() >= command.length()) {
        finish(context, current);
        break;
      }
      if (!step(context, current)) {
        break;
      }
    }
    log.debug("Parsed '{}': {}", command, context);
    return context;
  }

  /**
   * Parses and runs the command.
   *
   * @throws IncompleteCommandException if the input does not end at an action
   * @throws Exception whatever the action's callback throws
   */
  public DispatchResult execute(String text, Object userObject) throws Exception {
    return dispatcher.dispatch(parse(text, userObject));
  }

  public DispatchResult execute(String text) throws Exception {
    return execute(text, null);
  }

  /** Candidates for {@code partial} typed after the input held by {@code context}. */
  public List<String> complete(Context context, String partial) {
    return completion.candidates(context, partial);
  }

  /**
   * Candidates for the last word of {@code line}. The text before the last whitespace is parsed as
   * the prefix; a prefix that does not parse cleanly has no candidates.
   */
  public List<String> complete(String line) {
    String text = line == null ? "" : line;
    int split = text.length();
    while (split > 0 && !Character.isWhitespace(text.charAt(split - 1))) {
      split--;
    }
    Context context = parse(text.substring(0, split));
    if (context.outcome().isFailure()) {
      return List.of();
    }
    return completion.candidates(context, text.substring(split));
  }

  public List<HelpEntry> help(Context context) {
    return helpCollector.collect(context);
  }

  public List<HelpSection> helpSections(Context context) {
    return helpCollector.sections(context);
  }

  private void finish(Context context, Node current) {
    if (current.isAction()) {
      context.terminate(current);
      return;
    }
    for (Node child : grammar.children(current)) {
      if (child.matchesEndOfInput()) {
        context.terminate(child);
        return;
      }
    }
    context.end(ParseOutcome.PARTIAL);
  }

  /** Enters the first child matching at the cursor. Returns false once the parse has ended. */
  private boolean step(Context context, Node current) {
    String command = context.command();
    int cursor = context.cursor();
    for (Node child : grammar.children(current)) {
      if (child.matchesEndOfInput() || !context.canEnter(child)) {
        continue;
      }
      Optional<MatchResult> match = child.matchAt(command, cursor);
      if (match.isEmpty()) {
        continue;
      }
      String token = match.get().group();
      if (child.matchCandidates() && !completion.accepts(context, child, token)) {
        log.trace("'{}' is not a candidate of {}", token, child);
        continue;
      }
      Object value = null;
      if (child.isVariable()) {
        try {
          value = parseValue(child, match.get(), token);
        } catch (VariableParseException e) {
          log.debug("Rejected value '{}' for {}: {}", token, child, e.getMessage());
          context.fail(new ParseFailure(child, token, cursor, e));
          return false;
        }
      }
      context.enter(child, value, skipWhitespace(command, child.endOf(command, match.get())));
      log.trace("Entered {} with '{}'", child, token);
      return true;
    }
    context.end(ParseOutcome.NO_MATCH);
    return false;
  }

  private static Object parseValue(Node node, MatchResult match, String token)
      throws VariableParseException {
    VariableType<?> type = node.type().orElseThrow();
    try {
      return type.parse(match);
    } catch (RuntimeException e) {
      throw new VariableParseException(
          token, "Cannot parse '" + token + "' for " + node.name() + ": " + e, e);
    }
  }

  private static int skipWhitespace(String text, int from) {
    int i = from;
    while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
      i++;
    }
    return i;
  }
}
