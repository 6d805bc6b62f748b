package io.cmdtree.core.grammar;

import io.cmdtree.core.completion.CandidateProvider;
import io.cmdtree.core.dispatch.ActionBinding;
import io.cmdtree.core.help.HelpProvider;
import io.cmdtree.core.types.VariableType;
import java.util.List;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A resolved, immutable grammar node. Nodes live in the {@link Grammar}'s arena and are identified
 * by {@link #id()}; children and parent are stored as ids, so a node reached through several aliases
 * is still one node.
 *
 * <p>Navigation goes through the owning grammar: {@link Grammar#children(Node)}, {@link
 * Grammar#parent(Node)} and {@link Grammar#path(Node)}.
 */
public final class Node {
  /** Help group actions are listed under unless told otherwise. */
  public static final int ACTION_HELP_GROUP = 9999;

  static final int NO_PARENT = -1;

  private final int id;
  private final NodeKind kind;
  private final String name;
  private final int parentId;
  private final Pattern pattern;
  private final Pattern separator;
  /** Pattern for values that may span whitespace; they must still end at a word boundary. */
  private final Pattern spanningPattern;
  private final boolean defaultPattern;
  private final List<String> literals;
  private final HelpProvider help;
  private final int traversals;
  private final boolean matchCandidates;
  private final int helpGroup;
  private final boolean hidden;
  private final CandidateProvider candidates;
  private final VariableType<?> type;
  private final String varName;
  private final ActionBinding binding;
  private final int[] children;

  Node(NodeDraft draft, int[] children) {
    this.id = draft.id;
    this.kind = draft.kind;
    this.name = draft.name;
    this.parentId = draft.parentId;
    this.pattern = draft.pattern;
    this.separator = draft.separator;
    this.spanningPattern =
        draft.pattern != null && draft.type != null && draft.type.spansWhitespace()
            ? Pattern.compile("(?:" + draft.pattern.pattern() + ")(?=\\s|$)")
            : null;
    this.defaultPattern = draft.defaultPattern;
    this.literals = List.copyOf(draft.literals);
    this.help = draft.help;
    this.traversals = draft.traversals;
    this.matchCandidates = draft.matchCandidates;
    this.helpGroup = draft.helpGroup;
    this.hidden = draft.hidden;
    this.candidates = draft.candidates;
    this.type = draft.type;
    this.varName = draft.varName;
    this.binding = draft.binding;
    this.children = children.clone();
  }

  /** Stable index of this node in its grammar. The root is always 0. */
  public int id() {
    return id;
  }

  public NodeKind kind() {
    return kind;
  }

  public String name() {
    return name;
  }

  public boolean isRoot() {
    return kind == NodeKind.ROOT;
  }

  public boolean isVariable() {
    return kind == NodeKind.VARIABLE;
  }

  public boolean isAction() {
    return kind == NodeKind.ACTION;
  }

  /** Pattern matched against a token. Empty for the root and for actions matching end of input. */
  public Optional<Pattern> pattern() {
    return Optional.ofNullable(pattern);
  }

  /** Whether the pattern was derived from the node name rather than declared. */
  public boolean hasDefaultPattern() {
    return defaultPattern;
  }

  /** Actions without a pattern match only once the input is exhausted. */
  public boolean matchesEndOfInput() {
    return kind == NodeKind.ACTION && pattern == null;
  }

  /** Separator required after the token, if one was declared. */
  public Optional<Pattern> separator() {
    return Optional.ofNullable(separator);
  }

  /**
   * Matches this node's pattern against the token starting at {@code from}. The whole token must
   * match. Variables whose type {@linkplain VariableType#spansWhitespace() spans whitespace} may
   * match across several words, but still end at whitespace or at the end of the input. With a
   * {@linkplain #separator() separator} the pattern may stop anywhere the separator then matches.
   */
  public Optional<MatchResult> matchAt(String input, int from) {
    if (pattern == null || from >= input.length()) {
      return Optional.empty();
    }
    Matcher matcher;
    boolean matched;
    if (separator != null) {
      matcher = pattern.matcher(input);
      matcher.region(from, input.length());
      matched = matcher.lookingAt() && separatorEnd(input, matcher.end()) >= 0;
    } else if (spanningPattern != null) {
      matcher = spanningPattern.matcher(input);
      matcher.region(from, input.length());
      matched = matcher.lookingAt();
    } else {
      matcher = pattern.matcher(input);
      matcher.region(from, tokenEnd(input, from));
      matched = matcher.matches();
    }
    if (matched && matcher.end() > from) {
      return Optional.of(matcher.toMatchResult());
    }
    return Optional.empty();
  }

  /** Where input continues after {@code match}: past the separator, if there is one. */
  public int endOf(String input, MatchResult match) {
    return separator == null ? match.end() : Math.max(separatorEnd(input, match.end()), match.end());
  }

  private int separatorEnd(String input, int from) {
    Matcher matcher = separator.matcher(input);
    matcher.region(from, input.length());
    return matcher.lookingAt() ? matcher.end() : -1;
  }

  private static int tokenEnd(String input, int from) {
    int end = from;
    while (end < input.length() && !Character.isWhitespace(input.charAt(end))) {
      end++;
    }
    return end;
  }

  /**
   * Literal words this node accepts when its pattern is a finite choice, or its name when the
   * pattern is the default one. Used as completion candidates when no provider is set.
   */
  public List<String> literals() {
    return literals;
  }

  public HelpProvider help() {
    return help;
  }

  /** Traversal limit; 0 means unlimited. */
  public int traversals() {
    return traversals;
  }

  /** Variables accumulate a list whenever more than one visit is structurally possible. */
  public boolean collectsList() {
    return traversals != 1;
  }

  public boolean matchCandidates() {
    return matchCandidates;
  }

  public int helpGroup() {
    return helpGroup;
  }

  public boolean hidden() {
    return hidden;
  }

  public Optional<CandidateProvider> candidates() {
    return Optional.ofNullable(candidates);
  }

  public Optional<VariableType<?>> type() {
    return Optional.ofNullable(type);
  }

  /** Name variable values are stored under; {@code null} for non-variables. */
  public String varName() {
    return varName;
  }

  public Optional<ActionBinding> binding() {
    return Optional.ofNullable(binding);
  }

  int parentId() {
    return parentId;
  }

  int[] childIds() {
    return children;
  }

  @Override
  public String toString() {
    return "Node[" + kind + " " + (isRoot() ? "<root>" : name) + " #" + id + "]";
  }
}
