package io.cmdtree.core.grammar;

import io.cmdtree.core.completion.CandidateProvider;
import io.cmdtree.core.dispatch.ActionBinding;
import io.cmdtree.core.help.HelpProvider;
import io.cmdtree.core.types.VariableType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Mutable declaration of a grammar node. Declarations are assembled into a tree with {@link
 * #child(NodeDefinition...)} and turned into an immutable {@link Grammar} by {@link
 * Grammar.Builder#build()}, after which they can no longer change.
 *
 * <p>Attributes left unset here fall back to the nearest enclosing group's {@link GroupOverrides}
 * and then to the default for the node kind.
 *
 * <p>Instances are created through {@link Nodes}.
 */
public final class NodeDefinition {
  private final NodeKind kind;
  private final String name;
  private final List<NodeDefinition> children = new ArrayList<>();
  private NodeDefinition parent;
  private boolean frozen;

  private String pattern;
  private String separator;
  private String helpText = "";
  private HelpProvider helpProvider;
  private Integer traversals;
  private Boolean matchCandidates;
  private Integer helpGroup;
  private Boolean hidden;
  private CandidateProvider candidates;
  private String varName;

  private final VariableType<?> type;
  private final ActionBinding binding;
  private final String target;
  private final GroupOverrides overrides;

  NodeDefinition(
      NodeKind kind,
      String name,
      VariableType<?> type,
      ActionBinding binding,
      String target,
      GroupOverrides overrides) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.name = name;
    this.type = type;
    this.binding = binding;
    this.target = target;
    this.overrides = overrides;
    if (name != null && (name.isBlank() || name.contains("/") || name.chars().anyMatch(Character::isWhitespace))) {
      throw new GrammarDefinitionException("Invalid node name '" + name + "'");
    }
  }

  /** Attaches child declarations in order. Insertion order is the matching tie-break order. */
  public NodeDefinition child(NodeDefinition... nodes) {
    checkMutable();
    if (kind == NodeKind.ALIAS) {
      throw new GrammarDefinitionException("Alias " + describe() + " cannot have children");
    }
    for (NodeDefinition node : nodes) {
      Objects.requireNonNull(node, "child");
      if (node.kind == NodeKind.ROOT) {
        throw new GrammarDefinitionException("A grammar root cannot be attached as a child");
      }
      if (node.parent != null) {
        throw new GrammarDefinitionException(
            "Node " + node.describe() + " is already attached under " + node.parent.describe()
                + "; use an alias to share it");
      }
      if (node.name != null && hasChildNamed(node.name)) {
        throw new GrammarDefinitionException(
            "Duplicate child name '" + node.name + "' under " + describe());
      }
      node.parent = this;
      children.add(node);
    }
    return this;
  }

  /** Overrides the regular expression matched against input tokens. */
  public NodeDefinition pattern(String regex) {
    checkMutable();
    if (kind == NodeKind.ALIAS || kind == NodeKind.GROUP || kind == NodeKind.ROOT) {
      throw new GrammarDefinitionException(kind + " nodes do not take a pattern");
    }
    try {
      Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new GrammarDefinitionException(
          "Invalid pattern for " + describe() + ": " + e.getDescription(), e);
    }
    this.pattern = regex;
    return this;
  }

  /**
   * Requires {@code regex} to match right after the token and consumes what it matches. Without a
   * separator a token ends at whitespace or at the end of the input.
   */
  public NodeDefinition separator(String regex) {
    checkMutable();
    if (kind == NodeKind.ALIAS || kind == NodeKind.GROUP || kind == NodeKind.ROOT) {
      throw new GrammarDefinitionException(kind + " nodes do not take a separator");
    }
    try {
      Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new GrammarDefinitionException(
          "Invalid separator for " + describe() + ": " + e.getDescription(), e);
    }
    this.separator = regex;
    return this;
  }

  public NodeDefinition help(String text) {
    checkMutable();
    this.helpText = Objects.requireNonNull(text, "help");
    this.helpProvider = null;
    return this;
  }

  public NodeDefinition help(HelpProvider provider) {
    checkMutable();
    this.helpProvider = Objects.requireNonNull(provider, "help");
    return this;
  }

  /** Maximum number of times the node may be entered in one parse; 0 means unlimited. */
  public NodeDefinition traversals(int limit) {
    checkMutable();
    if (limit < 0) {
      throw new GrammarDefinitionException(
          "Traversals for " + describe() + " must be >= 0, got " + limit);
    }
    this.traversals = limit;
    return this;
  }

  /** Restricts matches to the exact candidates the node generates. */
  public NodeDefinition matchCandidates(boolean matchCandidates) {
    checkMutable();
    this.matchCandidates = matchCandidates;
    return this;
  }

  public NodeDefinition candidates(CandidateProvider provider) {
    checkMutable();
    this.candidates = Objects.requireNonNull(provider, "candidates");
    return this;
  }

  public NodeDefinition helpGroup(int group) {
    checkMutable();
    this.helpGroup = group;
    return this;
  }

  /** Hidden nodes still match input but are left out of help and completion. */
  public NodeDefinition hidden(boolean hidden) {
    checkMutable();
    this.hidden = hidden;
    return this;
  }

  /** Name the collected value is stored under. Defaults to the node name. */
  public NodeDefinition varName(String varName) {
    checkMutable();
    if (kind != NodeKind.VARIABLE) {
      throw new GrammarDefinitionException("Only variables take a var name, not " + describe());
    }
    this.varName = Objects.requireNonNull(varName, "varName");
    return this;
  }

  public NodeKind kind() {
    return kind;
  }

  public Optional<String> name() {
    return Optional.ofNullable(name);
  }

  public List<NodeDefinition> children() {
    return Collections.unmodifiableList(children);
  }

  Optional<NodeDefinition> parent() {
    return Optional.ofNullable(parent);
  }

  Optional<String> explicitPattern() {
    return Optional.ofNullable(pattern);
  }

  Optional<String> explicitSeparator() {
    return Optional.ofNullable(separator);
  }

  String helpText() {
    return helpText;
  }

  Optional<HelpProvider> helpProvider() {
    return Optional.ofNullable(helpProvider);
  }

  Integer explicitTraversals() {
    return traversals;
  }

  Boolean explicitMatchCandidates() {
    return matchCandidates;
  }

  Integer explicitHelpGroup() {
    return helpGroup;
  }

  Boolean explicitHidden() {
    return hidden;
  }

  Optional<CandidateProvider> candidateProvider() {
    return Optional.ofNullable(candidates);
  }

  Optional<String> explicitVarName() {
    return Optional.ofNullable(varName);
  }

  VariableType<?> type() {
    return type;
  }

  ActionBinding binding() {
    return binding;
  }

  String target() {
    return target;
  }

  GroupOverrides overrides() {
    return overrides;
  }

  void freeze() {
    frozen = true;
    for (NodeDefinition child : children) {
      child.freeze();
    }
  }

  /** Human-readable location of this declaration, for error messages. */
  String describe() {
    StringBuilder path = new StringBuilder();
    for (NodeDefinition node = this; node != null && node.kind != NodeKind.ROOT; node = node.parent) {
      String segment =
          node.name != null ? node.name : "<" + node.kind.name().toLowerCase() + ">";
      path.insert(0, "/" + segment);
    }
    return path.length() == 0 ? "/" : path.toString();
  }

  private boolean hasChildNamed(String childName) {
    for (NodeDefinition child : children) {
      if (childName.equals(child.name)) {
        return true;
      }
    }
    return false;
  }

  private void checkMutable() {
    if (frozen) {
      throw new IllegalStateException(
          "Node " + describe() + " belongs to a built grammar and can no longer change");
    }
  }

  @Override
  public String toString() {
    return kind == NodeKind.ALIAS
        ? "NodeDefinition[ALIAS " + describe() + " -> " + target + "]"
        : "NodeDefinition[" + kind + " " + describe() + "]";
  }
}
