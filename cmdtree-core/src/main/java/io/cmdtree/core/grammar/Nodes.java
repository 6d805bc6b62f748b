package io.cmdtree.core.grammar;

import io.cmdtree.core.dispatch.ActionBinding;
import io.cmdtree.core.dispatch.ActionCallback;
import io.cmdtree.core.dispatch.UserActionCallback;
import io.cmdtree.core.types.VariableType;
import io.cmdtree.core.types.VariableTypes;
import java.util.Objects;

/**
 * Factory methods for node declarations.
 *
 * <pre>{@code
 * Grammar grammar = Grammar.of(
 *     Nodes.node("kill", "Send a signal")
 *         .child(Nodes.variable("signal", "Signal name")
 *             .candidates(CandidateProvider.of("TERM", "KILL"))
 *             .matchCandidates(true)
 *             .child(Nodes.action("Send it", args -> send(args.getString("signal"))))));
 * }</pre>
 */
public final class Nodes {
  /** Name given to actions declared without one. */
  public static final String ACTION_NAME = "eol";

  private Nodes() {}

  /** A keyword node matching its own name. */
  public static NodeDefinition node(String name, String help) {
    return new NodeDefinition(NodeKind.ROUTING, requireName(name), null, null, null, null)
        .help(help);
  }

  /** A variable of the default {@link VariableTypes#WORD} type. */
  public static NodeDefinition variable(String name, String help) {
    return variable(name, help, VariableTypes.WORD);
  }

  public static NodeDefinition variable(String name, String help, VariableType<?> type) {
    Objects.requireNonNull(type, "type");
    return new NodeDefinition(NodeKind.VARIABLE, requireName(name), type, null, null, null)
        .help(help);
  }

  public static NodeDefinition action(String help, ActionCallback callback) {
    return action(ACTION_NAME, help, ActionBinding.of(callback));
  }

  /** An action whose callback also receives the user object passed to the parser. */
  public static <U> NodeDefinition action(
      String help, Class<U> userType, UserActionCallback<U> callback) {
    return action(ACTION_NAME, help, ActionBinding.withUserObject(userType, callback));
  }

  public static NodeDefinition action(String name, String help, ActionBinding binding) {
    Objects.requireNonNull(binding, "binding");
    return new NodeDefinition(NodeKind.ACTION, requireName(name), null, binding, null, null)
        .help(help);
  }

  /** An anonymous alias. Its targets are attached where the alias is declared. */
  public static NodeDefinition alias(String target) {
    return new NodeDefinition(NodeKind.ALIAS, null, null, null, requireTarget(target), null);
  }

  /** A named alias, addressable by path from other aliases. */
  public static NodeDefinition alias(String name, String target) {
    return new NodeDefinition(
        NodeKind.ALIAS, requireName(name), null, null, requireTarget(target), null);
  }

  public static NodeDefinition group(GroupOverrides overrides) {
    return new NodeDefinition(
        NodeKind.GROUP, null, null, null, null, Objects.requireNonNull(overrides, "overrides"));
  }

  static NodeDefinition root() {
    return new NodeDefinition(NodeKind.ROOT, null, null, null, null, null);
  }

  private static String requireName(String name) {
    if (name == null) {
      throw new GrammarDefinitionException("Node name is required");
    }
    return name;
  }

  private static String requireTarget(String target) {
    if (target == null || target.isBlank()) {
      throw new GrammarDefinitionException("Alias target is required");
    }
    return target;
  }
}
