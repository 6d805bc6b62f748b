package io.cmdtree.core.completion;

import io.cmdtree.core.grammar.Node;
import io.cmdtree.core.parse.Context;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes completion candidates for the word being typed after a partial parse.
 *
 * <p>For each child of the frontier node that is visible and can still be entered, in declaration
 * order, candidates come from the node's own {@link CandidateProvider}, else from its variable
 * type, else from the literal words its pattern accepts. Actions contribute nothing.
 */
public final class CompletionEngine {

  public List<String> candidates(Context context, String partial) {
    String prefix = partial == null ? "" : partial;
    if (context.failure().isPresent() || !context.remaining().isEmpty()) {
      return List.of();
    }
    Set<String> result = new LinkedHashSet<>();
    for (Node child : context.grammar().children(context.currentNode())) {
      if (child.hidden() || child.isAction() || !context.canEnter(child)) {
        continue;
      }
      for (String candidate : candidates(context, child, prefix)) {
        if (candidate.startsWith(prefix)) {
          result.add(candidate);
        }
      }
    }
    return new ArrayList<>(result);
  }

  /** Raw candidates of a single node, each terminated, before prefix filtering. */
  public List<String> candidates(Context context, Node node, String partial) {
    List<String> raw = source(context, node, partial);
    List<String> terminated = new ArrayList<>(raw.size());
    for (String candidate : raw) {
      if (candidate == null || candidate.isEmpty()) {
        continue;
      }
      terminated.add(terminate(candidate));
    }
    return terminated;
  }

  /** Whether {@code token} is exactly one of the node's candidates. */
  public boolean accepts(Context context, Node node, String token) {
    for (String candidate : candidates(context, node, token)) {
      if (candidate.strip().equals(token)) {
        return true;
      }
    }
    return false;
  }

  private static List<String> source(Context context, Node node, String partial) {
    if (node.candidates().isPresent()) {
      return node.candidates().get().candidates(context, partial);
    }
    if (node.type().isPresent() && node.type().get().candidates().isPresent()) {
      return node.type().get().candidates().get().candidates(context, partial);
    }
    return node.literals();
  }

  private static String terminate(String candidate) {
    char last = candidate.charAt(candidate.length() - 1);
    return Character.isWhitespace(last) || last == '/' ? candidate : candidate + " ";
  }
}
