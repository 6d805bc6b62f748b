package io.cmdtree.core.completion;

import io.cmdtree.core.parse.Context;
import java.util.List;

/**
 * Supplies completion candidates for a node. Results are filtered by the partial word and given a
 * trailing space by the {@link CompletionEngine}, so providers may return every value they know.
 *
 * <p>Providers are called during completion and, for nodes that match only their candidates, on
 * every match attempt, so they should be cheap.
 */
@FunctionalInterface
public interface CandidateProvider {
  List<String> candidates(Context context, String partial);

  /** A provider returning a fixed set of words. */
  static CandidateProvider of(String... values) {
    List<String> fixed = List.of(values);
    return (context, partial) -> fixed;
  }
}
