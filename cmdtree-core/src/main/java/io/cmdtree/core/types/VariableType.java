package io.cmdtree.core.types;

import io.cmdtree.core.completion.CandidateProvider;
import java.util.Optional;
import java.util.regex.MatchResult;

/**
 * The value side of a variable node: the pattern a token must match, the conversion of a match
 * into a value, and optionally where completion candidates come from.
 *
 * @param <T> the parsed value type
 */
public interface VariableType<T> {

  /** Regular expression a token must match. */
  String pattern();

  /**
   * Converts a successful match. The match covers exactly the token; capturing groups are those of
   * {@link #pattern()}.
   */
  T parse(MatchResult match) throws VariableParseException;

  default Optional<CandidateProvider> candidates() {
    return Optional.empty();
  }

  /**
   * Whether a value may contain whitespace, as a quoted string does. Other types are matched
   * against a single whitespace-delimited token.
   */
  default boolean spansWhitespace() {
    return false;
  }
}
