package io.cmdtree.core.grammar;

/** Thrown for a malformed node declaration: bad pattern, negative traversals, duplicate name. */
public final class GrammarDefinitionException extends GrammarException {
  public GrammarDefinitionException(String message) {
    super(message);
  }

  public GrammarDefinitionException(String message, Throwable cause) {
    super(message, cause);
  }
}
