package io.cmdtree.core.parse;

import io.cmdtree.core.grammar.Node;
import io.cmdtree.core.types.VariableParseException;

/** A rejected variable value: the node, the token it matched and why parsing it failed. */
public record ParseFailure(Node node, String token, int position, VariableParseException cause) {

  public String message() {
    return cause.getMessage();
  }
}
