package io.cmdtree.core.grammar;

/**
 * Thrown when an alias cannot be resolved: malformed path, a segment matching nothing, a cycle
 * between aliases, or a loop that could be followed without consuming input.
 */
public final class AliasResolutionException extends GrammarException {
  private final String aliasPath;
  private final String target;

  public AliasResolutionException(String aliasPath, String target, String reason) {
    super(String.format("Cannot resolve alias %s -> '%s': %s", aliasPath, target, reason));
    this.aliasPath = aliasPath;
    this.target = target;
  }

  /** Location of the offending alias in the declared grammar. */
  public String getAliasPath() {
    return aliasPath;
  }

  public String getTarget() {
    return target;
  }
}
