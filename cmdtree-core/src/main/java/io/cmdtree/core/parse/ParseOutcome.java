package io.cmdtree.core.parse;

/** How a parse ended. */
public enum ParseOutcome {
  /** Terminated at an action with no input left. */
  COMPLETE,
  /** The input is a valid prefix but no action terminates it. */
  PARTIAL,
  /** No child of the frontier node matches the remaining input. */
  NO_MATCH,
  /** A token matched a variable's pattern but its value could not be parsed. */
  INVALID_VALUE;

  public boolean isFailure() {
    return this == NO_MATCH || this == INVALID_VALUE;
  }
}
