package io.cmdtree.core.grammar;

/** The node variants a grammar is declared with. */
public enum NodeKind {
  /** The grammar root. Matches the empty prefix, has no parent. */
  ROOT,

  /** A plain keyword node routing to its children. */
  ROUTING,

  /** Stores a typed value parsed from the matched token. */
  VARIABLE,

  /** Terminal node bound to a callback. Matches end of input unless given a pattern. */
  ACTION,

  /** Build-time directive attaching other nodes by reference. Never a runtime node. */
  ALIAS,

  /** Build-time directive applying attribute overrides to its descendants. Never a runtime node. */
  GROUP;

  /** Whether declarations of this kind become entries of the resolved grammar. */
  public boolean isRuntime() {
    return this != ALIAS && this != GROUP;
  }
}
