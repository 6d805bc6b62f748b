package io.cmdtree.core.grammar;

/**
 * Attribute overrides a group applies to every node declared beneath it. A {@code null} component
 * leaves the attribute alone. Explicit per-node settings always win; a nested group replaces the
 * overrides of the enclosing one.
 */
public record GroupOverrides(
    Integer traversals, Boolean matchCandidates, Integer helpGroup, Boolean hidden) {

  public static final GroupOverrides NONE = new GroupOverrides(null, null, null, null);

  public GroupOverrides {
    if (traversals != null && traversals < 0) {
      throw new GrammarDefinitionException("Group traversals must be >= 0, got " + traversals);
    }
  }

  public GroupOverrides withTraversals(int traversals) {
    return new GroupOverrides(traversals, matchCandidates, helpGroup, hidden);
  }

  public GroupOverrides withMatchCandidates(boolean matchCandidates) {
    return new GroupOverrides(traversals, matchCandidates, helpGroup, hidden);
  }

  public GroupOverrides withHelpGroup(int helpGroup) {
    return new GroupOverrides(traversals, matchCandidates, helpGroup, hidden);
  }

  public GroupOverrides withHidden(boolean hidden) {
    return new GroupOverrides(traversals, matchCandidates, helpGroup, hidden);
  }
}
