package io.cmdtree.core.grammar;

import static org.junit.jupiter.api.Assertions.*;

import io.cmdtree.core.types.VariableTypes;
import org.junit.jupiter.api.Test;

class NodeDefinitionTest {

  @Test
  void invalidPatternIsRejected() {
    GrammarDefinitionException e =
        assertThrows(
            GrammarDefinitionException.class, () -> Nodes.node("bad", "Bad").pattern("(unclosed"));
    assertTrue(e.getMessage().contains("/bad"), e.getMessage());
  }

  @Test
  void invalidSeparatorIsRejected() {
    assertThrows(
        GrammarDefinitionException.class, () -> Nodes.node("bad", "Bad").separator("[unclosed"));
    assertThrows(GrammarDefinitionException.class, () -> Nodes.alias("/x").separator("="));
  }

  @Test
  void negativeTraversalsAreRejected() {
    assertThrows(GrammarDefinitionException.class, () -> Nodes.node("n", "N").traversals(-1));
    assertThrows(
        GrammarDefinitionException.class, () -> GroupOverrides.NONE.withTraversals(-2));
  }

  @Test
  void namesMustBeSinglePathSegments() {
    assertThrows(GrammarDefinitionException.class, () -> Nodes.node("a/b", "A"));
    assertThrows(GrammarDefinitionException.class, () -> Nodes.node("a b", "A"));
    assertThrows(GrammarDefinitionException.class, () -> Nodes.node(" ", "A"));
    assertThrows(GrammarDefinitionException.class, () -> Nodes.node(null, "A"));
  }

  @Test
  void aliasesTakeNoChildrenOrPattern() {
    NodeDefinition alias = Nodes.alias("/x");
    assertThrows(GrammarDefinitionException.class, () -> alias.child(Nodes.node("y", "Y")));
    assertThrows(GrammarDefinitionException.class, () -> alias.pattern("y"));
    assertThrows(GrammarDefinitionException.class, () -> Nodes.alias(" "));
  }

  @Test
  void aNodeCanOnlyBeAttachedOnce() {
    NodeDefinition shared = Nodes.node("shared", "Shared");
    Nodes.node("a", "A").child(shared);

    assertThrows(GrammarDefinitionException.class, () -> Nodes.node("b", "B").child(shared));
  }

  @Test
  void onlyVariablesTakeAVarName() {
    assertThrows(GrammarDefinitionException.class, () -> Nodes.node("n", "N").varName("v"));

    Grammar grammar =
        Grammar.of(Nodes.variable("host", "Host", VariableTypes.HOSTNAME).varName("target"));
    assertEquals("target", grammar.find("/host").orElseThrow().varName());
  }

  @Test
  void routingNodesMatchTheirNameLiterally() {
    Grammar grammar = Grammar.of(Nodes.node("a.b", "Dotted"));
    Node node = grammar.find("/a.b").orElseThrow();

    assertTrue(node.hasDefaultPattern());
    assertTrue(node.matchAt("a.b", 0).isPresent());
    assertTrue(node.matchAt("axb", 0).isEmpty());
    assertEquals(java.util.List.of("a.b"), node.literals());
  }

  @Test
  void matchMustEndAtATokenBoundary() {
    Grammar grammar = Grammar.of(Nodes.node("show", "Show"));
    Node show = grammar.find("/show").orElseThrow();

    assertTrue(show.matchAt("show ip", 0).isPresent());
    assertTrue(show.matchAt("shows", 0).isEmpty());
    assertEquals(4, show.matchAt("  show", 2).orElseThrow().end() - 2);
  }

  @Test
  void variablesDefaultToTheirTypePattern() {
    Grammar grammar = Grammar.of(Nodes.variable("n", "N", VariableTypes.INTEGER));
    Node n = grammar.find("/n").orElseThrow();

    assertEquals("-?\\d+", n.pattern().orElseThrow().pattern());
    assertFalse(n.hasDefaultPattern());
    assertTrue(n.isVariable());
  }
}
