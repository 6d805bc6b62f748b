package io.cmdtree.core.completion;

import static io.cmdtree.core.grammar.Nodes.action;
import static io.cmdtree.core.grammar.Nodes.node;
import static io.cmdtree.core.grammar.Nodes.variable;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.cmdtree.core.grammar.Grammar;
import io.cmdtree.core.grammar.Nodes;
import io.cmdtree.core.parse.Context;
import io.cmdtree.core.parse.Parser;
import io.cmdtree.core.types.VariableTypes;
import java.util.List;
import org.junit.jupiter.api.Test;

class CompletionEngineTest {

  private final CompletionEngine engine = new CompletionEngine();

  @Test
  void partialWordFiltersInDeclaredOrder() {
    Parser parser = new Parser(Grammar.of(node("term", "T"), node("other", "O"), node("test", "T")));

    Context context = parser.parse("");

    assertThat(parser.complete(context, "te")).containsExactly("term ", "test ");
    assertThat(engine.candidates(context, "")).containsExactly("term ", "other ", "test ");
  }

  @Test
  void providerOverridesLiterals() {
    CandidateProvider provider = mock(CandidateProvider.class);
    when(provider.candidates(any(), eq("e"))).thenReturn(List.of("eth0", "eth1", "lo"));
    Parser parser = new Parser(Grammar.of(variable("iface", "Interface").candidates(provider)));

    Context context = parser.parse("");

    assertThat(parser.complete(context, "e")).containsExactly("eth0 ", "eth1 ");
    verify(provider).candidates(context, "e");
  }

  @Test
  void typeCandidatesAndPatternChoices() {
    Parser parser =
        new Parser(
            Grammar.of(
                variable("mode", "Mode", VariableTypes.choice("fast", "safe")),
                node("state", "State").pattern("(?i)(on|off)"),
                variable("name", "Name")));

    assertThat(parser.complete("")).containsExactly("fast ", "safe ", "on ", "off ");
  }

  @Test
  void hiddenExhaustedAndActionNodesAreSkipped() {
    Parser parser =
        new Parser(
            Grammar.of(
                node("debug", "Debug").hidden(true),
                node("once", "Once").child(Nodes.alias("/once"), node("more", "More")),
                action("Run", args -> null)));

    assertThat(parser.complete("")).containsExactly("once ");
    assertThat(parser.complete("once ")).containsExactly("more ");
  }

  @Test
  void candidatesEndingInSlashOrSpaceAreKept() {
    Parser parser =
        new Parser(
            Grammar.of(
                variable("path", "Path").candidates(CandidateProvider.of("src/", "done ", "x"))));

    assertThat(parser.complete("")).containsExactly("src/", "done ", "x ");
  }

  @Test
  void duplicatesAcrossNodesAreDropped() {
    Parser parser =
        new Parser(
            Grammar.of(
                variable("a", "A").candidates(CandidateProvider.of("same", "one")),
                variable("b", "B").candidates(CandidateProvider.of("same", "two"))));

    assertThat(parser.complete("")).containsExactly("same ", "one ", "two ");
  }

  @Test
  void failedPrefixHasNoCandidates() {
    Parser parser = new Parser(Grammar.of(node("show", "Show").child(node("ip", "Ip"))));

    assertThat(parser.complete("shw ")).isEmpty();
    assertThat(parser.complete(parser.parse("shw"), "")).isEmpty();
  }

  @Test
  void matchCandidatesUsesTheSameCandidates() {
    Grammar grammar =
        Grammar.of(
            variable("signal", "Signal")
                .candidates(CandidateProvider.of("TERM", "KILL"))
                .matchCandidates(true));
    Context context = new Parser(grammar).parse("");

    assertThat(engine.accepts(context, grammar.find("/signal").orElseThrow(), "KILL")).isTrue();
    assertThat(engine.accepts(context, grammar.find("/signal").orElseThrow(), "KIL")).isFalse();
  }
}
