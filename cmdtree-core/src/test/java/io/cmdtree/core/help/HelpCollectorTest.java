package io.cmdtree.core.help;

import static io.cmdtree.core.grammar.Nodes.action;
import static io.cmdtree.core.grammar.Nodes.node;
import static io.cmdtree.core.grammar.Nodes.variable;
import static org.junit.jupiter.api.Assertions.*;

import io.cmdtree.core.grammar.Grammar;
import io.cmdtree.core.parse.Context;
import io.cmdtree.core.parse.Parser;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class HelpCollectorTest {

  @Test
  void entriesUseDefaultKeysAndGroupOrder() {
    Parser parser =
        new Parser(
            Grammar.of(
                action("Run it", args -> null),
                variable("name", "A name"),
                node("show", "Show things"),
                node("later", "Listed later").helpGroup(10),
                node("secret", "Not listed").hidden(true)));

    List<HelpEntry> help = parser.help(parser.parse(""));

    assertEquals(
        List.of(
            new HelpEntry("<name>", "A name"),
            new HelpEntry("show", "Show things"),
            new HelpEntry("later", "Listed later"),
            new HelpEntry("<eol>", "Run it")),
        help);
  }

  @Test
  void sectionsFollowHelpGroups() {
    Parser parser =
        new Parser(Grammar.of(node("a", "A").helpGroup(2), node("b", "B"), node("c", "C").helpGroup(2)));

    List<HelpSection> sections = parser.helpSections(parser.parse(""));

    assertEquals(2, sections.size());
    assertEquals(0, sections.get(0).group());
    assertEquals(List.of(new HelpEntry("b", "B")), sections.get(0).entries());
    assertEquals(2, sections.get(1).group());
    assertEquals(2, sections.get(1).entries().size());
  }

  @Test
  void providersAreEvaluatedLazilyWithTheContext() {
    AtomicInteger calls = new AtomicInteger();
    Parser parser =
        new Parser(
            Grammar.of(
                node("set", "Set")
                    .child(
                        variable("key", "Key")
                            .help(
                                context -> {
                                  calls.incrementAndGet();
                                  return List.of(
                                      new HelpEntry("<key>", "after '" + context.parsed() + "'"),
                                      new HelpEntry("<other>", "second line"));
                                }))));

    Context context = parser.parse("set ");
    assertEquals(0, calls.get());

    List<HelpEntry> help = parser.help(context);

    assertEquals(1, calls.get());
    assertEquals(new HelpEntry("<key>", "after 'set '"), help.get(0));
    assertEquals(2, help.size());
  }

  @Test
  void exhaustedNodesHaveNoHelp() {
    Parser parser =
        new Parser(Grammar.of(node("once", "Once").child(io.cmdtree.core.grammar.Nodes.alias("/once"))));

    assertTrue(parser.help(parser.parse("once")).isEmpty());
  }
}
