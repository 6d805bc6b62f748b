package io.cmdtree.shell;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import io.cmdtree.core.grammar.Grammar;
import io.cmdtree.core.grammar.Nodes;
import io.cmdtree.core.parse.Parser;
import io.cmdtree.core.types.VariableTypes;
import java.util.ArrayList;
import java.util.List;
import org.jline.reader.Candidate;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GrammarCompleterTest {

  GrammarCompleter completer;

  @BeforeEach
  void setUp() {
    Grammar grammar =
        Grammar.of(
            Nodes.node("show", "Show things")
                .child(
                    Nodes.node("interfaces", "").child(Nodes.action("", args -> null)),
                    Nodes.node("ip", "").child(Nodes.action("", args -> null))),
            Nodes.node("set", "Set things")
                .child(
                    Nodes.variable("mode", "", VariableTypes.choice("fast", "slow"))
                        .child(Nodes.action("", args -> null))));
    completer = new GrammarCompleter(new Parser(grammar));
  }

  private List<Candidate> complete(String line, int cursor) {
    ParsedLine parsed = mock(ParsedLine.class);
    when(parsed.line()).thenReturn(line);
    when(parsed.cursor()).thenReturn(cursor);
    List<Candidate> candidates = new ArrayList<>();
    completer.complete(mock(LineReader.class), parsed, candidates);
    return candidates;
  }

  private static List<String> values(List<Candidate> candidates) {
    return candidates.stream().map(Candidate::value).toList();
  }

  @Test
  void completesWordsAtTheCursor() {
    List<Candidate> candidates = complete("show i", 6);

    assertEquals(List.of("interfaces", "ip"), values(candidates));
    assertTrue(candidates.stream().allMatch(Candidate::complete));
  }

  @Test
  void textAfterTheCursorIsIgnored() {
    assertEquals(List.of("set", "show"), values(complete("s interfaces", 1)).stream().sorted().toList());
  }

  @Test
  void variableChoices() {
    assertEquals(List.of("fast", "slow"), values(complete("set ", 4)));
  }

  @Test
  void nothingAfterInvalidInput() {
    assertTrue(complete("bogus ", 6).isEmpty());
  }
}
