package io.cmdtree.shell;

import static org.junit.jupiter.api.Assertions.*;

import io.cmdtree.core.grammar.Grammar;
import io.cmdtree.core.grammar.Nodes;
import io.cmdtree.core.parse.Parser;
import io.cmdtree.core.types.VariableTypes;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ShellTest {

  static class BufferIO implements Shell.IO {
    final StringBuilder out = new StringBuilder();
    final StringBuilder err = new StringBuilder();

    @Override
    public void println(String s) {
      out.append(s).append('\n');
    }

    @Override
    public void printf(String fmt, Object... args) {
      out.append(String.format(fmt, args));
    }

    @Override
    public void error(String s) {
      err.append(s).append('\n');
    }
  }

  BufferIO io;
  Shell shell;
  StringBuilder log;

  @BeforeEach
  void setUp() {
    log = new StringBuilder();
    Grammar grammar =
        Grammar.of(
            Nodes.node("show", "Show things")
                .child(
                    Nodes.node("version", "Print the version")
                        .child(Nodes.action("Show it", args -> "0.1.0")),
                    Nodes.node("silent", "Return nothing")
                        .child(Nodes.action("", args -> null))),
            Nodes.node("set", "Change a setting")
                .child(
                    Nodes.node("mtu", "Transmission unit")
                        .child(
                            Nodes.variable("size", "Bytes", VariableTypes.INTEGER)
                                .child(
                                    Nodes.action(
                                        "Apply",
                                        StringBuilder.class,
                                        (sink, args) -> sink.append(args.getLong("size")))))),
            Nodes.node("ask", "Ask a question")
                .child(
                    Nodes.variable("question", "Question")
                        .pattern("\\S+")
                        .child(Nodes.action("Ask", args -> args.getString("question")))),
            Nodes.node("say", "Say something")
                .child(
                    Nodes.variable("text", "Text", VariableTypes.STRING)
                        .child(Nodes.action("Say", args -> args.getString("text")))),
            Nodes.node("fail", "Always fails")
                .child(
                    Nodes.action(
                        "",
                        args -> {
                          throw new IllegalStateException("device busy");
                        })));
    io = new BufferIO();
    shell = new Shell(new Parser(grammar), ShellConfig.defaults(), io, log);
  }

  @Test
  void executesCommandsAndPrintsResults() {
    assertEquals(Shell.Status.OK, shell.handle("show version"));
    assertEquals("0.1.0\n", io.out.toString());

    assertEquals(Shell.Status.OK, shell.handle("  show   silent "));
    assertEquals("0.1.0\n", io.out.toString());
  }

  @Test
  void callbacksReceiveTheUserObject() {
    assertEquals(Shell.Status.OK, shell.handle("set mtu 1400"));
    assertEquals("1400", log.toString());
  }

  @Test
  void blankLinesAndExitCommands() {
    assertEquals(Shell.Status.OK, shell.handle("   "));
    assertEquals(Shell.Status.OK, shell.handle(null));
    assertEquals(Shell.Status.EXIT, shell.handle("exit"));
    assertEquals(Shell.Status.EXIT, shell.handle(" quit "));
    assertEquals("", io.out.toString());
  }

  @Test
  void helpKeyListsWhatMayFollow() {
    assertEquals(Shell.Status.OK, shell.handle("show ?"));

    String text = io.out.toString();
    assertTrue(text.contains("version"), text);
    assertTrue(text.contains("Print the version"), text);
    assertTrue(text.contains("silent"), text);
    assertFalse(text.contains("mtu"), text);
  }

  @Test
  void helpKeyFiltersByPartialWord() {
    shell.handle("show v?");

    String text = io.out.toString();
    assertTrue(text.contains("version"), text);
    assertFalse(text.contains("silent"), text);
  }

  @Test
  void helpKeyInsideAnArgumentIsNotHelp() {
    assertEquals(Shell.Status.OK, shell.handle("ask why?"));
    assertEquals(Shell.Status.OK, shell.handle("say 'is it?'"));
    assertEquals("why?\nis it?\n", io.out.toString());

    assertEquals(Shell.Status.FAILED, shell.handle("say 'is it?"));
    assertEquals("why?\nis it?\n", io.out.toString());
  }

  @Test
  void helpKeyAfterAnArgumentStillListsWhatFollows() {
    assertEquals(Shell.Status.OK, shell.handle("ask ?"));
    assertTrue(io.out.toString().contains("<question>"), io.out.toString());
  }

  @Test
  void helpWithNothingToOffer() {
    shell.handle("show x?");

    assertEquals("No completions\n", io.out.toString());
  }

  @Test
  void helpAfterInvalidInput() {
    assertEquals(Shell.Status.FAILED, shell.handle("show bogus ?"));
    assertTrue(io.err.toString().startsWith("Invalid input at column 6: bogus"), io.err.toString());
  }

  @Test
  void unknownInputIsPointedAt() {
    assertEquals(Shell.Status.FAILED, shell.handle("show bogus"));

    List<String> lines = io.err.toString().lines().toList();
    assertEquals("Invalid input at column 6: bogus", lines.get(0));
    assertEquals("  show bogus", lines.get(1));
    assertEquals("       ^", lines.get(2));
  }

  @Test
  void invalidValueIsPointedAt() {
    assertEquals(Shell.Status.FAILED, shell.handle("set mtu 99999999999999999999"));

    List<String> lines = io.err.toString().lines().toList();
    assertTrue(lines.get(0).startsWith("Invalid value '99999999999999999999'"), lines.get(0));
    assertEquals("          ^", lines.get(2));
  }

  @Test
  void partialCommandsSuggestHelp() {
    assertEquals(Shell.Status.FAILED, shell.handle("set mtu"));

    List<String> lines = io.err.toString().lines().toList();
    assertEquals("Incomplete command: set mtu", lines.get(0));
    assertEquals("Type 'set mtu ?' to see what may follow", lines.get(1));
  }

  @Test
  void callbackFailuresAreReported() {
    assertEquals(Shell.Status.FAILED, shell.handle("fail"));
    assertEquals("Error: device busy\n", io.err.toString());
  }

  @Test
  void runNeedsATerminal() {
    assertThrows(IllegalStateException.class, () -> shell.run(true));
  }
}
