package io.cmdtree.shell;

import static org.junit.jupiter.api.Assertions.*;

import io.cmdtree.core.dispatch.Arguments;
import io.cmdtree.core.types.VariableTypes;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CallbackRegistryTest {

  private static Object invoke(CallbackRegistry registry, String action, Map<String, Object> values)
      throws Exception {
    return registry.findAction(action).orElseThrow().invoke(null, new Arguments(values));
  }

  @Test
  void echoJoinsValuesAndFlattensLists() throws Exception {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("name", "eth0");
    values.put("words", List.of("up", "fast"));
    values.put("mtu", 1500L);

    assertEquals("eth0 up fast 1500", invoke(CallbackRegistry.withBuiltins(), "echo", values));
    assertEquals("", invoke(CallbackRegistry.withBuiltins(), "echo", Map.of()));
  }

  @Test
  void varsListsOneLinePerVariable() throws Exception {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("host", "example.com");
    values.put("port", 22L);

    assertEquals(
        "host = example.com" + System.lineSeparator() + "port = 22",
        invoke(CallbackRegistry.withBuiltins(), "vars", values));
    assertEquals("(no variables)", invoke(CallbackRegistry.withBuiltins(), "vars", Map.of()));
  }

  @Test
  void userObjectActions() throws Exception {
    CallbackRegistry registry =
        new CallbackRegistry()
            .action("greet", StringBuilder.class, (sb, args) -> sb.append("hi ").append(args.get("who")));
    StringBuilder sink = new StringBuilder();

    registry.findAction("greet").orElseThrow().invoke(sink, new Arguments(Map.of("who", "bob")));

    assertEquals("hi bob", sink.toString());
    assertTrue(registry.findAction("greet").orElseThrow().needsUserObject());
  }

  @Test
  void typesFallBackToBuiltins() {
    CallbackRegistry registry =
        new CallbackRegistry().type("integer", VariableTypes.of("\\d+", Integer::valueOf));

    assertNotSame(VariableTypes.INTEGER, registry.findType("integer").orElseThrow());
    assertSame(VariableTypes.BOOLEAN, registry.findType("boolean").orElseThrow());
    assertTrue(registry.findType("colour").isEmpty());
  }

  @Test
  void emptyRegistryKnowsNothing() {
    CallbackRegistry registry = new CallbackRegistry();

    assertTrue(registry.findAction("echo").isEmpty());
    assertTrue(registry.findCandidates("signals").isEmpty());
    assertTrue(registry.findHelp("signals").isEmpty());
  }

  @Test
  void blankNamesAreRejected() {
    CallbackRegistry registry = new CallbackRegistry();

    assertThrows(IllegalArgumentException.class, () -> registry.action(" ", args -> null));
    assertThrows(IllegalArgumentException.class, () -> registry.type("", VariableTypes.WORD));
  }
}
