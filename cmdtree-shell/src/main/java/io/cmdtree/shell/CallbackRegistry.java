package io.cmdtree.shell;

import io.cmdtree.core.completion.CandidateProvider;
import io.cmdtree.core.dispatch.ActionBinding;
import io.cmdtree.core.dispatch.ActionCallback;
import io.cmdtree.core.dispatch.Arguments;
import io.cmdtree.core.dispatch.UserActionCallback;
import io.cmdtree.core.help.HelpProvider;
import io.cmdtree.core.types.VariableType;
import io.cmdtree.core.types.VariableTypes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Named callbacks, candidate providers, help providers and variable types that declarative
 * grammars refer to. Variable types fall back to the built-ins of {@link VariableTypes}.
 */
public final class CallbackRegistry {
  private final Map<String, ActionBinding> actions = new LinkedHashMap<>();
  private final Map<String, CandidateProvider> candidates = new LinkedHashMap<>();
  private final Map<String, HelpProvider> help = new LinkedHashMap<>();
  private final Map<String, VariableType<?>> types = new LinkedHashMap<>();

  /**
   * A registry with the {@code echo} and {@code vars} actions, so any grammar can be tried out
   * before real callbacks exist. {@code echo} returns the collected values joined by spaces,
   * {@code vars} one {@code name = value} line per variable.
   */
  public static CallbackRegistry withBuiltins() {
    CallbackRegistry registry = new CallbackRegistry();
    registry.action("echo", CallbackRegistry::echo);
    registry.action("vars", CallbackRegistry::vars);
    return registry;
  }

  public CallbackRegistry action(String name, ActionCallback callback) {
    return action(name, ActionBinding.of(callback));
  }

  public <U> CallbackRegistry action(
      String name, Class<U> userType, UserActionCallback<U> callback) {
    return action(name, ActionBinding.withUserObject(userType, callback));
  }

  public CallbackRegistry action(String name, ActionBinding binding) {
    actions.put(requireName(name), Objects.requireNonNull(binding, "binding"));
    return this;
  }

  public CallbackRegistry candidates(String name, CandidateProvider provider) {
    candidates.put(requireName(name), Objects.requireNonNull(provider, "provider"));
    return this;
  }

  public CallbackRegistry help(String name, HelpProvider provider) {
    help.put(requireName(name), Objects.requireNonNull(provider, "provider"));
    return this;
  }

  public CallbackRegistry type(String name, VariableType<?> type) {
    types.put(requireName(name), Objects.requireNonNull(type, "type"));
    return this;
  }

  public Optional<ActionBinding> findAction(String name) {
    return Optional.ofNullable(actions.get(name));
  }

  public Optional<CandidateProvider> findCandidates(String name) {
    return Optional.ofNullable(candidates.get(name));
  }

  public Optional<HelpProvider> findHelp(String name) {
    return Optional.ofNullable(help.get(name));
  }

  /** A registered type, or a built-in one of the same name. */
  public Optional<VariableType<?>> findType(String name) {
    VariableType<?> type = types.get(name);
    return type != null ? Optional.of(type) : VariableTypes.byName(name);
  }

  private static String requireName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Registry names must not be blank");
    }
    return name;
  }

  private static Object echo(Arguments args) {
    List<String> words = new ArrayList<>();
    for (Object value : args.asMap().values()) {
      if (value instanceof List<?> list) {
        list.forEach(item -> words.add(String.valueOf(item)));
      } else {
        words.add(String.valueOf(value));
      }
    }
    return String.join(" ", words);
  }

  private static Object vars(Arguments args) {
    if (args.size() == 0) {
      return "(no variables)";
    }
    return args.asMap().entrySet().stream()
        .map(e -> e.getKey() + " = " + e.getValue())
        .collect(Collectors.joining(System.lineSeparator()));
  }
}
