package io.cmdtree.core.dispatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Read-only view of the variables a parse collected, with typed getters. */
public final class Arguments {
  private final Map<String, Object> values;

  public Arguments(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public boolean has(String name) {
    return values.containsKey(name);
  }

  /** Raw value, {@code null} when the variable was not collected. */
  public Object get(String name) {
    return values.get(name);
  }

  public <T> Optional<T> find(String name, Class<T> type) {
    Object value = values.get(name);
    if (value == null) {
      return Optional.empty();
    }
    if (!type.isInstance(value)) {
      throw new ClassCastException(
          "Variable '" + name + "' is a " + value.getClass().getName() + ", not " + type.getName());
    }
    return Optional.of(type.cast(value));
  }

  /**
   * Typed value of a collected variable.
   *
   * @throws IllegalArgumentException if the variable was not collected
   */
  public <T> T get(String name, Class<T> type) {
    return find(name, type)
        .orElseThrow(() -> new IllegalArgumentException("No variable named '" + name + "'"));
  }

  public String getString(String name) {
    Object value = values.get(name);
    return value == null ? null : value.toString();
  }

  public long getLong(String name) {
    return get(name, Number.class).longValue();
  }

  public double getDouble(String name) {
    return get(name, Number.class).doubleValue();
  }

  public boolean getBoolean(String name) {
    return get(name, Boolean.class);
  }

  /** The values of a repeatable variable; a single value is returned as a one-element list. */
  public List<Object> getList(String name) {
    Object value = values.get(name);
    if (value == null) {
      return List.of();
    }
    if (value instanceof List<?> list) {
      return Collections.unmodifiableList(list);
    }
    return List.of(value);
  }

  public Set<String> names() {
    return values.keySet();
  }

  public Map<String, Object> asMap() {
    return values;
  }

  public int size() {
    return values.size();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
