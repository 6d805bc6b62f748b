package io.cmdtree.core.types;

/** Converts a matched token into a value. */
@FunctionalInterface
public interface ValueParser<T> {
  T parse(String token) throws VariableParseException;
}
