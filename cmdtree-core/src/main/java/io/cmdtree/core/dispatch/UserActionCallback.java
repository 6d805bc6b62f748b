package io.cmdtree.core.dispatch;

/**
 * Runs a completed command with the user object given to the parser, typically the application
 * state the command acts on.
 */
@FunctionalInterface
public interface UserActionCallback<U> {
  Object invoke(U user, Arguments args) throws Exception;
}
