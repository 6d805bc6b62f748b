package io.cmdtree.core.dispatch;

/** Runs a completed command. The return value is handed back in the {@link DispatchResult}. */
@FunctionalInterface
public interface ActionCallback {
  Object invoke(Arguments args) throws Exception;
}
