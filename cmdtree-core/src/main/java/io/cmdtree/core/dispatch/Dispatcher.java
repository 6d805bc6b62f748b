package io.cmdtree.core.dispatch;

import io.cmdtree.core.grammar.Node;
import io.cmdtree.core.parse.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs the action a completed parse terminated at. */
public final class Dispatcher {
  private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

  /**
   * Invokes the terminal action's callback with the collected variables.
   *
   * @throws IncompleteCommandException if the context did not complete
   * @throws Exception whatever the callback throws, unchanged
   */
  public DispatchResult dispatch(Context context) throws Exception {
    if (!context.isComplete()) {
      throw new IncompleteCommandException(context);
    }
    Node action =
        context.terminal().orElseThrow(() -> new IllegalStateException("No terminal action"));
    ActionBinding binding =
        action
            .binding()
            .orElseThrow(() -> new IllegalStateException(action + " has no callback"));
    Arguments args = new Arguments(context.vars());
    log.debug("Dispatching {} with {}", context.grammar().path(action), args);
    Object value = binding.invoke(context.userObject().orElse(null), args);
    return new DispatchResult(context, value);
  }
}
