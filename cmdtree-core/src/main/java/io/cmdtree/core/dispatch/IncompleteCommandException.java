package io.cmdtree.core.dispatch;

import io.cmdtree.core.parse.Context;
import io.cmdtree.core.parse.ParseOutcome;

/** Thrown when a command is executed that does not end at an action. */
public class IncompleteCommandException extends Exception {
  private final transient Context context;

  public IncompleteCommandException(Context context) {
    super(describe(context));
    this.context = context;
  }

  public Context getContext() {
    return context;
  }

  public ParseOutcome getOutcome() {
    return context.outcome();
  }

  public String getParsed() {
    return context.parsed();
  }

  public String getRemaining() {
    return context.remaining();
  }

  private static String describe(Context context) {
    switch (context.outcome()) {
      case NO_MATCH:
        return "Invalid input at column " + (context.cursor() + 1) + ": " + context.remaining();
      case INVALID_VALUE:
        return context
            .failure()
            .map(f -> "Invalid value '" + f.token() + "': " + f.message())
            .orElse("Invalid value");
      default:
        return context.command().isBlank()
            ? "Empty command"
            : "Incomplete command: " + context.command().strip();
    }
  }
}
