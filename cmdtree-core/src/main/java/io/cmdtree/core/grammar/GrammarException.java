package io.cmdtree.core.grammar;

/**
 * Base class for errors detected while declaring or building a grammar. A grammar that fails to
 * build is never handed out, so these are fatal to construction.
 */
public abstract class GrammarException extends RuntimeException {
  protected GrammarException(String message) {
    super(message);
  }

  protected GrammarException(String message, Throwable cause) {
    super(message, cause);
  }
}
