package io.cmdtree.core.types;

/** Thrown by a variable type when a token matched its pattern but is not a valid value. */
public class VariableParseException extends Exception {
  private final String token;

  public VariableParseException(String token, String message) {
    super(message);
    this.token = token;
  }

  public VariableParseException(String token, String message, Throwable cause) {
    super(message, cause);
    this.token = token;
  }

  /** The offending input. */
  public String getToken() {
    return token;
  }
}
