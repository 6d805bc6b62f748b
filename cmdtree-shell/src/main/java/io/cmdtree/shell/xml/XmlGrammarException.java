package io.cmdtree.shell.xml;

/** Thrown when an XML grammar cannot be read or does not follow the grammar schema. */
public class XmlGrammarException extends Exception {
  public XmlGrammarException(String message) {
    super(message);
  }

  public XmlGrammarException(String message, Throwable cause) {
    super(message, cause);
  }
}
