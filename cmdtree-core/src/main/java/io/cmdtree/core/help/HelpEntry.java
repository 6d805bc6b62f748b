package io.cmdtree.core.help;

import java.util.Objects;

/** One help line: the word or placeholder a user can type, and what it does. */
public record HelpEntry(String key, String text) {
  public HelpEntry {
    Objects.requireNonNull(key, "key");
    text = text == null ? "" : text;
  }
}
