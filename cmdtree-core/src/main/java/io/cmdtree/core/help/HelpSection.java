package io.cmdtree.core.help;

import java.util.List;

/** Help entries sharing a display group. */
public record HelpSection(int group, List<HelpEntry> entries) {
  public HelpSection {
    entries = List.copyOf(entries);
  }
}
