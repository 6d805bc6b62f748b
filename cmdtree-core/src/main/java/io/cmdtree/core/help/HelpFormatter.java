package io.cmdtree.core.help;

import java.util.List;

/** Renders help sections as two aligned columns with a blank line between groups. */
public final class HelpFormatter {
  private static final int GAP = 2;

  private final String indent;

  public HelpFormatter() {
    this("  ");
  }

  public HelpFormatter(String indent) {
    this.indent = indent;
  }

  public String format(List<HelpSection> sections) {
    int width = 0;
    for (HelpSection section : sections) {
      for (HelpEntry entry : section.entries()) {
        width = Math.max(width, entry.key().length());
      }
    }
    StringBuilder out = new StringBuilder();
    for (HelpSection section : sections) {
      if (section.entries().isEmpty()) {
        continue;
      }
      if (out.length() > 0) {
        out.append(System.lineSeparator());
      }
      for (HelpEntry entry : section.entries()) {
        out.append(indent).append(entry.key());
        if (!entry.text().isEmpty()) {
          out.append(" ".repeat(width - entry.key().length() + GAP)).append(entry.text());
        }
        out.append(System.lineSeparator());
      }
    }
    return out.toString();
  }

  /** Formats a flat entry list as a single group. */
  public String formatEntries(List<HelpEntry> entries) {
    return format(List.of(new HelpSection(0, entries)));
  }
}
