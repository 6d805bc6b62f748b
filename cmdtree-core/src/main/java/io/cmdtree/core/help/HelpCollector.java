package io.cmdtree.core.help;

import io.cmdtree.core.grammar.Node;
import io.cmdtree.core.parse.Context;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Gathers help for whatever may follow a partial parse: the visible children of the frontier node
 * that can still be entered, ordered by help group and then by declaration order.
 */
public final class HelpCollector {

  /** Flat list of entries, in display order. */
  public List<HelpEntry> collect(Context context) {
    List<HelpEntry> entries = new ArrayList<>();
    for (HelpSection section : sections(context)) {
      entries.addAll(section.entries());
    }
    return entries;
  }

  public List<HelpSection> sections(Context context) {
    Map<Integer, List<HelpEntry>> groups = new TreeMap<>();
    for (Node child : context.grammar().children(context.currentNode())) {
      if (child.hidden() || !context.canEnter(child)) {
        continue;
      }
      List<HelpEntry> lines = child.help().help(context);
      if (lines == null || lines.isEmpty()) {
        continue;
      }
      groups.computeIfAbsent(child.helpGroup(), g -> new ArrayList<>()).addAll(lines);
    }
    List<HelpSection> sections = new ArrayList<>(groups.size());
    groups.forEach((group, lines) -> sections.add(new HelpSection(group, lines)));
    return sections;
  }
}
