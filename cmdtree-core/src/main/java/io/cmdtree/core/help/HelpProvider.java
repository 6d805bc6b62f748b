package io.cmdtree.core.help;

import io.cmdtree.core.parse.Context;
import java.util.List;

/**
 * Produces the help lines for a node. Providers are evaluated lazily, each time help is requested,
 * and may inspect the partial parse.
 */
@FunctionalInterface
public interface HelpProvider {
  List<HelpEntry> help(Context context);

  static HelpProvider literal(String key, String text) {
    List<HelpEntry> entries = List.of(new HelpEntry(key, text));
    return context -> entries;
  }

  static HelpProvider of(HelpEntry... entries) {
    List<HelpEntry> copy = List.of(entries);
    return context -> copy;
  }
}
