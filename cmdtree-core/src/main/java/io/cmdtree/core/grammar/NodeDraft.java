package io.cmdtree.core.grammar;

import io.cmdtree.core.completion.CandidateProvider;
import io.cmdtree.core.dispatch.ActionBinding;
import io.cmdtree.core.help.HelpProvider;
import io.cmdtree.core.types.VariableType;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Mutable arena entry used while a grammar is assembled and its aliases resolved. */
final class NodeDraft {
  final int id;
  final NodeKind kind;
  final String name;
  final int parentId;
  final NodeDefinition definition;

  Pattern pattern;
  Pattern separator;
  boolean defaultPattern;
  List<String> literals = List.of();
  HelpProvider help;
  int traversals;
  boolean matchCandidates;
  int helpGroup;
  boolean hidden;
  CandidateProvider candidates;
  VariableType<?> type;
  String varName;
  ActionBinding binding;

  /** Declared children in order: owned nodes and unresolved aliases. */
  final List<Slot> slots = new ArrayList<>();

  NodeDraft(int id, NodeKind kind, String name, int parentId, NodeDefinition definition) {
    this.id = id;
    this.kind = kind;
    this.name = name;
    this.parentId = parentId;
    this.definition = definition;
  }

  /** Slash-separated path of this draft, computed through the parent ids in {@code arena}. */
  String path(List<NodeDraft> arena) {
    List<String> names = new ArrayList<>();
    for (NodeDraft node = this; node.parentId != Node.NO_PARENT; node = arena.get(node.parentId)) {
      names.add(0, node.name);
    }
    return "/" + String.join("/", names);
  }

  /** A declared child position: either an owned node or an alias awaiting resolution. */
  sealed interface Slot permits NodeSlot, AliasSlot {
    String name();
  }

  record NodeSlot(NodeDraft node) implements Slot {
    @Override
    public String name() {
      return node.name;
    }
  }

  record AliasSlot(NodeDefinition alias, NodeDraft owner, String location) implements Slot {
    @Override
    public String name() {
      return alias.name().orElse(null);
    }

    String target() {
      return alias.target();
    }
  }
}
