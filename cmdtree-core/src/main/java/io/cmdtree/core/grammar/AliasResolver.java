package io.cmdtree.core.grammar;

import io.cmdtree.core.grammar.NodeDraft.AliasSlot;
import io.cmdtree.core.grammar.NodeDraft.NodeSlot;
import io.cmdtree.core.grammar.NodeDraft.Slot;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves alias slots against the declared structure and computes each node's final child list.
 *
 * <p>Paths are walked over declared children only: absolute paths start at the root, relative
 * paths at the node the alias is declared under. A segment landing on a named alias expands to that
 * alias's own targets, which is where resolution cycles can arise.
 */
final class AliasResolver {
  private static final Logger log = LoggerFactory.getLogger(AliasResolver.class);

  private final List<NodeDraft> drafts;
  private final Map<AliasSlot, List<NodeDraft>> resolved = new HashMap<>();
  private final Set<AliasSlot> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());

  AliasResolver(List<NodeDraft> drafts) {
    this.drafts = drafts;
  }

  /** Returns the resolved child ids of every draft, indexed by draft id. */
  int[][] resolve() {
    int[][] children = new int[drafts.size()][];
    for (NodeDraft draft : drafts) {
      LinkedHashSet<Integer> ids = new LinkedHashSet<>();
      for (Slot slot : draft.slots) {
        if (slot instanceof NodeSlot nodeSlot) {
          ids.add(nodeSlot.node().id);
        } else {
          for (NodeDraft target : resolve((AliasSlot) slot)) {
            ids.add(target.id);
          }
        }
      }
      children[draft.id] = ids.stream().mapToInt(Integer::intValue).toArray();
    }
    checkEmptyLoops(children);
    return children;
  }

  private List<NodeDraft> resolve(AliasSlot alias) {
    List<NodeDraft> cached = resolved.get(alias);
    if (cached != null) {
      return cached;
    }
    if (!inProgress.add(alias)) {
      throw new AliasResolutionException(
          alias.location(), alias.target(), "alias refers back to itself");
    }
    try {
      PathExpression path;
      try {
        path = PathExpression.parse(alias.target());
      } catch (IllegalArgumentException e) {
        throw new AliasResolutionException(
            alias.location(), alias.target(), "malformed path: " + e.getMessage());
      }
      List<NodeDraft> current = List.of(path.absolute() ? drafts.get(0) : alias.owner());
      for (PathExpression.Segment segment : path.segments()) {
        current = step(current, segment, alias);
        if (current.isEmpty()) {
          throw new AliasResolutionException(
              alias.location(), alias.target(), "segment '" + segment.text() + "' matches no node");
        }
      }
      for (NodeDraft target : current) {
        if (target.kind == NodeKind.ROOT) {
          throw new AliasResolutionException(
              alias.location(), alias.target(), "the grammar root cannot be aliased");
        }
      }
      List<NodeDraft> targets = List.copyOf(current);
      resolved.put(alias, targets);
      if (log.isDebugEnabled()) {
        log.debug(
            "Resolved alias {} -> '{}' to {}",
            alias.location(),
            alias.target(),
            targets.stream().map(this::path).collect(Collectors.toList()));
      }
      return targets;
    } finally {
      inProgress.remove(alias);
    }
  }

  private List<NodeDraft> step(List<NodeDraft> current, PathExpression.Segment segment, AliasSlot alias) {
    LinkedHashSet<NodeDraft> next = new LinkedHashSet<>();
    for (NodeDraft node : current) {
      switch (segment.type()) {
        case SELF -> next.add(node);
        case PARENT -> {
          if (node.parentId == Node.NO_PARENT) {
            throw new AliasResolutionException(
                alias.location(), alias.target(), "path climbs above the grammar root");
          }
          next.add(drafts.get(node.parentId));
        }
        case NAME, GLOB -> {
          for (Slot slot : node.slots) {
            if (!segment.matches(slot.name())) {
              continue;
            }
            if (slot instanceof NodeSlot nodeSlot) {
              next.add(nodeSlot.node());
            } else {
              next.addAll(resolve((AliasSlot) slot));
            }
          }
        }
      }
    }
    return new ArrayList<>(next);
  }

  /**
   * Rejects cycles made only of nodes whose pattern accepts the empty string: following such a
   * cycle would never consume input.
   */
  private void checkEmptyLoops(int[][] children) {
    boolean[] empty = new boolean[drafts.size()];
    for (NodeDraft draft : drafts) {
      empty[draft.id] =
          draft.kind != NodeKind.ROOT
              && draft.pattern != null
              && draft.pattern.matcher("").matches();
    }
    int[] state = new int[drafts.size()];
    for (NodeDraft draft : drafts) {
      if (empty[draft.id] && state[draft.id] == 0) {
        visit(draft.id, children, empty, state);
      }
    }
  }

  private void visit(int id, int[][] children, boolean[] empty, int[] state) {
    state[id] = 1;
    for (int child : children[id]) {
      if (!empty[child]) {
        continue;
      }
      if (state[child] == 1) {
        throw new AliasResolutionException(
            path(drafts.get(id)),
            path(drafts.get(child)),
            "creates a loop that consumes no input");
      }
      if (state[child] == 0) {
        visit(child, children, empty, state);
      }
    }
    state[id] = 2;
  }

  private String path(NodeDraft draft) {
    return draft.path(drafts);
  }
}
