package io.cmdtree.core.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable, fully resolved command grammar.
 *
 * <p>Nodes are held in an arena indexed by {@link Node#id()}; aliases have been replaced by shared
 * references, so the same node may appear in several child lists. A grammar is safe to share
 * between threads: all per-parse state lives in a {@link io.cmdtree.core.parse.Context}.
 *
 * <pre>{@code
 * Grammar grammar = Grammar.builder()
 *     .child(Nodes.node("one", "One").child(Nodes.alias("/three"), Nodes.node("two", "Two")))
 *     .child(Nodes.node("three", "Three"))
 *     .build();
 * }</pre>
 */
public final class Grammar {
  private final List<Node> nodes;
  private final Map<String, Node> byPath;

  private Grammar(List<Node> nodes) {
    this.nodes = List.copyOf(nodes);
    Map<String, Node> paths = new LinkedHashMap<>();
    for (Node node : this.nodes) {
      paths.put(computePath(node), node);
    }
    this.byPath = Collections.unmodifiableMap(paths);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builds a grammar whose root has the given children. */
  public static Grammar of(NodeDefinition... children) {
    return builder().child(children).build();
  }

  public Node root() {
    return nodes.get(0);
  }

  /** All nodes, in declaration order, root first. */
  public List<Node> nodes() {
    return nodes;
  }

  public Node node(int id) {
    return nodes.get(id);
  }

  /** Resolved children of {@code node}, in tie-break order, aliased nodes included. */
  public List<Node> children(Node node) {
    int[] ids = own(node).childIds();
    List<Node> children = new ArrayList<>(ids.length);
    for (int id : ids) {
      children.add(nodes.get(id));
    }
    return children;
  }

  /** The node that declares {@code node}; empty for the root. */
  public Optional<Node> parent(Node node) {
    int parentId = own(node).parentId();
    return parentId == Node.NO_PARENT ? Optional.empty() : Optional.of(nodes.get(parentId));
  }

  /** Canonical path of {@code node}, following declaring parents. The root is {@code /}. */
  public String path(Node node) {
    return computePath(own(node));
  }

  /** Looks a node up by its canonical absolute path. */
  public Optional<Node> find(String path) {
    String normalized = path.strip();
    if (normalized.length() > 1 && normalized.endsWith("/")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    if (!normalized.startsWith("/")) {
      normalized = "/" + normalized;
    }
    return Optional.ofNullable(byPath.get(normalized));
  }

  /**
   * Nodes whose canonical path matches an absolute path expression, globs allowed, in declaration
   * order.
   *
   * @throws IllegalArgumentException if the expression is malformed or relative
   */
  public List<Node> select(String expression) {
    PathExpression path = PathExpression.parse(expression);
    if (!path.absolute()) {
      throw new IllegalArgumentException("Selection path must be absolute: " + expression);
    }
    List<Node> selected = new ArrayList<>();
    selected.add(root());
    for (PathExpression.Segment segment : path.segments()) {
      List<Node> next = new ArrayList<>();
      for (Node node : selected) {
        switch (segment.type()) {
          case SELF -> next.add(node);
          case PARENT -> parent(node).ifPresent(next::add);
          default -> {
            for (Node child : nodes) {
              if (child.parentId() == node.id() && segment.matches(child.name())) {
                next.add(child);
              }
            }
          }
        }
      }
      selected = next.stream().distinct().toList();
    }
    return selected;
  }

  private Node own(Node node) {
    if (node.id() >= nodes.size() || nodes.get(node.id()) != node) {
      throw new IllegalArgumentException(node + " does not belong to this grammar");
    }
    return node;
  }

  private String computePath(Node node) {
    List<String> names = new ArrayList<>();
    for (Node n = node; n.parentId() != Node.NO_PARENT; n = nodes.get(n.parentId())) {
      names.add(0, n.name());
    }
    return "/" + String.join("/", names);
  }

  @Override
  public String toString() {
    return "Grammar[" + nodes.size() + " nodes]";
  }

  /**
   * Collects root children and builds the grammar once. Building is synchronized and one-shot:
   * later calls return the same grammar and the declarations are frozen.
   */
  public static final class Builder {
    private final NodeDefinition root = Nodes.root();
    private Grammar built;

    private Builder() {}

    public synchronized Builder child(NodeDefinition... children) {
      if (built != null) {
        throw new IllegalStateException("Grammar already built");
      }
      root.child(children);
      return this;
    }

    /**
     * Resolves the declarations into a grammar.
     *
     * @throws GrammarDefinitionException for invalid declarations
     * @throws AliasResolutionException when an alias cannot be resolved
     */
    public synchronized Grammar build() {
      if (built == null) {
        Grammar grammar = new Grammar(new GrammarAssembler().assemble(root));
        root.freeze();
        built = grammar;
      }
      return built;
    }
  }
}
