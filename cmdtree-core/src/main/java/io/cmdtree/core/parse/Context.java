package io.cmdtree.core.parse;

import io.cmdtree.core.grammar.Grammar;
import io.cmdtree.core.grammar.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State of one parse: the input, how far it was consumed, which nodes were entered and what the
 * variables collected. A context is created and filled by the {@link Parser}; callers only read it.
 */
public final class Context {
  private final Grammar grammar;
  private final String command;
  private final Object userObject;
  private final int[] traversals;
  private final Map<String, Object> vars = new LinkedHashMap<>();
  private final List<Node> history = new ArrayList<>();

  private int cursor;
  private Node current;
  private Node terminal;
  private ParseFailure failure;
  private ParseOutcome outcome = ParseOutcome.PARTIAL;

  Context(Grammar grammar, String command, Object userObject) {
    this.grammar = grammar;
    this.command = command;
    this.userObject = userObject;
    this.traversals = new int[grammar.nodes().size()];
    this.current = grammar.root();
  }

  public Grammar grammar() {
    return grammar;
  }

  public String command() {
    return command;
  }

  public Optional<Object> userObject() {
    return Optional.ofNullable(userObject);
  }

  public int cursor() {
    return cursor;
  }

  /** The consumed part of the input, including whitespace after the last token. */
  public String parsed() {
    return command.substring(0, cursor);
  }

  /** The unconsumed part of the input. {@code parsed() + remaining()} is always the input. */
  public String remaining() {
    return command.substring(cursor);
  }

  /**
   * The last node whose token was consumed, or the root. Completion and help look at its children.
   * An action that only matched the end of input is not current.
   */
  public Node currentNode() {
    return current;
  }

  /** Nodes entered so far, in order, including a terminating action. */
  public List<Node> history() {
    return Collections.unmodifiableList(history);
  }

  /** The action this parse terminated at, if any. */
  public Optional<Node> terminal() {
    return Optional.ofNullable(terminal);
  }

  public Optional<ParseFailure> failure() {
    return Optional.ofNullable(failure);
  }

  public ParseOutcome outcome() {
    return outcome;
  }

  public boolean isComplete() {
    return outcome == ParseOutcome.COMPLETE;
  }

  /**
   * Collected variables in the order they were first set. Variables that may be visited more than
   * once hold a list.
   */
  public Map<String, Object> vars() {
    Map<String, Object> copy = new LinkedHashMap<>();
    vars.forEach(
        (name, value) ->
            copy.put(
                name, value instanceof ValueList list ? Collections.unmodifiableList(list) : value));
    return Collections.unmodifiableMap(copy);
  }

  /** How often {@code node} has been entered in this parse. Actions are never counted. */
  public int traversed(Node node) {
    return traversals[node.id()];
  }

  /**
   * Whether {@code node} may be entered now: its traversal limit is not reached and, for a single
   * value variable, its value has not been set through another node.
   */
  public boolean canEnter(Node node) {
    if (node.isRoot()) {
      return false;
    }
    int limit = node.traversals();
    if (limit != 0 && traversals[node.id()] >= limit) {
      return false;
    }
    return !(node.isVariable() && !node.collectsList() && vars.containsKey(node.varName()));
  }

  void enter(Node node, Object value, int next) {
    if (node.isVariable()) {
      if (node.collectsList()) {
        Object existing = vars.get(node.varName());
        ValueList list;
        if (existing instanceof ValueList values) {
          list = values;
        } else {
          list = new ValueList();
          if (existing != null) {
            list.add(existing);
          }
          vars.put(node.varName(), list);
        }
        list.add(value);
      } else {
        vars.put(node.varName(), value);
      }
    }
    if (!node.isAction()) {
      traversals[node.id()]++;
    }
    history.add(node);
    current = node;
    cursor = next;
  }

  void skipTo(int next) {
    cursor = next;
  }

  /**
   * Ends the parse at {@code action}. An action reached without consuming input is recorded in the
   * history but does not become the current node, so completion and help still see the node the
   * input stopped at.
   */
  void terminate(Node action) {
    if (current != action) {
      history.add(action);
    }
    terminal = action;
    outcome = ParseOutcome.COMPLETE;
  }

  void fail(ParseFailure failure) {
    this.failure = failure;
    this.outcome = ParseOutcome.INVALID_VALUE;
  }

  void end(ParseOutcome outcome) {
    this.outcome = outcome;
  }

  @Override
  public String toString() {
    return "Context[" + outcome + ", parsed='" + parsed() + "', remaining='" + remaining() + "']";
  }

  /** Marks lists the parser accumulated, as opposed to list values a type produced. */
  private static final class ValueList extends ArrayList<Object> {
    private static final long serialVersionUID = 1L;
  }
}
