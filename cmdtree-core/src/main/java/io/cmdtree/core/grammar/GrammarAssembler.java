package io.cmdtree.core.grammar;

import io.cmdtree.core.completion.LiteralChoices;
import io.cmdtree.core.grammar.NodeDraft.AliasSlot;
import io.cmdtree.core.grammar.NodeDraft.NodeSlot;
import io.cmdtree.core.grammar.NodeDraft.Slot;
import io.cmdtree.core.help.HelpProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a declaration tree into the node arena: groups are flattened into their parent with their
 * overrides applied, runtime nodes get their effective attributes, and aliases are resolved.
 */
final class GrammarAssembler {
  private static final Logger log = LoggerFactory.getLogger(GrammarAssembler.class);

  private final List<NodeDraft> drafts = new ArrayList<>();

  List<Node> assemble(NodeDefinition root) {
    NodeDraft rootDraft = draft(root, "", Node.NO_PARENT, GroupOverrides.NONE);
    flatten(root, rootDraft, GroupOverrides.NONE);

    int[][] children = new AliasResolver(drafts).resolve();

    List<Node> nodes = new ArrayList<>(drafts.size());
    for (NodeDraft draft : drafts) {
      nodes.add(new Node(draft, children[draft.id]));
    }
    log.debug("Assembled grammar with {} nodes", nodes.size());
    return nodes;
  }

  private void flatten(NodeDefinition definition, NodeDraft owner, GroupOverrides group) {
    for (NodeDefinition child : definition.children()) {
      switch (child.kind()) {
        case GROUP -> flatten(child, owner, child.overrides());
        case ALIAS -> addSlot(owner, new AliasSlot(child, owner, location(owner, child)));
        default -> {
          NodeDraft draft = draft(child, child.name().orElseThrow(), owner.id, group);
          addSlot(owner, new NodeSlot(draft));
          flatten(child, draft, group);
        }
      }
    }
  }

  private void addSlot(NodeDraft owner, Slot slot) {
    String name = slot.name();
    if (name != null) {
      for (Slot sibling : owner.slots) {
        if (name.equals(sibling.name())) {
          throw new GrammarDefinitionException(
              "Duplicate child name '" + name + "' under " + path(owner));
        }
      }
    }
    owner.slots.add(slot);
  }

  private NodeDraft draft(
      NodeDefinition definition, String name, int parentId, GroupOverrides group) {
    NodeKind kind = definition.kind();
    NodeDraft draft = new NodeDraft(drafts.size(), kind, name, parentId, definition);
    drafts.add(draft);

    switch (kind) {
      case ROUTING -> {
        String explicit = definition.explicitPattern().orElse(null);
        draft.defaultPattern = explicit == null;
        draft.pattern = compile(explicit == null ? Pattern.quote(name) : explicit, definition);
        draft.literals = draft.defaultPattern ? List.of(name) : LiteralChoices.of(explicit);
      }
      case VARIABLE -> {
        String source = definition.explicitPattern().orElse(definition.type().pattern());
        draft.pattern = compile(source, definition);
        draft.literals = LiteralChoices.of(source);
        draft.type = definition.type();
        draft.varName = definition.explicitVarName().orElse(name);
      }
      case ACTION -> {
        draft.pattern = definition.explicitPattern().map(p -> compile(p, definition)).orElse(null);
        draft.binding = definition.binding();
      }
      default -> {
        // the root matches the empty prefix and carries no attributes
      }
    }

    draft.separator =
        definition.explicitSeparator().map(p -> compile(p, definition)).orElse(null);
    draft.traversals = pick(definition.explicitTraversals(), group.traversals(), 1);
    draft.matchCandidates =
        pick(definition.explicitMatchCandidates(), group.matchCandidates(), false);
    draft.helpGroup =
        pick(
            definition.explicitHelpGroup(),
            group.helpGroup(),
            kind == NodeKind.ACTION ? Node.ACTION_HELP_GROUP : 0);
    draft.hidden = pick(definition.explicitHidden(), group.hidden(), false);
    draft.candidates = definition.candidateProvider().orElse(null);
    draft.help =
        definition
            .helpProvider()
            .orElseGet(() -> HelpProvider.literal(helpKey(draft), definition.helpText()));
    return draft;
  }

  private static String helpKey(NodeDraft draft) {
    if (draft.kind == NodeKind.ACTION) {
      return "<eol>";
    }
    return draft.defaultPattern ? draft.name : "<" + draft.name + ">";
  }

  private static <T> T pick(T explicit, T inherited, T fallback) {
    if (explicit != null) {
      return explicit;
    }
    return inherited != null ? inherited : fallback;
  }

  private static Pattern compile(String regex, NodeDefinition definition) {
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new GrammarDefinitionException(
          "Invalid pattern for " + definition.describe() + ": " + e.getDescription(), e);
    }
  }

  private String location(NodeDraft owner, NodeDefinition alias) {
    String base = path(owner);
    String segment = alias.name().orElse("<alias>");
    return base.endsWith("/") ? base + segment : base + "/" + segment;
  }

  private String path(NodeDraft draft) {
    return draft.path(drafts);
  }
}
