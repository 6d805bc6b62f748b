package io.cmdtree.shell.xml;

import io.cmdtree.core.grammar.Grammar;
import io.cmdtree.core.grammar.GrammarException;
import io.cmdtree.core.grammar.GroupOverrides;
import io.cmdtree.core.grammar.NodeDefinition;
import io.cmdtree.core.grammar.Nodes;
import io.cmdtree.core.types.VariableType;
import io.cmdtree.core.types.VariableTypes;
import io.cmdtree.shell.CallbackRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Builds a {@link Grammar} from XML.
 *
 * <pre>{@code
 * <grammar>
 *   <node name="kill" help="Send a signal">
 *     <variable name="signal" candidates="signals" match-candidates="true">
 *       <action callback="kill" help="Send it"/>
 *     </variable>
 *   </node>
 *   <alias name="stop" target="/kill"/>
 * </grammar>
 * }</pre>
 *
 * <p>Each element accepts a fixed set of attributes with typed values; callbacks, candidate and
 * help providers and variable types are referred to by name and looked up in a {@link
 * CallbackRegistry}. Unknown elements or attributes, malformed values and unresolvable names are
 * rejected.
 */
public final class XmlGrammarLoader {
  private static final Logger log = LoggerFactory.getLogger(XmlGrammarLoader.class);

  private static final Set<String> COMMON =
      Set.of("help", "help-provider", "pattern", "separator", "traversals", "match-candidates",
          "hidden", "help-group", "candidates");

  private static final Map<String, Set<String>> ATTRIBUTES =
      Map.of(
          "grammar", Set.of(),
          "node", union(COMMON, "name"),
          "variable", union(COMMON, "name", "type", "var-name"),
          "action", Set.of("name", "help", "help-provider", "pattern", "separator", "callback",
              "hidden", "help-group"),
          "alias", Set.of("name", "target"),
          "group", Set.of("traversals", "match-candidates", "hidden", "help-group"));

  private final CallbackRegistry registry;

  public XmlGrammarLoader(CallbackRegistry registry) {
    this.registry = registry;
  }

  public Grammar load(Path path) throws XmlGrammarException {
    try (InputStream in = Files.newInputStream(path)) {
      return load(new InputSource(in), path.toString());
    } catch (IOException e) {
      throw new XmlGrammarException("Cannot read grammar " + path + ": " + e.getMessage(), e);
    }
  }

  public Grammar loadString(String xml) throws XmlGrammarException {
    return load(new InputSource(new StringReader(xml)), "<string>");
  }

  private Grammar load(InputSource source, String sourceName) throws XmlGrammarException {
    Document document = parse(source, sourceName);
    Element root = document.getDocumentElement();
    if (!"grammar".equals(root.getTagName())) {
      throw new XmlGrammarException(
          "Invalid root element <" + root.getTagName() + "> in " + sourceName
              + ", expected <grammar>");
    }
    checkAttributes(root, "/");

    Grammar.Builder builder = Grammar.builder();
    try {
      for (Element child : elements(root, "/")) {
        builder.child(definition(child, "/"));
      }
      Grammar grammar = builder.build();
      log.debug("Loaded grammar from {} with {} nodes", sourceName, grammar.nodes().size());
      return grammar;
    } catch (GrammarException e) {
      throw new XmlGrammarException("Invalid grammar in " + sourceName + ": " + e.getMessage(), e);
    }
  }

  private static Document parse(InputSource source, String sourceName)
      throws XmlGrammarException {
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setXIncludeAware(false);
      factory.setExpandEntityReferences(false);
      DocumentBuilder builder = factory.newDocumentBuilder();
      builder.setErrorHandler(new DefaultHandler());
      return builder.parse(source);
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser does not support secure processing", e);
    } catch (SAXException | IOException e) {
      throw new XmlGrammarException("Cannot parse " + sourceName + ": " + e.getMessage(), e);
    }
  }

  private NodeDefinition definition(Element element, String parentPath)
      throws XmlGrammarException {
    String tag = element.getTagName();
    String path = location(parentPath, element);
    checkAttributes(element, path);

    NodeDefinition definition;
    switch (tag) {
      case "node" -> definition = Nodes.node(required(element, "name", path), "");
      case "variable" -> {
        VariableType<?> type = VariableTypes.WORD;
        if (element.hasAttribute("type")) {
          String typeName = element.getAttribute("type");
          type =
              registry
                  .findType(typeName)
                  .orElseThrow(() -> unknown("variable type", typeName, path));
        }
        definition = Nodes.variable(required(element, "name", path), "", type);
        if (element.hasAttribute("var-name")) {
          definition.varName(element.getAttribute("var-name"));
        }
      }
      case "action" -> {
        String callback = required(element, "callback", path);
        String name = element.hasAttribute("name") ? element.getAttribute("name") : Nodes.ACTION_NAME;
        definition =
            Nodes.action(
                name,
                "",
                registry.findAction(callback).orElseThrow(() -> unknown("callback", callback, path)));
        if (!elements(element, path).isEmpty()) {
          throw new XmlGrammarException("Action " + path + " cannot have children");
        }
      }
      case "alias" -> {
        String target = required(element, "target", path);
        definition =
            element.hasAttribute("name")
                ? Nodes.alias(element.getAttribute("name"), target)
                : Nodes.alias(target);
        if (!elements(element, path).isEmpty()) {
          throw new XmlGrammarException("Alias " + path + " cannot have children");
        }
        return definition;
      }
      case "group" -> definition = Nodes.group(overrides(element, path));
      default -> throw new XmlGrammarException("Unknown element <" + tag + "> at " + path);
    }

    if (!"group".equals(tag)) {
      applyAttributes(definition, element, path);
    }
    for (Element child : elements(element, path)) {
      definition.child(definition(child, "group".equals(tag) ? parentPath : path));
    }
    return definition;
  }

  private void applyAttributes(NodeDefinition definition, Element element, String path)
      throws XmlGrammarException {
    if (element.hasAttribute("help")) {
      definition.help(element.getAttribute("help"));
    }
    if (element.hasAttribute("help-provider")) {
      String name = element.getAttribute("help-provider");
      definition.help(registry.findHelp(name).orElseThrow(() -> unknown("help provider", name, path)));
    }
    if (element.hasAttribute("pattern")) {
      definition.pattern(element.getAttribute("pattern"));
    }
    if (element.hasAttribute("separator")) {
      definition.separator(element.getAttribute("separator"));
    }
    if (element.hasAttribute("traversals")) {
      definition.traversals(integer(element, "traversals", path));
    }
    if (element.hasAttribute("match-candidates")) {
      definition.matchCandidates(bool(element, "match-candidates", path));
    }
    if (element.hasAttribute("hidden")) {
      definition.hidden(bool(element, "hidden", path));
    }
    if (element.hasAttribute("help-group")) {
      definition.helpGroup(integer(element, "help-group", path));
    }
    if (element.hasAttribute("candidates")) {
      String name = element.getAttribute("candidates");
      definition.candidates(
          registry.findCandidates(name).orElseThrow(() -> unknown("candidate provider", name, path)));
    }
  }

  private static GroupOverrides overrides(Element element, String path) throws XmlGrammarException {
    GroupOverrides overrides = GroupOverrides.NONE;
    if (element.hasAttribute("traversals")) {
      overrides = overrides.withTraversals(integer(element, "traversals", path));
    }
    if (element.hasAttribute("match-candidates")) {
      overrides = overrides.withMatchCandidates(bool(element, "match-candidates", path));
    }
    if (element.hasAttribute("hidden")) {
      overrides = overrides.withHidden(bool(element, "hidden", path));
    }
    if (element.hasAttribute("help-group")) {
      overrides = overrides.withHelpGroup(integer(element, "help-group", path));
    }
    return overrides;
  }

  private static void checkAttributes(Element element, String path) throws XmlGrammarException {
    Set<String> allowed = ATTRIBUTES.get(element.getTagName());
    if (allowed == null) {
      throw new XmlGrammarException("Unknown element <" + element.getTagName() + "> at " + path);
    }
    NamedNodeMap attributes = element.getAttributes();
    for (int i = 0; i < attributes.getLength(); i++) {
      String name = attributes.item(i).getNodeName();
      if (!allowed.contains(name)) {
        throw new XmlGrammarException(
            "Unknown attribute '" + name + "' on <" + element.getTagName() + "> at " + path);
      }
    }
  }

  /** Child elements; text other than whitespace is not part of the schema. */
  private static List<Element> elements(Element parent, String path) throws XmlGrammarException {
    List<Element> children = new ArrayList<>();
    for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
      switch (child.getNodeType()) {
        case Node.ELEMENT_NODE -> children.add((Element) child);
        case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> {
          if (!child.getNodeValue().isBlank()) {
            throw new XmlGrammarException(
                "Unexpected text '" + child.getNodeValue().strip() + "' at " + path);
          }
        }
        default -> {
          // comments and processing instructions carry no grammar
        }
      }
    }
    return children;
  }

  private static String required(Element element, String attribute, String path)
      throws XmlGrammarException {
    if (!element.hasAttribute(attribute)) {
      throw new XmlGrammarException(
          "Missing attribute '" + attribute + "' on <" + element.getTagName() + "> at " + path);
    }
    return element.getAttribute(attribute);
  }

  private static int integer(Element element, String attribute, String path)
      throws XmlGrammarException {
    String value = element.getAttribute(attribute).strip();
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new XmlGrammarException(
          "Attribute '" + attribute + "' at " + path + " must be an integer, got '" + value + "'",
          e);
    }
  }

  private static boolean bool(Element element, String attribute, String path)
      throws XmlGrammarException {
    String value = element.getAttribute(attribute).strip();
    if ("true".equalsIgnoreCase(value)) {
      return true;
    }
    if ("false".equalsIgnoreCase(value)) {
      return false;
    }
    throw new XmlGrammarException(
        "Attribute '" + attribute + "' at " + path + " must be true or false, got '" + value + "'");
  }

  private static XmlGrammarException unknown(String what, String name, String path) {
    return new XmlGrammarException("Unknown " + what + " '" + name + "' at " + path);
  }

  private static String location(String parentPath, Element element) {
    String segment =
        element.hasAttribute("name")
            ? element.getAttribute("name")
            : "<" + element.getTagName() + ">";
    return parentPath.endsWith("/") ? parentPath + segment : parentPath + "/" + segment;
  }

  private static Set<String> union(Set<String> base, String... extra) {
    Set<String> all = new HashSet<>(base);
    all.addAll(List.of(extra));
    return Set.copyOf(all);
  }
}
