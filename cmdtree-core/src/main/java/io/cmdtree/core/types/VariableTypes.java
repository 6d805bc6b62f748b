package io.cmdtree.core.types;

import io.cmdtree.core.completion.CandidateProvider;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Built-in variable types. */
public final class VariableTypes {
  private static final Set<String> TRUE =
      Set.of("true", "yes", "aye", "enable", "enabled", "on", "1");
  private static final Set<String> FALSE =
      Set.of("false", "no", "disable", "disabled", "off", "0");

  private static final String IP_OCTET = "(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)";
  private static final String IP_PATTERN =
      IP_OCTET + "\\." + IP_OCTET + "\\." + IP_OCTET + "\\." + IP_OCTET;
  private static final String HOSTNAME_PATTERN =
      "(?i)[A-Z0-9][A-Z0-9_-]*(?:\\.[A-Z0-9][A-Z0-9_-]*)*";
  private static final Pattern IP_ONLY = Pattern.compile(IP_PATTERN);

  /** One or more word characters; the default for variables. */
  public static final VariableType<String> WORD = of("\\w+", token -> token);

  /** A word that starts with a letter or underscore. */
  public static final VariableType<String> IDENTIFIER = of("(?i)[A-Z_]\\w*", token -> token);

  /** A bare word, or a single or double quoted string with backslash escapes. Yields the unquoted text. */
  public static final VariableType<String> STRING = new StringType();

  /** A signed decimal integer that fits in a {@code long}. */
  public static final VariableType<Long> INTEGER =
      of(
          "-?\\d+",
          token -> {
            try {
              return Long.parseLong(token);
            } catch (NumberFormatException e) {
              throw new VariableParseException(token, "Integer out of range: " + token, e);
            }
          });

  public static final VariableType<Double> FLOAT =
      of(
          "[-+]?[0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?",
          token -> {
            try {
              return Double.parseDouble(token);
            } catch (NumberFormatException e) {
              throw new VariableParseException(token, "Not a number: " + token, e);
            }
          });

  public static final VariableType<Boolean> BOOLEAN =
      of(
          "(?i)(" + String.join("|", sorted(TRUE)) + "|" + String.join("|", sorted(FALSE)) + ")",
          token -> {
            String value = token.toLowerCase(Locale.ROOT);
            if (TRUE.contains(value)) {
              return Boolean.TRUE;
            }
            if (FALSE.contains(value)) {
              return Boolean.FALSE;
            }
            throw new VariableParseException(token, "Not a boolean: " + token);
          });

  public static final VariableType<Inet4Address> IP = of(IP_PATTERN, VariableTypes::toInet4);

  /** A dotted host name, yielding its labels. */
  public static final VariableType<List<String>> HOSTNAME =
      of(HOSTNAME_PATTERN, token -> List.of(token.split("\\.")));

  /** An IPv4 address ({@link Inet4Address}) or a host name (list of labels). */
  public static final VariableType<Object> HOST =
      of(
          "(?:" + IP_PATTERN + ")|(?:" + HOSTNAME_PATTERN + ")",
          token -> {
            if (IP_ONLY.matcher(token).matches()) {
              return toInet4(token);
            }
            return List.of(token.split("\\."));
          });

  public static final VariableType<String> EMAIL =
      of("(?i)[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}", token -> token);

  public static final VariableType<java.net.URI> URI =
      of(
          "(?:[a-zA-Z][0-9a-zA-Z+.-]*:)?/{0,2}[0-9a-zA-Z;/?:@&=+$._!~*'()%-]+"
              + "(?:#[0-9a-zA-Z;/?:@&=+$._!~*'()%-]+)?",
          token -> {
            try {
              return new java.net.URI(token);
            } catch (URISyntaxException e) {
              throw new VariableParseException(token, "Invalid URI: " + e.getMessage(), e);
            }
          });

  /** An LDAP distinguished name such as {@code cn=admin,dc=example}, yielding its components. */
  public static final VariableType<List<String>> LDAP_DN =
      of("\\w+=[\\w.-]+(?:,\\w+=[\\w.-]+)*", token -> List.of(token.split(",")));

  /** A path on the local file system, completed from directory listings. */
  public static final VariableType<java.nio.file.Path> FILE = new FileVariableType();

  private static final Map<String, VariableType<?>> BY_NAME = byNameTable();

  private VariableTypes() {}

  /** A custom type: values matching {@code pattern}, converted by {@code parser}. */
  public static <T> VariableType<T> of(String pattern, ValueParser<T> parser) {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(parser, "parser");
    Pattern.compile(pattern);
    return new VariableType<>() {
      @Override
      public String pattern() {
        return pattern;
      }

      @Override
      public T parse(MatchResult match) throws VariableParseException {
        return parser.parse(match.group());
      }

      @Override
      public String toString() {
        return "VariableType[" + pattern + "]";
      }
    };
  }

  /** One of a fixed set of words. The words are also the completion candidates. */
  public static VariableType<String> choice(String... values) {
    if (values.length == 0) {
      throw new IllegalArgumentException("A choice needs at least one value");
    }
    List<String> words = List.of(values);
    String pattern = words.stream().map(Pattern::quote).collect(Collectors.joining("|"));
    CandidateProvider provider = CandidateProvider.of(values);
    return new VariableType<>() {
      @Override
      public String pattern() {
        return pattern;
      }

      @Override
      public String parse(MatchResult match) {
        return match.group();
      }

      @Override
      public Optional<CandidateProvider> candidates() {
        return Optional.of(provider);
      }

      @Override
      public String toString() {
        return "VariableType" + words;
      }
    };
  }

  /**
   * Looks a built-in type up by its lower-case name ({@code word}, {@code string}, {@code integer},
   * {@code ldap-dn}, ...).
   */
  public static Optional<VariableType<?>> byName(String name) {
    return Optional.ofNullable(BY_NAME.get(name.toLowerCase(Locale.ROOT)));
  }

  public static Set<String> names() {
    return BY_NAME.keySet();
  }

  private static Map<String, VariableType<?>> byNameTable() {
    Map<String, VariableType<?>> table = new LinkedHashMap<>();
    table.put("word", WORD);
    table.put("identifier", IDENTIFIER);
    table.put("string", STRING);
    table.put("integer", INTEGER);
    table.put("float", FLOAT);
    table.put("boolean", BOOLEAN);
    table.put("ip", IP);
    table.put("hostname", HOSTNAME);
    table.put("host", HOST);
    table.put("email", EMAIL);
    table.put("uri", URI);
    table.put("ldap-dn", LDAP_DN);
    table.put("file", FILE);
    return Collections.unmodifiableMap(table);
  }

  private static Inet4Address toInet4(String token) throws VariableParseException {
    try {
      // a dotted-quad literal never triggers a lookup
      InetAddress address = InetAddress.getByName(token);
      if (address instanceof Inet4Address inet4) {
        return inet4;
      }
      throw new VariableParseException(token, "Not an IPv4 address: " + token);
    } catch (UnknownHostException e) {
      throw new VariableParseException(token, "Invalid IPv4 address: " + token, e);
    }
  }

  private static List<String> sorted(Set<String> words) {
    List<String> list = new ArrayList<>(words);
    // longest first so "enabled" is tried before "enable"
    list.sort((a, b) -> b.length() != a.length() ? b.length() - a.length() : a.compareTo(b));
    return list;
  }

  private static final class StringType implements VariableType<String> {
    private static final String PATTERN =
        "(\\w+)|\"([^\"\\\\]*(?:\\\\.[^\"\\\\]*)*)\"|'([^'\\\\]*(?:\\\\.[^'\\\\]*)*)'";

    @Override
    public String pattern() {
      return PATTERN;
    }

    @Override
    public boolean spansWhitespace() {
      return true;
    }

    @Override
    public String parse(MatchResult match) {
      if (match.group(1) != null) {
        return match.group(1);
      }
      String quoted = match.group(2) != null ? match.group(2) : match.group(3);
      return unescape(quoted);
    }

    private static String unescape(String text) {
      StringBuilder out = new StringBuilder(text.length());
      for (int i = 0; i < text.length(); i++) {
        char c = text.charAt(i);
        if (c == '\\' && i + 1 < text.length()) {
          char next = text.charAt(++i);
          switch (next) {
            case 'n' -> out.append('\n');
            case 't' -> out.append('\t');
            default -> out.append(next);
          }
        } else {
          out.append(c);
        }
      }
      return out.toString();
    }

    @Override
    public String toString() {
      return "VariableType[string]";
    }
  }
}
