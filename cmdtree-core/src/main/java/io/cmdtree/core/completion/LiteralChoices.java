package io.cmdtree.core.completion;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the literal words a regular expression accepts when it is a plain alternation such as
 * {@code on|off}, {@code (?i)(yes|no)} or a quoted literal. Anything else yields an empty list.
 */
public final class LiteralChoices {
  private static final String META = "\\^$.|?*+()[]{}";

  private LiteralChoices() {}

  public static List<String> of(String regex) {
    if (regex == null || regex.isEmpty()) {
      return List.of();
    }
    String body = stripFlags(regex);
    body = stripGroup(body);
    List<String> alternatives = splitTopLevel(body);
    if (alternatives == null) {
      return List.of();
    }
    List<String> literals = new ArrayList<>(alternatives.size());
    for (String alternative : alternatives) {
      String literal = unescape(alternative);
      if (literal == null || literal.isEmpty()) {
        return List.of();
      }
      if (!literals.contains(literal)) {
        literals.add(literal);
      }
    }
    return List.copyOf(literals);
  }

  private static String stripFlags(String regex) {
    if (regex.startsWith("(?")) {
      int close = regex.indexOf(')');
      if (close > 2 && regex.substring(2, close).chars().allMatch(Character::isLetter)) {
        return regex.substring(close + 1);
      }
    }
    return regex;
  }

  /** Removes one group enclosing the whole expression, capturing or not. */
  private static String stripGroup(String regex) {
    if (!regex.startsWith("(") || !regex.endsWith(")") || closingParen(regex, 0) != regex.length() - 1) {
      return regex;
    }
    String inner = regex.substring(1, regex.length() - 1);
    return inner.startsWith("?:") ? inner.substring(2) : inner;
  }

  private static int closingParen(String regex, int open) {
    int depth = 0;
    for (int i = open; i < regex.length(); i++) {
      char c = regex.charAt(i);
      if (c == '\\') {
        i++;
      } else if (c == '(') {
        depth++;
      } else if (c == ')' && --depth == 0) {
        return i;
      }
    }
    return -1;
  }

  /** Splits at '|' outside groups and quotes; {@code null} if the expression nests groups. */
  private static List<String> splitTopLevel(String body) {
    List<String> parts = new ArrayList<>();
    int start = 0;
    int i = 0;
    while (i < body.length()) {
      char c = body.charAt(i);
      if (c == '\\' && body.startsWith("\\Q", i)) {
        int end = body.indexOf("\\E", i + 2);
        i = end < 0 ? body.length() : end + 2;
        continue;
      }
      if (c == '\\') {
        i += 2;
        continue;
      }
      if (c == '(' || c == '[') {
        return null;
      }
      if (c == '|') {
        parts.add(body.substring(start, i));
        start = i + 1;
      }
      i++;
    }
    parts.add(body.substring(start));
    return parts;
  }

  /** Turns an alternative into the text it matches, or {@code null} if it is not a literal. */
  private static String unescape(String alternative) {
    StringBuilder out = new StringBuilder();
    int i = 0;
    while (i < alternative.length()) {
      char c = alternative.charAt(i);
      if (c == '\\') {
        if (i + 1 >= alternative.length()) {
          return null;
        }
        char next = alternative.charAt(i + 1);
        if (next == 'Q') {
          int end = alternative.indexOf("\\E", i + 2);
          out.append(alternative, i + 2, end < 0 ? alternative.length() : end);
          i = end < 0 ? alternative.length() : end + 2;
          continue;
        }
        if (Character.isLetterOrDigit(next)) {
          return null;
        }
        out.append(next);
        i += 2;
        continue;
      }
      if (META.indexOf(c) >= 0 || Character.isWhitespace(c)) {
        return null;
      }
      out.append(c);
      i++;
    }
    return out.toString();
  }
}
