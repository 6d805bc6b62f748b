package io.cmdtree.core.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A parsed grammar path such as {@code /show/interface}, {@code ../status} or {@code /config/*}.
 *
 * <p>Segments are {@code .}, {@code ..}, plain names, or globs using {@code *}, {@code ?} and
 * {@code [...]} character classes ({@code [!...]} negates). A trailing slash is ignored; empty
 * segments are not allowed.
 */
public record PathExpression(String text, boolean absolute, List<Segment> segments) {

  public PathExpression {
    segments = List.copyOf(segments);
  }

  /** One step of a path. */
  public record Segment(Type type, String text, Pattern glob) {
    public enum Type {
      SELF,
      PARENT,
      NAME,
      GLOB
    }

    /** Whether a node called {@code name} satisfies a NAME or GLOB segment. */
    public boolean matches(String name) {
      if (name == null) {
        return false;
      }
      return switch (type) {
        case NAME -> text.equals(name);
        case GLOB -> glob.matcher(name).matches();
        default -> false;
      };
    }
  }

  /**
   * Parses a path expression.
   *
   * @throws IllegalArgumentException if the path is malformed
   */
  public static PathExpression parse(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("empty path");
    }
    String path = text.strip();
    boolean absolute = path.startsWith("/");
    String body = absolute ? path.substring(1) : path;
    if (body.endsWith("/")) {
      body = body.substring(0, body.length() - 1);
    }
    List<Segment> segments = new ArrayList<>();
    if (!body.isEmpty()) {
      for (String part : body.split("/", -1)) {
        if (part.isEmpty()) {
          throw new IllegalArgumentException("empty segment in '" + path + "'");
        }
        if (part.chars().anyMatch(Character::isWhitespace)) {
          throw new IllegalArgumentException("whitespace in segment '" + part + "'");
        }
        if (part.equals(".")) {
          segments.add(new Segment(Segment.Type.SELF, part, null));
        } else if (part.equals("..")) {
          segments.add(new Segment(Segment.Type.PARENT, part, null));
        } else if (isGlob(part)) {
          segments.add(new Segment(Segment.Type.GLOB, part, compileGlob(part)));
        } else {
          segments.add(new Segment(Segment.Type.NAME, part, null));
        }
      }
    }
    return new PathExpression(path, absolute, segments);
  }

  /** Whether any segment is a glob, so the path may name several nodes. */
  public boolean hasGlob() {
    return segments.stream().anyMatch(s -> s.type() == Segment.Type.GLOB);
  }

  private static boolean isGlob(String segment) {
    return segment.indexOf('*') >= 0 || segment.indexOf('?') >= 0 || segment.indexOf('[') >= 0
        || segment.indexOf(']') >= 0;
  }

  private static Pattern compileGlob(String glob) {
    StringBuilder regex = new StringBuilder();
    int i = 0;
    while (i < glob.length()) {
      char c = glob.charAt(i);
      switch (c) {
        case '*' -> regex.append(".*");
        case '?' -> regex.append('.');
        case '[' -> {
          int close = glob.indexOf(']', i + 2);
          if (close < 0) {
            throw new IllegalArgumentException("unclosed '[' in '" + glob + "'");
          }
          String members = glob.substring(i + 1, close);
          regex.append('[');
          if (members.startsWith("!")) {
            regex.append('^');
            members = members.substring(1);
          }
          for (char m : members.toCharArray()) {
            if (m == '-') {
              regex.append('-');
            } else if (Character.isLetterOrDigit(m)) {
              regex.append(m);
            } else {
              regex.append('\\').append(m);
            }
          }
          regex.append(']');
          i = close;
        }
        case ']' -> throw new IllegalArgumentException("unmatched ']' in '" + glob + "'");
        default -> regex.append(Pattern.quote(String.valueOf(c)));
      }
      i++;
    }
    return Pattern.compile(regex.toString());
  }

  @Override
  public String toString() {
    return text;
  }
}
