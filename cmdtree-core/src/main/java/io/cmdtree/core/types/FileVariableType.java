package io.cmdtree.core.types;

import io.cmdtree.core.completion.CandidateProvider;
import io.cmdtree.core.parse.Context;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A path on the local file system. A leading {@code ~} expands to the user's home directory.
 *
 * <p>Accepted paths can be narrowed with include and exclude globs matched against the file name,
 * and dot files and directories are refused unless allowed. The file need not exist. Candidates
 * list the directory named by the partial word; directories are always offered, ending with
 * {@code /} so completion can continue into them, and permitted dot files are offered once the
 * partial name starts with a dot.
 *
 * <pre>{@code
 * FileVariableType scripts =
 *     FileVariableType.builder().include("*.sh").exclude("test-*").build();
 * }</pre>
 */
public final class FileVariableType implements VariableType<Path>, CandidateProvider {
  private static final Logger log = LoggerFactory.getLogger(FileVariableType.class);

  private final Path home;
  private final Path workingDirectory;
  private final List<PathMatcher> includes;
  private final List<PathMatcher> excludes;
  private final boolean allowDotfiles;
  private final boolean allowDirectories;

  public FileVariableType() {
    this(builder());
  }

  /** A file type resolving {@code ~} and relative paths against the given directories. */
  public FileVariableType(Path home, Path workingDirectory) {
    this(builder().home(home).workingDirectory(workingDirectory));
  }

  private FileVariableType(Builder builder) {
    this.home = builder.home;
    this.workingDirectory = builder.workingDirectory;
    this.includes = globs(builder.includes.isEmpty() ? List.of("*") : builder.includes);
    this.excludes = globs(builder.excludes);
    this.allowDotfiles = builder.allowDotfiles;
    this.allowDirectories = builder.allowDirectories;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String pattern() {
    return "\\S+";
  }

  /**
   * Expands the token into a path.
   *
   * @throws VariableParseException if the path is malformed or refused by this type's filters
   */
  @Override
  public Path parse(MatchResult match) throws VariableParseException {
    String token = match.group();
    Path path;
    try {
      path = expand(token);
    } catch (InvalidPathException e) {
      throw new VariableParseException(token, "Invalid path: " + e.getReason(), e);
    }
    if (Files.isDirectory(path)) {
      if (!allowDirectories) {
        throw new VariableParseException(token, "Is a directory: " + token);
      }
      return path;
    }
    String refusal = refusal(path);
    if (refusal != null) {
      throw new VariableParseException(token, refusal + ": " + token);
    }
    return path;
  }

  /** Why a non-directory path is not accepted, or {@code null} if it is. */
  private String refusal(Path path) {
    Path name = path.getFileName();
    if (name == null) {
      return "Not a file";
    }
    if (!allowDotfiles && name.toString().startsWith(".")) {
      return "Hidden files are not allowed";
    }
    for (PathMatcher exclude : excludes) {
      if (exclude.matches(name)) {
        return "Excluded file";
      }
    }
    for (PathMatcher include : includes) {
      if (include.matches(name)) {
        return null;
      }
    }
    return "Not an accepted file";
  }

  @Override
  public Optional<CandidateProvider> candidates() {
    return Optional.of(this);
  }

  @Override
  public List<String> candidates(Context context, String partial) {
    String text = partial == null ? "" : partial;
    int slash = text.lastIndexOf('/');
    String dirPart = slash < 0 ? "" : text.substring(0, slash + 1);
    String namePart = text.substring(slash + 1);

    Path directory;
    try {
      directory = dirPart.isEmpty() ? resolve(Paths.get("")) : expand(dirPart);
    } catch (InvalidPathException e) {
      return List.of();
    }
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    List<String> candidates = new ArrayList<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
      for (Path entry : entries) {
        String name = entry.getFileName().toString();
        if (!name.startsWith(namePart)) {
          continue;
        }
        if (name.startsWith(".") && !(allowDotfiles && namePart.startsWith("."))) {
          continue;
        }
        if (Files.isDirectory(entry)) {
          candidates.add(dirPart + name + "/");
        } else if (refusal(entry) == null) {
          candidates.add(dirPart + name);
        }
      }
    } catch (IOException e) {
      log.debug("Cannot list {} for completion: {}", directory, e.getMessage());
      return List.of();
    }
    candidates.sort(null);
    return candidates;
  }

  private Path expand(String text) {
    if (text.equals("~")) {
      return home;
    }
    if (text.startsWith("~/")) {
      return home.resolve(text.substring(2));
    }
    return resolve(Paths.get(text));
  }

  private Path resolve(Path path) {
    return path.isAbsolute() ? path : workingDirectory.resolve(path);
  }

  private static List<PathMatcher> globs(List<String> globs) {
    FileSystem fs = FileSystems.getDefault();
    List<PathMatcher> matchers = new ArrayList<>(globs.size());
    for (String glob : globs) {
      matchers.add(fs.getPathMatcher("glob:" + glob));
    }
    return List.copyOf(matchers);
  }

  @Override
  public String toString() {
    return "VariableType[file]";
  }

  /** Options for a {@link FileVariableType}. By default any file name is accepted. */
  public static final class Builder {
    private Path home = Paths.get(System.getProperty("user.home", "."));
    private Path workingDirectory = Paths.get("");
    private final List<String> includes = new ArrayList<>();
    private final List<String> excludes = new ArrayList<>();
    private boolean allowDotfiles;
    private boolean allowDirectories;

    private Builder() {}

    public Builder home(Path home) {
      this.home = Objects.requireNonNull(home, "home");
      return this;
    }

    public Builder workingDirectory(Path workingDirectory) {
      this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
      return this;
    }

    /** Accepts file names matching {@code glob}. Without any include every name is accepted. */
    public Builder include(String glob) {
      includes.add(Objects.requireNonNull(glob, "glob"));
      return this;
    }

    /** Refuses file names matching {@code glob}, even when an include matches. */
    public Builder exclude(String glob) {
      excludes.add(Objects.requireNonNull(glob, "glob"));
      return this;
    }

    public Builder allowDotfiles(boolean allow) {
      this.allowDotfiles = allow;
      return this;
    }

    public Builder allowDirectories(boolean allow) {
      this.allowDirectories = allow;
      return this;
    }

    /**
     * Builds the type.
     *
     * @throws IllegalArgumentException if a glob is malformed
     */
    public FileVariableType build() {
      return new FileVariableType(this);
    }
  }
}
