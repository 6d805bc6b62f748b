package io.cmdtree.core.types;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileVariableTypeTest {

  @TempDir Path dir;

  private FileVariableType type;

  @BeforeEach
  void setUp() throws Exception {
    Files.createDirectories(dir.resolve("src/main"));
    Files.writeString(dir.resolve("setup.py"), "");
    Files.writeString(dir.resolve("test_setup.py"), "");
    Files.writeString(dir.resolve("README"), "");
    Files.writeString(dir.resolve(".hidden"), "");
    type = new FileVariableType(dir.resolve("src"), dir);
  }

  private FileVariableType.Builder options() {
    return FileVariableType.builder().home(dir.resolve("src")).workingDirectory(dir);
  }

  private static Path parse(FileVariableType type, String token) throws VariableParseException {
    Matcher matcher = Pattern.compile(type.pattern()).matcher(token);
    assertThat(matcher.matches()).isTrue();
    return type.parse(matcher);
  }

  @Test
  void listsTheWorkingDirectory() {
    assertThat(type.candidates(null, "s")).containsExactly("setup.py", "src/");
    assertThat(type.candidates(null, ""))
        .containsExactly("README", "setup.py", "src/", "test_setup.py");
  }

  @Test
  void dotFilesAreRefusedUnlessAllowed() throws Exception {
    assertThat(type.candidates(null, ".")).isEmpty();
    assertThatThrownBy(() -> parse(type, ".hidden"))
        .isInstanceOf(VariableParseException.class)
        .hasMessageContaining("Hidden");

    FileVariableType dotfiles = options().allowDotfiles(true).build();
    assertThat(dotfiles.candidates(null, ".")).containsExactly(".hidden");
    assertThat(dotfiles.candidates(null, "")).doesNotContain(".hidden");
    assertThat(parse(dotfiles, ".hidden")).isEqualTo(dir.resolve(".hidden"));
  }

  @Test
  void directoriesAreRefusedUnlessAllowed() throws Exception {
    assertThatThrownBy(() -> parse(type, "src"))
        .isInstanceOf(VariableParseException.class)
        .hasMessageContaining("directory");

    FileVariableType directories = options().allowDirectories(true).build();
    assertThat(parse(directories, "src")).isEqualTo(dir.resolve("src"));
  }

  @Test
  void includesAndExcludesFilterFileNames() throws Exception {
    FileVariableType python = options().include("*.py").exclude("test_*").build();

    assertThat(parse(python, "setup.py")).isEqualTo(dir.resolve("setup.py"));
    assertThat(parse(python, "new.py")).isEqualTo(dir.resolve("new.py"));
    assertThatThrownBy(() -> parse(python, "README")).isInstanceOf(VariableParseException.class);
    assertThatThrownBy(() -> parse(python, "test_setup.py"))
        .isInstanceOf(VariableParseException.class);
    assertThat(python.candidates(null, "")).containsExactly("setup.py", "src/");
  }

  @Test
  void descendsIntoDirectories() {
    assertThat(type.candidates(null, "src/")).containsExactly("src/main/");
    assertThat(type.candidates(null, "src/m")).containsExactly("src/main/");
    assertThat(type.candidates(null, "missing/")).isEmpty();
  }

  @Test
  void homeIsExpanded() throws Exception {
    assertThat(type.candidates(null, "~/")).containsExactly("~/main/");

    FileVariableType directories = options().allowDirectories(true).build();
    assertThat(parse(directories, "~/main")).isEqualTo(dir.resolve("src").resolve("main"));
    assertThat(parse(type, "~/notes.txt")).isEqualTo(dir.resolve("src").resolve("notes.txt"));
  }

  @Test
  void relativePathsResolveAgainstTheWorkingDirectory() throws Exception {
    assertThat(parse(type, "setup.py")).isEqualTo(dir.resolve("setup.py"));
  }
}
