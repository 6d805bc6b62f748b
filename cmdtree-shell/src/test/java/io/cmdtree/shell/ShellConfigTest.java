package io.cmdtree.shell;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ShellConfigTest {

  @Test
  void missingFileGivesDefaults(@TempDir Path dir) throws Exception {
    ShellConfig config = ShellConfig.load(dir.resolve("absent.properties"));

    assertEquals(ShellConfig.defaults(), config);
    assertEquals("?", config.helpKey());
    assertEquals(Set.of("exit", "quit"), config.exitCommands());
  }

  @Test
  void readsPropertiesFile(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("shell.properties");
    Files.writeString(
        file,
        "prompt=router# \n"
            + "historyFile=" + dir.resolve("hist").toString().replace("\\", "\\\\") + "\n"
            + "banner=\n"
            + "helpKey=??\n"
            + "exitCommands=logout, bye ,\n");

    ShellConfig config = ShellConfig.load(file);

    assertEquals("router# ", config.prompt());
    assertEquals(dir.resolve("hist"), config.historyFile());
    assertEquals("", config.banner());
    assertEquals("??", config.helpKey());
    assertEquals(Set.of("logout", "bye"), config.exitCommands());
  }

  @Test
  void blankHistoryFileDisablesHistory() {
    Properties props = new Properties();
    props.setProperty("historyFile", " ");

    assertNull(ShellConfig.fromProperties(props).historyFile());
  }

  @Test
  void homeIsExpandedInHistoryPath() {
    Properties props = new Properties();
    props.setProperty("historyFile", "~/.cmdtree/h");

    assertEquals(
        Path.of(System.getProperty("user.home"), ".cmdtree/h"),
        ShellConfig.fromProperties(props).historyFile());
  }

  @Test
  void blankHelpKeyIsRejected() {
    Properties props = new Properties();
    props.setProperty("helpKey", "  ");

    assertThrows(IllegalArgumentException.class, () -> ShellConfig.fromProperties(props));
  }
}
