package ca.gc.cra.sentinel.infrastructure.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.domain.source.SourceFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectorySourceScannerTest {
  @TempDir
  Path root;

  @Test
  void loadsTextFilesSortedByRelativePath() throws Exception {
    write("src/b.js", "b();");
    write("src/a.js", "a();");
    write("README.md", "# readme");

    List<SourceFile> files = new DirectorySourceScanner(root).load();

    assertEquals(List.of("README.md", "src/a.js", "src/b.js"), files.stream().map(SourceFile::path).toList());
    assertEquals("a();", files.get(1).content());
  }

  @Test
  void skipsIgnoredAndHiddenDirectories() throws Exception {
    write("node_modules/lib/index.js", "x");
    write(".git/config", "[core]");
    write(".cache/tmp.js", "x");
    write("target/classes/App.java", "class App {}");
    write("app/main.js", "main();");
    write("app/.DS_Store", "meta");

    List<SourceFile> files = new DirectorySourceScanner(root).load();

    assertEquals(List.of("app/main.js"), files.stream().map(SourceFile::path).toList());
  }

  @Test
  void skipsBinaryAndOversizedFiles() throws Exception {
    Files.write(root.resolve("image.png"), new byte[] {(byte) 0x89, 'P', 'N', 'G', 0, 1, 2});
    write("big.js", "x".repeat(2_000));
    write("small.js", "ok();");

    List<SourceFile> files = new DirectorySourceScanner(root, 1_000).load();

    assertEquals(List.of("small.js"), files.stream().map(SourceFile::path).toList());
  }

  @Test
  void unreadableFileIsSkippedAndTheRestStillLoads() throws Exception {
    write("locked.js", "secret();");
    write("open.js", "open();");
    DirectorySourceScanner scanner = new DirectorySourceScanner(root, 1_000, file -> {
      if (file.getFileName().toString().equals("locked.js")) {
        throw new AccessDeniedException(file.toString());
      }
      return Files.readAllBytes(file);
    });

    List<SourceFile> files = scanner.load();

    assertEquals(List.of("open.js"), files.stream().map(SourceFile::path).toList());
    assertEquals("open();", files.get(0).content());
  }

  @Test
  void ignoredDirectoryRules() {
    assertTrue(DirectorySourceScanner.isIgnoredDirectory("node_modules"));
    assertTrue(DirectorySourceScanner.isIgnoredDirectory(".idea"));
    assertTrue(DirectorySourceScanner.isIgnoredDirectory(".hidden"));
    assertFalse(DirectorySourceScanner.isIgnoredDirectory("src"));
    assertFalse(DirectorySourceScanner.isIgnoredDirectory("."));
  }

  @Test
  void binaryDetectionLooksForNulBytes() {
    assertTrue(DirectorySourceScanner.looksBinary(new byte[] {'a', 0, 'b'}));
    assertFalse(DirectorySourceScanner.looksBinary("plain text".getBytes(StandardCharsets.UTF_8)));
    assertFalse(DirectorySourceScanner.looksBinary(new byte[0]));
  }

  @Test
  void rejectsMissingRootAndNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> new DirectorySourceScanner(root.resolve("missing")));
    assertThrows(IllegalArgumentException.class, () -> new DirectorySourceScanner(root, 0));
  }

  private void write(String relative, String content) throws Exception {
    Path file = root.resolve(relative);
    Files.createDirectories(file.getParent());
    Files.writeString(file, content);
  }
}
