package ca.gc.cra.sentinel.infrastructure.source;

import ca.gc.cra.sentinel.application.port.SourceFileProvider;
import ca.gc.cra.sentinel.domain.source.SourceFile;
import ca.gc.cra.sentinel.validation.Paths;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SourceFileProvider} that walks a directory tree and loads text files.
 * <p><strong>Filtering:</strong> skips VCS, dependency and build output directories, hidden
 * directories, files above {@code maxFileBytes} and files whose first block contains a NUL byte.</p>
 * <p><strong>Ordering:</strong> paths are relative to the root, use {@code /} separators and are sorted,
 * so batches are reproducible.</p>
 *
 * @since 0.1.0
 */
public final class DirectorySourceScanner implements SourceFileProvider {
  private static final Logger log = LoggerFactory.getLogger(DirectorySourceScanner.class);
  /** Largest file loaded by default. */
  public static final long DEFAULT_MAX_FILE_BYTES = 1L << 20;
  private static final int BINARY_PROBE_BYTES = 8_192;

  static final Set<String> IGNORE_DIRS = Set.of(
      ".git", ".hg", ".svn", "node_modules", "target", "build", "dist", "out", "coverage",
      ".idea", ".vscode", ".gradle", ".mvn", "__pycache__", ".next", "vendor");

  private static final Set<String> IGNORE_FILES = Set.of(".DS_Store", "Thumbs.db");

  /** Reads one candidate file. */
  @FunctionalInterface
  interface ContentReader {
    byte[] read(Path file) throws IOException;
  }

  private final Path root;
  private final long maxFileBytes;
  private final ContentReader reader;

  /**
   * Creates a scanner.
   *
   * @param root directory to scan; must exist and be readable
   * @param maxFileBytes files larger than this are skipped; must be positive
   * @throws IllegalArgumentException if {@code root} is not a readable directory
   */
  public DirectorySourceScanner(Path root, long maxFileBytes) {
    this(root, maxFileBytes, Files::readAllBytes);
  }

  DirectorySourceScanner(Path root, long maxFileBytes, ContentReader reader) {
    this.root = Paths.validateReadableDir(root);
    if (maxFileBytes <= 0) {
      throw new IllegalArgumentException("maxFileBytes must be positive");
    }
    this.maxFileBytes = maxFileBytes;
    this.reader = reader;
  }

  public DirectorySourceScanner(Path root) {
    this(root, DEFAULT_MAX_FILE_BYTES);
  }

  public Path root() {
    return root;
  }

  @Override
  public List<SourceFile> load() throws IOException {
    List<Path> candidates = new ArrayList<>();
    Files.walkFileTree(root, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
        if (!dir.equals(root) && isIgnoredDirectory(dir.getFileName().toString())) {
          log.trace("Skipping directory {}", dir);
          return FileVisitResult.SKIP_SUBTREE;
        }
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
        if (attrs.isRegularFile() && !IGNORE_FILES.contains(file.getFileName().toString())) {
          if (attrs.size() > maxFileBytes) {
            log.debug("Skipping {} ({} bytes exceeds {})", file, attrs.size(), maxFileBytes);
          } else {
            candidates.add(file);
          }
        }
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFileFailed(Path file, IOException exc) {
        log.warn("Cannot read {}: {}", file, exc.toString());
        return FileVisitResult.CONTINUE;
      }
    });

    candidates.sort(Comparator.comparing(this::relativeName));
    List<SourceFile> files = new ArrayList<>(candidates.size());
    int binary = 0;
    int unreadable = 0;
    for (Path candidate : candidates) {
      byte[] bytes;
      try {
        bytes = reader.read(candidate);
      } catch (IOException ex) {
        log.warn("Cannot read {}: {}", candidate, ex.toString());
        unreadable++;
        continue;
      }
      if (looksBinary(bytes)) {
        binary++;
        continue;
      }
      files.add(new SourceFile(relativeName(candidate), new String(bytes, StandardCharsets.UTF_8)));
    }
    log.info("Loaded {} source files from {} ({} binary, {} unreadable skipped)",
        files.size(), root, binary, unreadable);
    return files;
  }

  static boolean isIgnoredDirectory(String name) {
    return IGNORE_DIRS.contains(name) || (name.startsWith(".") && name.length() > 1);
  }

  static boolean looksBinary(byte[] bytes) {
    int limit = Math.min(bytes.length, BINARY_PROBE_BYTES);
    for (int i = 0; i < limit; i++) {
      if (bytes[i] == 0) {
        return true;
      }
    }
    return false;
  }

  private String relativeName(Path file) {
    return root.relativize(file).toString().replace('\\', '/');
  }
}
