package ca.gc.cra.sentinel.application.port;

import ca.gc.cra.sentinel.domain.source.SourceFile;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Upstream port supplying the files to analyse.
 * <p><strong>Role:</strong> Implemented by {@code DirectorySourceScanner}; tests use in-memory lists.</p>
 *
 * @since 0.1.0
 */
public interface SourceFileProvider {
  /**
   * Loads the files to analyse.
   *
   * @return files in a stable order; never {@code null}
   * @throws IOException if the source cannot be read
   */
  List<SourceFile> load() throws IOException;
}
