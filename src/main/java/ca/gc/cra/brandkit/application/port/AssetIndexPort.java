package ca.gc.cra.brandkit.application.port;

import ca.gc.cra.brandkit.domain.asset.AssetRecord;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * <strong>What:</strong> Port for a brand's advisory asset index file.
 * <p><strong>Why:</strong> The index duplicates filesystem state for fast metadata lookups; it is never authoritative,
 * so callers treat failures as best-effort.</p>
 *
 * @since 0.1.0
 */
public interface AssetIndexPort {
  /**
   * Reads the index.
   *
   * @param indexFile index file
   * @return records keyed by filename in file order; empty when the file is absent
   * @throws IOException if the file exists but cannot be read or parsed
   */
  Map<String, AssetRecord> read(Path indexFile) throws IOException;

  /**
   * Replaces the index contents.
   *
   * @param indexFile index file
   * @param records records keyed by filename
   * @throws IOException if the write fails
   */
  void write(Path indexFile, Map<String, AssetRecord> records) throws IOException;
}
