package ca.gc.cra.brandkit.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * <strong>What:</strong> Port reading and writing one structured document per file.
 * <p><strong>Why:</strong> Keeps brand and template registries independent of the document format.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse files into nested mapping / sequence / scalar trees, preserving key order.</li>
 *   <li>Write documents atomically relative to readers, creating parent directories.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations are stateless; callers serialize writes per entity.</p>
 *
 * @since 0.1.0
 */
public interface ConfigStore {
  /**
   * Loads a document.
   *
   * @param path document file
   * @return mutable document tree
   * @throws java.nio.file.NoSuchFileException if the file does not exist
   * @throws MalformedDocumentException if the file is empty or is not a mapping
   * @throws IOException if the file cannot be read
   */
  Map<String, Object> load(Path path) throws IOException;

  /**
   * Writes a document with write-temp-then-rename semantics.
   *
   * @param path target file
   * @param document document tree
   * @throws IOException if the write fails; the previous file, if any, is left intact
   */
  void save(Path path, Map<String, Object> document) throws IOException;

  /**
   * Tests whether a document file exists.
   *
   * @param path document file
   * @return {@code true} when a regular file exists at {@code path}
   */
  boolean exists(Path path);

  /**
   * Returns the file extension, without dot, used for documents and document backups.
   *
   * @return extension such as {@code yaml}
   */
  String fileExtension();
}
