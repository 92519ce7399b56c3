package ca.gc.cra.brandkit.infrastructure.persistence;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write-temp-then-rename helper shared by the file adapters.
 *
 * <p>The temp file lives next to the target so the final move stays on one filesystem. Readers observe either
 * the previous content or the new content, never a partial write.</p>
 */
public final class AtomicFiles {
  private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);

  private AtomicFiles() {
    // Utility
  }

  /**
   * Atomically replaces {@code target} with {@code content}, creating parent directories.
   *
   * @param target destination file
   * @param content bytes to write
   * @throws IOException if any step fails; the temp file is removed and {@code target} is untouched
   */
  public static void write(Path target, byte[] content) throws IOException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(content, "content");
    Path absolute = target.toAbsolutePath();
    Path parent = absolute.getParent();
    Files.createDirectories(parent);
    Path temp = Files.createTempFile(parent, "." + absolute.getFileName(), ".tmp");
    try {
      try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
          OutputStream out = Channels.newOutputStream(channel)) {
        out.write(content);
        out.flush();
        channel.force(true);
      }
      move(temp, absolute);
    } catch (IOException | RuntimeException ex) {
      deleteQuietly(temp, ex);
      throw ex;
    }
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; falling back to replace", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path temp, Exception primary) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException cleanup) {
      primary.addSuppressed(cleanup);
    }
  }
}
