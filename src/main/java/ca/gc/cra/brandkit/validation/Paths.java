package ca.gc.cra.brandkit.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for Brandkit roots and entity-relative paths.
 * <p><strong>Why:</strong> Brand, template, and asset operations may only touch files under their own
 * registry root; operator-supplied relative paths must never escape it.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize user-provided root directories to real, canonical, writable directories.</li>
 *   <li>Resolve relative asset paths inside a base directory and reject traversal.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} to avoid accidental symlink traversal.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a writable directory, optionally creating it and requiring it to be empty.
   *
   * @param path candidate directory; must not be {@code null}
   * @param allowedBase optional base directory; when non-null, {@code path} must reside within it
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @param allowReuse when {@code false}, existing non-empty directories are rejected
   * @return canonical directory path when available, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the path escapes {@code allowedBase}, is non-writable, or creation fails
   */
  public static Path validateWritableDir(Path path, Path allowedBase, boolean createIfMissing, boolean allowReuse) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    if (containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }

    Path normalized = path.toAbsolutePath().normalize();
    Path base = allowedBase == null ? null : allowedBase.toAbsolutePath().normalize();
    ensureWithinBase(normalized, base);

    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
        ensureWithinBase(real, base);
        ensureDirectory(real, allowReuse);
        return real;
      }
      if (!createIfMissing) {
        return normalized;
      }
      Files.createDirectories(normalized);
      Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
      ensureWithinBase(real, base);
      ensureDirectory(real, allowReuse);
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Resolves {@code relative} against {@code base} and ensures the result stays inside {@code base}.
   *
   * @param base directory that must contain the result; must not be {@code null}
   * @param relative relative path supplied by a caller; absolute paths are rejected
   * @return absolute, normalized path inside {@code base}
   * @throws IllegalArgumentException if {@code relative} is blank, absolute, or escapes {@code base}
   */
  public static Path resolveWithin(Path base, String relative) {
    if (base == null) {
      throw new IllegalArgumentException("base must not be null");
    }
    if (relative == null || relative.isBlank()) {
      throw new IllegalArgumentException("relative path must not be blank");
    }
    if (relative.indexOf('\0') >= 0 || containsControl(relative)) {
      throw new IllegalArgumentException("relative path must not contain control characters");
    }
    Path candidate = Path.of(relative);
    if (candidate.isAbsolute()) {
      throw new IllegalArgumentException("path must be relative: " + relative);
    }
    Path normalizedBase = base.toAbsolutePath().normalize();
    Path resolved = normalizedBase.resolve(candidate).normalize();
    if (!resolved.startsWith(normalizedBase) || resolved.equals(normalizedBase)) {
      throw new IllegalArgumentException("path " + relative + " escapes " + normalizedBase);
    }
    return resolved;
  }

  private static void ensureDirectory(Path dir, boolean allowReuse) throws IOException {
    if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("path is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
    if (!allowReuse) {
      try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
        if (entries.iterator().hasNext()) {
          throw new IllegalArgumentException("directory " + dir + " is not empty");
        }
      }
    }
  }

  private static void ensureWithinBase(Path candidate, Path base) {
    if (base == null) {
      return;
    }
    if (!candidate.startsWith(base)) {
      throw new IllegalArgumentException("path " + candidate + " escapes allowed base " + base);
    }
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
