package ca.gc.cra.brandkit.util;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/** Utility helpers for working with {@link Path} instances and filenames. */
public final class PathUtils {
  private PathUtils() {}

  /**
   * Returns the file name for the supplied path when available.
   *
   * @param path source path; may be {@code null}
   * @return optional file name string
   */
  public static Optional<String> fileName(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    Path name = path.getFileName();
    return name == null ? Optional.empty() : Optional.of(name.toString());
  }

  /**
   * Returns the lower-cased extension of {@code filename} including the leading dot.
   *
   * <p>Leading-dot names such as {@code .hidden} have no extension.</p>
   *
   * @param filename bare filename
   * @return extension such as {@code ".png"}, or an empty string
   */
  public static String extension(String filename) {
    if (filename == null) {
      return "";
    }
    int dot = filename.lastIndexOf('.');
    if (dot <= 0 || dot == filename.length() - 1) {
      return "";
    }
    return filename.substring(dot).toLowerCase(Locale.ROOT);
  }

  /**
   * Returns {@code filename} without its extension.
   *
   * @param filename bare filename
   * @return stem, or the full name when there is no extension
   */
  public static String stem(String filename) {
    if (filename == null) {
      return "";
    }
    int dot = filename.lastIndexOf('.');
    if (dot <= 0 || dot == filename.length() - 1) {
      return filename;
    }
    return filename.substring(0, dot);
  }

  /**
   * Returns {@code filename}'s extension with its original case.
   *
   * @param filename bare filename
   * @return extension such as {@code ".PNG"}, or an empty string
   */
  public static String rawExtension(String filename) {
    String stem = stem(filename);
    return filename == null ? "" : filename.substring(stem.length());
  }
}
