package ca.gc.cra.brandkit.util;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/** Recursive copy, delete and measurement helpers for brand and template directory trees. */
public final class DirectoryTrees {
  private DirectoryTrees() {
    // Utility
  }

  /**
   * File and byte totals for a directory tree.
   *
   * @param files regular files visited
   * @param directories directories visited, including the root
   * @param bytes summed size of the regular files
   */
  public record TreeStats(long files, long directories, long bytes) {
    /** Stats for an absent tree. */
    public static final TreeStats EMPTY = new TreeStats(0, 0, 0);
  }

  /**
   * Copies {@code source} into {@code target}, creating {@code target} and any missing subdirectories.
   * Symbolic links are skipped.
   *
   * @param source existing directory
   * @param target destination directory
   * @return copied regular files under {@code target}, in visit order
   * @throws IOException if reading or writing fails
   */
  public static List<Path> copyTree(Path source, Path target) throws IOException {
    List<Path> copied = new ArrayList<>();
    Files.walkFileTree(source, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
        Files.createDirectories(target.resolve(source.relativize(dir).toString()));
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
        if (attrs.isRegularFile()) {
          Path destination = target.resolve(source.relativize(file).toString());
          Files.copy(file, destination, StandardCopyOption.COPY_ATTRIBUTES, StandardCopyOption.REPLACE_EXISTING);
          copied.add(destination);
        }
        return FileVisitResult.CONTINUE;
      }
    });
    return copied;
  }

  /**
   * Sums regular files and directories below {@code root}.
   *
   * @param root directory to walk; an absent directory yields {@link TreeStats#EMPTY}
   * @return totals
   * @throws IOException if the walk fails
   */
  public static TreeStats measure(Path root) throws IOException {
    if (!Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS)) {
      return TreeStats.EMPTY;
    }
    long[] totals = new long[3];
    Files.walkFileTree(root, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
        totals[1]++;
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
        if (attrs.isRegularFile()) {
          totals[0]++;
          totals[2] += attrs.size();
        }
        return FileVisitResult.CONTINUE;
      }
    });
    return new TreeStats(totals[0], totals[1], totals[2]);
  }

  /**
   * Deletes {@code root} and everything below it.
   *
   * @param root directory to delete; absent directories are ignored
   * @return what was removed
   * @throws IOException if any entry cannot be deleted
   */
  public static TreeStats deleteTree(Path root) throws IOException {
    if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
      return TreeStats.EMPTY;
    }
    long[] totals = new long[3];
    Files.walkFileTree(root, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
        if (attrs.isRegularFile()) {
          totals[0]++;
          totals[2] += attrs.size();
        }
        Files.delete(file);
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult postVisitDirectory(Path dir, IOException failure) throws IOException {
        if (failure != null) {
          throw failure;
        }
        Files.delete(dir);
        totals[1]++;
        return FileVisitResult.CONTINUE;
      }
    });
    return new TreeStats(totals[0], totals[1], totals[2]);
  }

  /**
   * Lists regular files below {@code root}, sorted by path.
   *
   * @param root directory to walk; an absent directory yields an empty list
   * @return regular files
   * @throws IOException if the walk fails
   */
  public static List<Path> regularFiles(Path root) throws IOException {
    if (!Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS)) {
      return List.of();
    }
    try (Stream<Path> walk = Files.walk(root)) {
      return walk.filter(p -> Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS)).sorted().toList();
    }
  }

  /**
   * Removes empty directories below {@code root}, deepest first. {@code root} itself is kept.
   *
   * @param root directory to prune
   * @return number of directories removed
   * @throws IOException if the walk or a deletion fails
   */
  public static int removeEmptyDirectories(Path root) throws IOException {
    if (!Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS)) {
      return 0;
    }
    List<Path> directories;
    try (Stream<Path> walk = Files.walk(root)) {
      directories = walk
          .filter(p -> !p.equals(root) && Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS))
          .sorted(Comparator.comparingInt(Path::getNameCount).reversed())
          .toList();
    }
    int removed = 0;
    for (Path dir : directories) {
      boolean empty;
      try (Stream<Path> entries = Files.list(dir)) {
        empty = entries.findAny().isEmpty();
      }
      if (empty) {
        Files.delete(dir);
        removed++;
      }
    }
    return removed;
  }
}
