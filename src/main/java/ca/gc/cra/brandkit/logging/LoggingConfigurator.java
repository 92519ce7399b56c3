package ca.gc.cra.brandkit.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts Brandkit logging verbosity for operator CLI runs.
 * <p><strong>Why:</strong> {@code --verbose} should surface per-asset resolution detail without editing
 * {@code logback.xml}.
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Only Logback supports dynamic level changes here; other SLF4J bindings log a warning.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /** Raises the root logger to DEBUG. */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  /**
   * Returns the current root level name, or {@code null} when the backend is not Logback.
   *
   * @return level name such as {@code "INFO"}
   */
  public static String rootLevel() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Level level = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel();
      return level == null ? null : level.toString();
    }
    return null;
  }

  /**
   * Restores the root logger to a named level; used after verbose CLI runs in the same JVM.
   *
   * @param levelName Logback level name; unknown names fall back to INFO
   */
  public static void restoreRootLevel(String levelName) {
    setRootLevel(Level.toLevel(levelName, Level.INFO));
  }

  private static void setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return;
    }
    log.warn("Log level change to {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
  }
}
