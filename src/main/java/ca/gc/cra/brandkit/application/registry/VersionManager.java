package ca.gc.cra.brandkit.application.registry;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the next semantic version of a brand or template document.
 *
 * <p>Only the minor component is ever incremented. Major and patch are carried over unchanged. A
 * version string that is not three dot-separated integers is replaced by {@link #RECOVERY_VERSION}.</p>
 *
 * @since 0.1.0
 */
public final class VersionManager {
  private static final Logger log = LoggerFactory.getLogger(VersionManager.class);

  /** Brand sections whose change bumps the version. */
  public static final Set<String> MAJOR_IMPACT_SECTIONS = Set.of("colors", "typography", "assets", "compliance");

  /** Version assigned when the stored version cannot be parsed. */
  public static final String RECOVERY_VERSION = "1.1.0";

  private static final Pattern SEMVER = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");

  private VersionManager() {
    // Utility
  }

  /**
   * Returns the version after an update touching {@code changedSections}.
   *
   * @param current stored version; may be {@code null}
   * @param changedSections top-level keys present in the update
   * @return bumped version when a major-impact section changed, otherwise {@code current}
   */
  public static String nextVersion(String current, Collection<String> changedSections) {
    return nextVersion(current, changedSections, MAJOR_IMPACT_SECTIONS);
  }

  /**
   * Returns the version after an update, using a caller-defined set of impact sections.
   *
   * @param current stored version; may be {@code null}
   * @param changedSections top-level keys present in the update
   * @param impactSections keys that trigger a bump
   * @return bumped version when {@code changedSections} intersects {@code impactSections}, otherwise {@code current}
   */
  public static String nextVersion(String current, Collection<String> changedSections, Set<String> impactSections) {
    for (String section : changedSections) {
      if (impactSections.contains(section)) {
        return bumpMinor(current);
      }
    }
    return current;
  }

  /**
   * Increments the minor component of {@code version}.
   *
   * @param version three-component version; may be {@code null} or malformed
   * @return bumped version, or {@link #RECOVERY_VERSION} when {@code version} is malformed
   */
  public static String bumpMinor(String version) {
    if (version == null || !SEMVER.matcher(version.trim()).matches()) {
      log.warn("Malformed version '{}'; resetting to {}", version, RECOVERY_VERSION);
      return RECOVERY_VERSION;
    }
    List<String> parts = List.of(version.trim().split("\\."));
    try {
      long minor = Math.addExact(Long.parseLong(parts.get(1)), 1L);
      return Long.parseLong(parts.get(0)) + "." + minor + "." + Long.parseLong(parts.get(2));
    } catch (NumberFormatException | ArithmeticException ex) {
      log.warn("Version '{}' out of range; resetting to {}", version, RECOVERY_VERSION);
      return RECOVERY_VERSION;
    }
  }
}
