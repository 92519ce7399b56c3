package ca.gc.cra.brandkit.application.asset;

import java.util.Locale;
import java.util.Objects;

/**
 * Result of {@link AssetRegistry#validate(String, String)}.
 *
 * @param brand brand name
 * @param assetPath path relative to the brand directory, as requested
 * @param status outcome
 * @param fileSize size in bytes; {@code -1} unless the file was read
 * @param checksum hex SHA-256; {@code null} unless the file was read
 * @param modifiedTime ISO-8601 modification time; {@code null} unless the file was read
 * @param extension lower-case extension including the dot
 * @param allowedType whether the extension is on the allow-list
 * @param indexChecksumMatches comparison with the asset index; {@code null} when the index has no entry
 * @param message human-readable summary
 */
public record AssetValidationReport(
    String brand,
    String assetPath,
    Status status,
    long fileSize,
    String checksum,
    String modifiedTime,
    String extension,
    boolean allowedType,
    Boolean indexChecksumMatches,
    String message) {

  public AssetValidationReport {
    Objects.requireNonNull(status, "status");
  }

  /** Validation outcome. */
  public enum Status {
    MISSING,
    VALID,
    INVALID_TYPE,
    ERROR;

    public String value() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
