package ca.gc.cra.brandkit.domain.asset;

import ca.gc.cra.brandkit.domain.brand.BrandDocuments;
import java.util.Map;
import java.util.Objects;

/**
 * Entry of a brand's advisory asset index, keyed by filename.
 *
 * @param filename stored filename
 * @param assetType declared type name
 * @param fileSize decoded size in bytes
 * @param checksum lower-case hex SHA-256 of the stored bytes
 * @param uploadedAt ISO-8601 upload time
 * @param metadata caller-supplied metadata
 * @since 0.1.0
 */
public record AssetRecord(
    String filename,
    String assetType,
    long fileSize,
    String checksum,
    String uploadedAt,
    Map<String, Object> metadata) {

  public AssetRecord {
    filename = Objects.requireNonNull(filename, "filename");
    assetType = Objects.requireNonNull(assetType, "assetType");
    checksum = Objects.requireNonNull(checksum, "checksum");
    metadata = BrandDocuments.readOnly(metadata);
  }
}
