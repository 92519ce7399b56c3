package ca.gc.cra.brandkit.application.asset;

import java.util.List;

/**
 * Result of {@link AssetRegistry#list(String, String)}.
 *
 * @param brand brand name
 * @param assets assets sorted by filename
 * @param totalSize summed size of {@code assets}
 * @param typeFilter filter applied; {@code null} when none
 */
public record AssetListing(String brand, List<AssetSummary> assets, long totalSize, String typeFilter) {
  public AssetListing {
    assets = List.copyOf(assets);
  }

  public int totalCount() {
    return assets.size();
  }
}
