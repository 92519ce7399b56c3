/**
 * Uploaded brand assets and the advisory asset index.
 * <p>Uploads are validated in a fixed order and the first failure wins; see
 * {@link ca.gc.cra.brandkit.application.asset.AssetRegistry#upload}.</p>
 */
package ca.gc.cra.brandkit.application.asset;
