/**
 * Asset data model: declared types with their storage directories and advisory index entries.
 *
 * @since 0.1.0
 */
package ca.gc.cra.brandkit.domain.asset;
