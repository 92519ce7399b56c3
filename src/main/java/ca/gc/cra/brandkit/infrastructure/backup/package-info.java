/**
 * Backups taken before brand updates, asset deletions and brand deletions. Archives use Apache Commons
 * Compress ({@code tar.gz}).
 */
package ca.gc.cra.brandkit.infrastructure.backup;
