/**
 * File adapters for brand and template documents (YAML) and the per-brand asset index (JSON).
 * <p><strong>Concurrency:</strong> Adapters are stateless; writes are atomic per file but callers must serialize
 * read-modify-write cycles per brand.</p>
 */
package ca.gc.cra.brandkit.infrastructure.persistence;
