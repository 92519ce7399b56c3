/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing, configuration bootstrap, and
 * registry operations.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 * <p><strong>Security:</strong> Keeps entity names and asset paths inside their registry roots.
 *
 * @since 0.1.0
 */
package ca.gc.cra.brandkit.validation;
