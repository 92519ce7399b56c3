/**
 * Operator CLI for the brand, asset and template registries.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging, resolves
 * settings, and invokes the registry services wired by {@code CompositionRoot}.</p>
 * <p><strong>Concurrency:</strong> Each invocation runs one action on the calling thread.</p>
 * <p><strong>Security:</strong> Rejects control characters in arguments; entity names and asset paths are
 * validated again by the registries.</p>
 */
package ca.gc.cra.brandkit.api;
