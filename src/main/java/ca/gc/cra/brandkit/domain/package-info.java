/**
 * Core domain model for Brandkit: brands, templates, assets and the registry failure taxonomy.
 * <p><strong>Role:</strong> Domain layer types without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 */
package ca.gc.cra.brandkit.domain;
