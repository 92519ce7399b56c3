/**
 * Template (preset) data model consumed read-only by brand creation.
 *
 * @since 0.1.0
 */
package ca.gc.cra.brandkit.domain.template;
