/**
 * Brand data model: typed view over stored brand documents, protection state and CSS variable generation.
 * <p><strong>Concurrency:</strong> Records are immutable; {@link ca.gc.cra.brandkit.domain.brand.BrandDocuments}
 * is a stateless utility.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.brandkit.domain.brand;
