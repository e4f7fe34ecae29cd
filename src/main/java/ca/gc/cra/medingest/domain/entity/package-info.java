/**
 * Canonical medical entities and the normalized record that groups them per document.
 * <p><strong>Concurrency:</strong> All types are immutable.</p>
 */
package ca.gc.cra.medingest.domain.entity;
