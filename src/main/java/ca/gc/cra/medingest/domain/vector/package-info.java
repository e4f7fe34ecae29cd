/**
 * Embedding entries and similarity hits.
 */
package ca.gc.cra.medingest.domain.vector;
