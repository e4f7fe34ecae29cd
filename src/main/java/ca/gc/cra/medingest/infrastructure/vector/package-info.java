/**
 * Embedding store and embedding model adapters.
 */
package ca.gc.cra.medingest.infrastructure.vector;
