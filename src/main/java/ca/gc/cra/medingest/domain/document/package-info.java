/**
 * Extraction results produced by format extractors.
 */
package ca.gc.cra.medingest.domain.document;
