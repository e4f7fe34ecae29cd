/**
 * Tolerant parsing of responses from the free-text entity extractor collaborator.
 */
package ca.gc.cra.medingest.application.llm;
