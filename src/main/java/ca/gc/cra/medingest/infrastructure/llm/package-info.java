/**
 * HTTP adapter for the free-text entity extraction collaborator.
 */
package ca.gc.cra.medingest.infrastructure.llm;
