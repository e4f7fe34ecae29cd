/**
 * Mapping of normalized records into flat property maps for the workspace sync collaborator.
 */
package ca.gc.cra.medingest.application.sync;
