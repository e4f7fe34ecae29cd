/**
 * Workspace sync adapters.
 */
package ca.gc.cra.medingest.infrastructure.sync;
