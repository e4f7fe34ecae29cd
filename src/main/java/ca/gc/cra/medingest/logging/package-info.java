/**
 * Logging helpers: runtime verbosity and bounded rendering of logged text.
 */
package ca.gc.cra.medingest.logging;
