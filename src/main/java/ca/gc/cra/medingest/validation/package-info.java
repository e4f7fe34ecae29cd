/**
 * Validation helpers for configuration values and filesystem locations.
 */
package ca.gc.cra.medingest.validation;
