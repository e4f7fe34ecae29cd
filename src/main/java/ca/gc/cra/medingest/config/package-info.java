/**
 * Configuration records, YAML loading, precedence merging and the composition root.
 * <p>Effective configuration is CLI over YAML over {@link ca.gc.cra.medingest.config.DefaultsForMode}; the
 * merged flat map is turned into {@link ca.gc.cra.medingest.config.IngestConfig} or
 * {@link ca.gc.cra.medingest.config.SearchConfig}, whose {@code fromMap} factories validate every value.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.medingest.config;
