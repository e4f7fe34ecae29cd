/**
 * Format detection: extension routing and content sniffing over the registered extractor modules.
 */
package ca.gc.cra.medingest.infrastructure.detect;
