/**
 * OpenTelemetry metrics adapter and its meter-provider bootstrap.
 */
package ca.gc.cra.medingest.infrastructure.metrics;
