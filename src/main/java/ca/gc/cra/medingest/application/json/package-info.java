/**
 * Streaming JSON helpers built on jackson-core: parsing into map/list graphs and deterministic writing of
 * domain records.
 */
package ca.gc.cra.medingest.application.json;
