/**
 * OpenTelemetry-backed implementation of the metrics port.
 */
package ca.gc.cra.halo.infrastructure.metrics;
