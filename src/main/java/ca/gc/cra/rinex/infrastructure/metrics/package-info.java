/**
 * OpenTelemetry metrics adapter exporting over OTLP gRPC, falling back to a no-op meter.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rinex.infrastructure.metrics;
