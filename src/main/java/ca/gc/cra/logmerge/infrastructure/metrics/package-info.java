/**
 * Metrics adapters that bridge the merge metrics port to OpenTelemetry or a no-op implementation.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code merge.*} namespace.</p>
 * <p><strong>Security:</strong> Only counts and durations are exported; callsigns and record values never are.</p>
 */
package ca.gc.cra.logmerge.infrastructure.metrics;
