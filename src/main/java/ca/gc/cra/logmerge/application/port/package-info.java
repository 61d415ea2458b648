/**
 * <strong>Purpose:</strong> Ports between the merge use case and the file system, clock and metrics backend.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Runs are single-threaded; implementations need not synchronize unless
 * documented.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logmerge.application.port;
