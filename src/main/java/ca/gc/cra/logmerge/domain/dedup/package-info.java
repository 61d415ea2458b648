/**
 * <strong>Purpose:</strong> Near-duplicate contact detection scoped by station group and comparison bucket.
 * <p><strong>Pipeline role:</strong> Domain engine invoked by the merge use case once per parsed record.
 * <p><strong>Concurrency:</strong> Single-threaded; a fresh index is built for each run.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logmerge.domain.dedup;
