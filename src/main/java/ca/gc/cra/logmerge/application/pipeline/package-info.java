/**
 * The merge use case and its result.
 * <p><strong>Role:</strong> Application layer; drives sources through the duplicate index and hands accepted
 * records, duplicate events and the run summary to the output ports.</p>
 * <p><strong>Observability:</strong> Counts {@code merge.*} metrics and tags log lines with the MDC key
 * {@code merge.source}.</p>
 */
package ca.gc.cra.logmerge.application.pipeline;
