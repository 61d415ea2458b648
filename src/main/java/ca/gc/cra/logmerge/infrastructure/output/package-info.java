/**
 * Writers for the merged logs, the duplicate report and the JSON run summary.
 * <p><strong>Role:</strong> Driven adapters for the merge output ports.</p>
 */
package ca.gc.cra.logmerge.infrastructure.output;
