/**
 * Configuration for the merge CLI: defaults, YAML loading, precedence merging, the validated
 * {@link ca.gc.cra.logmerge.config.MergeConfig} record and the composition root.
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Paths, charsets and numbers are validated through {@code ca.gc.cra.logmerge.validation}.</p>
 */
package ca.gc.cra.logmerge.config;
