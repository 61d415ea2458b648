/**
 * Logging helpers shared by the CLI and the parser: verbosity control and bounded value snippets.
 *
 * <p>Classes log through SLF4J; Logback is the runtime backend. The merge use case puts the current
 * source identifier under the MDC key {@code merge.source}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logmerge.logging;
