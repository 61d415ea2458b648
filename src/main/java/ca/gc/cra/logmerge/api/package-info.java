/**
 * Command-line entry points: the {@code logmerge} dispatcher and the {@code merge} subcommand.
 * <p><strong>Role:</strong> Driving adapter; parses arguments, configures logging and telemetry, validates
 * directories and invokes the merge use case.</p>
 * <p><strong>Output:</strong> Usage text, dry-run plans and run summaries go to stdout via {@link
 * ca.gc.cra.logmerge.api.CliPrinter}; diagnostics go to the logs.</p>
 */
package ca.gc.cra.logmerge.api;
