/**
 * File system sources: the directory catalog of new and archived logs and the done-directory archiver.
 * <p><strong>Role:</strong> Driven adapters for {@code LogSourceCatalog} and {@code ArchivePort}.</p>
 */
package ca.gc.cra.logmerge.infrastructure.source;
