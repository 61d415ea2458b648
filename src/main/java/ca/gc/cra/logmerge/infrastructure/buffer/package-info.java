/** Byte buffers used by the incremental record parser. */
package ca.gc.cra.logmerge.infrastructure.buffer;
