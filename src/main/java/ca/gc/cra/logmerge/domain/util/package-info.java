/** Text decoding helpers for byte-level record values. */
package ca.gc.cra.logmerge.domain.util;
