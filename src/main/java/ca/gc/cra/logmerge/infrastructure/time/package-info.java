/** System clock adapter. */
package ca.gc.cra.logmerge.infrastructure.time;
