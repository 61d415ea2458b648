/**
 * <strong>Purpose:</strong> Value types and pure functions of the tag-length-value contact log format.
 * <p><strong>Pipeline role:</strong> Domain layer shared by the record parser, the duplicate index and the encoder.
 * <p><strong>Concurrency:</strong> Immutable values and stateless helpers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logmerge.domain.adif;
