/**
 * Streaming reader and writer for ADIF-style contact logs.
 * <p><strong>Role:</strong> Infrastructure codec between raw log bytes and domain records.</p>
 * <p><strong>Concurrency:</strong> Readers and encoders are owned by a single thread.</p>
 */
package ca.gc.cra.logmerge.infrastructure.adif;
