package ca.gc.cra.logmerge.infrastructure.adif;

import ca.gc.cra.logmerge.domain.adif.AdifRecord;
import ca.gc.cra.logmerge.domain.adif.AdifTags;
import ca.gc.cra.logmerge.domain.adif.TagFramer;
import ca.gc.cra.logmerge.domain.adif.TagHeader;
import ca.gc.cra.logmerge.domain.util.FallbackDecoder;
import ca.gc.cra.logmerge.infrastructure.buffer.GrowableBuffer;
import ca.gc.cra.logmerge.logging.Logs;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Pull reader turning one log byte stream into {@link AdifRecord}s.
 * <p><strong>Why:</strong> Logs can be large and arrive in arbitrary chunk sizes; records must be decoded
 * without reading the whole file and without losing position across refills.</p>
 * <p><strong>Role:</strong> Infrastructure reader created per source by the merge use case.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Skip the header up to {@code <EOH>}, or start immediately when none shows up within
 *   {@link #HEADER_SCAN_LIMIT} bytes or before end of input.</li>
 *   <li>Split on {@code <EOR>} (case-insensitive) and decode each span with {@link TagFramer}.</li>
 *   <li>Decode the unterminated remainder at end of input as a final best-effort record.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by one consumer.</p>
 * <p><strong>Performance:</strong> Memory is bounded by one chunk plus the record currently being accumulated.</p>
 * <p><strong>Observability:</strong> I/O failures are logged with the source identifier and end the stream
 * early; {@link #failed()} reports it.</p>
 *
 * @implNote A tag whose declared length runs past the end of its record span stops decoding of that record;
 * tags completed before it are kept. Spans without any usable tag are dropped silently.
 * @since 0.1.0
 */
public final class RecordStream implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RecordStream.class);

  /** Default read size per refill. */
  public static final int DEFAULT_CHUNK_BYTES = 64 * 1024;
  /** Bytes scanned for {@code <EOH>} before input is treated as headerless. */
  public static final int HEADER_SCAN_LIMIT = 1024 * 1024;

  private static final byte[] EOH = AdifTags.END_OF_HEADER.getBytes(StandardCharsets.US_ASCII);
  private static final byte[] EOR = AdifTags.END_OF_RECORD.getBytes(StandardCharsets.US_ASCII);
  private static final int SNIPPET_BYTES = 64;

  private final String sourceId;
  private final InputStream in;
  private final int chunkBytes;
  private final FallbackDecoder decoder;
  private final GrowableBuffer buffer;

  private boolean headerDone;
  private boolean exhausted;
  private boolean failed;
  private int searchFrom;
  private long recordsRead;

  /**
   * Creates a stream with the default chunk size and UTF-8 / GBK decoding.
   *
   * @param sourceId provenance identifier stamped on every record
   * @param in byte source; closed by {@link #close()}
   */
  public RecordStream(String sourceId, InputStream in) {
    this(sourceId, in, DEFAULT_CHUNK_BYTES, FallbackDecoder.utf8Then(Charset.forName("GBK")));
  }

  /**
   * Creates a stream.
   *
   * @param sourceId provenance identifier stamped on every record; must not be {@code null}
   * @param in byte source; must not be {@code null}; closed by {@link #close()}
   * @param chunkBytes bytes requested per refill; must be positive
   * @param decoder value decoder; must not be {@code null}
   */
  public RecordStream(String sourceId, InputStream in, int chunkBytes, FallbackDecoder decoder) {
    this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
    this.in = Objects.requireNonNull(in, "in");
    if (chunkBytes <= 0) {
      throw new IllegalArgumentException("chunkBytes must be positive");
    }
    this.chunkBytes = chunkBytes;
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.buffer = new GrowableBuffer(Math.max(chunkBytes, 1024));
  }

  /**
   * Returns the next record or {@code null} once the source is depleted or failed.
   *
   * @return next record, or {@code null} when complete
   */
  public AdifRecord next() {
    while (true) {
      if (!headerDone) {
        if (!skipHeader() && !fill()) {
          // end of input without <EOH>: everything buffered is record data
          headerDone = true;
          searchFrom = 0;
        }
        continue;
      }

      int terminator = buffer.indexOfIgnoreCase(EOR, searchFrom);
      if (terminator >= 0) {
        AdifRecord record = decodeSpan(sourceId, buffer.array(), buffer.readerIndex(), terminator, decoder);
        buffer.discard(terminator + EOR.length);
        searchFrom = 0;
        if (record != null) {
          recordsRead++;
          return record;
        }
        continue;
      }

      searchFrom = Math.max(0, buffer.readableBytes() - (EOR.length - 1));
      if (!fill()) {
        return drainRemainder();
      }
    }
  }

  private boolean skipHeader() {
    int end = buffer.indexOfIgnoreCase(EOH, searchFrom);
    if (end >= 0) {
      buffer.discard(end + EOH.length);
      headerDone = true;
      searchFrom = 0;
      return true;
    }
    if (buffer.readableBytes() > HEADER_SCAN_LIMIT) {
      log.warn("No {} within {} bytes of {}; parsing as headerless input",
          AdifTags.END_OF_HEADER, HEADER_SCAN_LIMIT, sourceId);
      headerDone = true;
      searchFrom = 0;
      return true;
    }
    searchFrom = Math.max(0, buffer.readableBytes() - (EOH.length - 1));
    return false;
  }

  private AdifRecord drainRemainder() {
    int remaining = buffer.readableBytes();
    if (remaining == 0) {
      return null;
    }
    AdifRecord record = decodeSpan(sourceId, buffer.array(), buffer.readerIndex(), remaining, decoder);
    buffer.clear();
    searchFrom = 0;
    if (record != null) {
      recordsRead++;
    }
    return record;
  }

  private boolean fill() {
    if (exhausted) {
      return false;
    }
    try {
      int read = buffer.readFrom(in, chunkBytes);
      if (read < 0) {
        exhausted = true;
        return false;
      }
      return true;
    } catch (IOException ex) {
      log.error("I/O failure reading {} after {} records; skipping the rest of this source",
          sourceId, recordsRead, ex);
      abort();
      return false;
    } catch (IllegalStateException ex) {
      log.error("Record in {} exceeds the parser buffer limit; skipping the rest of this source", sourceId, ex);
      abort();
      return false;
    }
  }

  private void abort() {
    failed = true;
    exhausted = true;
    headerDone = true;
    buffer.clear();
    searchFrom = 0;
  }

  /**
   * Decodes one raw record span, the bytes between two {@code <EOR>} markers.
   *
   * @param source provenance identifier
   * @param data backing array
   * @param offset span start
   * @param length span length in bytes
   * @param decoder value decoder
   * @return record holding every completely framed tag, or {@code null} when the span has none
   */
  static AdifRecord decodeSpan(String source, byte[] data, int offset, int length, FallbackDecoder decoder) {
    AdifRecord.Builder builder = AdifRecord.builder(source);
    int limit = offset + length;
    int cursor = offset;
    while (cursor < limit) {
      Optional<TagHeader> next = TagFramer.next(data, cursor, limit);
      if (next.isEmpty()) {
        break;
      }
      TagHeader header = next.get();
      if (header.valueEnd() > limit) {
        if (log.isDebugEnabled()) {
          log.debug("Tag {} in {} declares {} bytes but only {} remain; keeping earlier tags",
              header.name(), source, header.length(), limit - header.end());
        }
        break;
      }
      builder.put(header.name(), decoder.decode(data, header.end(), header.length()));
      cursor = (int) header.valueEnd();
    }
    if (builder.isEmpty()) {
      if (log.isDebugEnabled() && hasContent(data, offset, limit)) {
        log.debug("Dropping span without usable tags from {}: {}", source,
            Logs.truncate(new String(data, offset, length, StandardCharsets.UTF_8).strip(), SNIPPET_BYTES));
      }
      return null;
    }
    return builder.build();
  }

  private static boolean hasContent(byte[] data, int from, int to) {
    for (int i = from; i < to; i++) {
      if (!Character.isWhitespace(data[i])) {
        return true;
      }
    }
    return false;
  }

  /**
   * Indicates whether the stream ended early because the source failed.
   *
   * @return {@code true} after an I/O failure
   */
  public boolean failed() {
    return failed;
  }

  /**
   * Records yielded so far.
   *
   * @return record count
   */
  public long recordsRead() {
    return recordsRead;
  }

  /**
   * Closes the underlying source. Close failures are logged, not thrown.
   */
  @Override
  public void close() {
    try {
      in.close();
    } catch (IOException ex) {
      log.warn("Failed to close source {}", sourceId, ex);
    }
  }
}
