package ca.gc.cra.logmerge.domain.adif;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One decoded contact entry: an ordered tag-to-value mapping plus provenance.
 * <p><strong>Why:</strong> Gives the parser, dedup index, and encoder a single value type to exchange.</p>
 * <p><strong>Role:</strong> Domain value produced by {@code RecordStream} and consumed by
 * {@link ca.gc.cra.logmerge.domain.dedup.DuplicateIndex}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Store tag names normalized to uppercase, preserving first-insertion order.</li>
 *   <li>Carry the source identifier in a dedicated field so it can never be written back out.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once built; safe to share across threads.</p>
 * <p><strong>Performance:</strong> Backed by a {@link LinkedHashMap}; lookups are constant-time.</p>
 * <p><strong>Observability:</strong> {@link #source()} identifies the originating file in reports.</p>
 *
 * @implNote {@link #equals(Object)} compares fields only; provenance and tag order are ignored.
 * @since 0.1.0
 */
public final class AdifRecord {
  private final String source;
  private final Map<String, String> fields;

  private AdifRecord(String source, Map<String, String> fields) {
    this.source = source;
    this.fields = Collections.unmodifiableMap(fields);
  }

  /**
   * Starts a builder for a record read from {@code source}.
   *
   * @param source source identifier; {@code null} is stored as an empty string
   * @return new builder
   */
  public static Builder builder(String source) {
    return new Builder(source);
  }

  /**
   * Creates a record from an existing tag map.
   *
   * @param source source identifier
   * @param fields tag values; keys are uppercased
   * @return populated record
   */
  public static AdifRecord of(String source, Map<String, String> fields) {
    Builder builder = builder(source);
    Objects.requireNonNull(fields, "fields").forEach(builder::put);
    return builder.build();
  }

  /**
   * Returns the provenance identifier of the input this record was read from.
   *
   * @return source identifier, never {@code null}
   */
  public String source() {
    return source;
  }

  /**
   * Returns the read-only tag map in first-insertion order.
   *
   * @return unmodifiable view of uppercase tag names to values
   */
  public Map<String, String> fields() {
    return fields;
  }

  /**
   * Looks up a tag value, case-insensitively.
   *
   * @param tag tag name
   * @return value when present
   */
  public Optional<String> get(String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(fields.get(tag.toUpperCase(Locale.ROOT)));
  }

  /**
   * Returns the value of {@code tag} or an empty string when absent.
   *
   * @param tag tag name
   * @return value or {@code ""}
   */
  public String getOrEmpty(String tag) {
    return get(tag).orElse("");
  }

  /**
   * Number of tags held by the record.
   *
   * @return tag count
   */
  public int size() {
    return fields.size();
  }

  /**
   * Indicates whether no tag was captured.
   *
   * @return {@code true} when the record has no tags
   */
  public boolean isEmpty() {
    return fields.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AdifRecord that)) {
      return false;
    }
    return fields.equals(that.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "AdifRecord{source='" + source + "', fields=" + fields + '}';
  }

  /**
   * Mutable builder used while a record span is being decoded.
   */
  public static final class Builder {
    private final String source;
    private final Map<String, String> fields = new LinkedHashMap<>();

    private Builder(String source) {
      this.source = source == null ? "" : source;
    }

    /**
     * Stores {@code value} under the uppercased {@code tag}; a repeated tag replaces the earlier value.
     *
     * @param tag tag name; must not be {@code null} or blank
     * @param value tag value; {@code null} is stored as an empty string
     * @return this builder
     */
    public Builder put(String tag, String value) {
      Objects.requireNonNull(tag, "tag");
      if (tag.isBlank()) {
        throw new IllegalArgumentException("tag must not be blank");
      }
      fields.put(tag.trim().toUpperCase(Locale.ROOT), value == null ? "" : value);
      return this;
    }

    /**
     * Indicates whether any tag has been added.
     *
     * @return {@code true} when no tag has been captured yet
     */
    public boolean isEmpty() {
      return fields.isEmpty();
    }

    /**
     * Builds an immutable record.
     *
     * @return record snapshot
     */
    public AdifRecord build() {
      return new AdifRecord(source, new LinkedHashMap<>(fields));
    }
  }
}
