package com.onthegomap.tiledecoder;

import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An error caused by malformed or hostile vector tile bytes.
 * <p>
 * Errors are scoped to the unit that was being parsed: a failure decoding one layer or feature leaves the {@link Tile}
 * and sibling layers usable, and no partially-constructed object is ever returned alongside one of these.
 */
public class DecodeException extends Exception {

  private static final Logger LOGGER = LoggerFactory.getLogger(DecodeException.class);

  /** The category of decoding failure. */
  public enum Kind {
    /** A layer lacks one of {@code name}, {@code version}, or {@code extent}. */
    MISSING_REQUIRED_FIELD,
    /** A feature's tag stream has an odd number of entries. */
    MALFORMED_TAG_STREAM,
    /** A feature tag references a key or value index beyond the layer dictionary. */
    OUT_OF_RANGE_REFERENCE,
    /** A geometry command id other than MoveTo, LineTo, or ClosePath. */
    UNKNOWN_COMMAND,
    /** A MoveTo or LineTo ran out of parameter integers. */
    TRUNCATED_COMMAND,
    /** A scaled coordinate does not fit in the requested coordinate range. */
    COORDINATE_OUT_OF_RANGE,
    /** A layer name or feature index does not exist. */
    NOT_FOUND,
    /** The underlying protobuf reader rejected the bytes. */
    PRIMITIVE_READ_ERROR,
    /** Decoded paths could not be assembled into a JTS geometry. */
    INVALID_GEOMETRY;

    /** Returns the lowercase code for this kind, used as the {@link #stat()} of exceptions. */
    public String stat() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private final Kind kind;
  private final List<String> missingFields;

  public DecodeException(Kind kind, String message) {
    this(kind, message, null, List.of());
  }

  public DecodeException(Kind kind, String message, Throwable cause) {
    this(kind, message, cause, List.of());
  }

  private DecodeException(Kind kind, String message, Throwable cause, List<String> missingFields) {
    super(message, cause);
    this.kind = kind;
    this.missingFields = List.copyOf(missingFields);
  }

  /**
   * Returns an exception reporting every required layer field that was absent.
   *
   * @param missingFields names of the absent fields in the order {@code version}, {@code extent}, {@code name}
   */
  public static DecodeException missingRequiredFields(List<String> missingFields) {
    return new DecodeException(Kind.MISSING_REQUIRED_FIELD,
      "missing required field: " + String.join(" ", missingFields), null, missingFields);
  }

  public Kind kind() {
    return kind;
  }

  /** Returns the unique code for this error condition, suitable for counting occurrences. */
  public String stat() {
    return kind.stat();
  }

  /** Returns the absent layer fields for {@link Kind#MISSING_REQUIRED_FIELD}, otherwise an empty list. */
  public List<String> missingFields() {
    return missingFields;
  }

  /** Logs this error at {@code WARN} level prefixed by {@code logContext}. */
  public void log(String logContext) {
    if (getCause() != null) {
      LOGGER.warn("{}: [{}] {}", logContext, stat(), getMessage(), getCause());
    } else {
      LOGGER.warn("{}: [{}] {}", logContext, stat(), getMessage());
    }
  }
}
