package com.onthegomap.tiledecoder;

/**
 * Receives advisory notes about suspicious but decodable tile contents, for example a key dictionary that maps one
 * name to several indexes.
 */
@FunctionalInterface
public interface DecodeWarnings {

  /** Discards every warning. */
  DecodeWarnings NONE = message -> {
  };

  /** Logs warnings at {@code DEBUG} level. */
  DecodeWarnings LOG = new LoggingDecodeWarnings();

  void warn(String message);
}
