package com.onthegomap.tiledecoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sends decode warnings to slf4j at {@code DEBUG} level. */
final class LoggingDecodeWarnings implements DecodeWarnings {

  private static final Logger LOGGER = LoggerFactory.getLogger(DecodeWarnings.class);

  @Override
  public void warn(String message) {
    LOGGER.debug(message);
  }
}
