package com.onthegomap.tiledecoder.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value settings read by {@link DecoderConfig#from(Arguments)}.
 * <p>
 * Keys match regardless of case and of whether words are separated by {@code _}, {@code -}, or {@code .}, so
 * {@code "max-reserved-points"} and {@code "MAX.RESERVED.POINTS"} name the same setting.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);

  private final Map<String, String> values;

  private Arguments(Map<String, String> values) {
    this.values = values;
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> normalized = new LinkedHashMap<>();
    map.forEach((key, value) -> normalized.put(normalize(key), value));
    return new Arguments(normalized);
  }

  /** Shorthand for {@link #of(Map)} from alternating keys and values. */
  public static Arguments of(Object... keysAndValues) {
    if (keysAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("expected key/value pairs but got " + keysAndValues.length + " items");
    }
    Map<String, String> map = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      map.put(keysAndValues[i].toString(), keysAndValues[i + 1].toString());
    }
    return of(map);
  }

  private static String normalize(String key) {
    return key.replaceAll("[._-]", "_").toLowerCase(Locale.ROOT);
  }

  private String get(String key, String defaultValue) {
    String value = values.get(normalize(key));
    return value == null ? defaultValue : value.trim();
  }

  private static <T> T logged(String key, String description, T value) {
    LOGGER.debug("argument: {}={} ({})", key, value, description);
    return value;
  }

  public String getString(String key, String description, String defaultValue) {
    return logged(key, description, get(key, defaultValue));
  }

  /** Returns {@code true} only if the setting is {@code "true"}, ignoring case. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    return logged(key, description, "true".equalsIgnoreCase(get(key, Boolean.toString(defaultValue))));
  }

  /**
   * Returns a setting as an integer.
   *
   * @throws NumberFormatException if the setting cannot be parsed as an integer
   */
  public int getInteger(String key, String description, int defaultValue) {
    return logged(key, description, Integer.parseInt(get(key, Integer.toString(defaultValue))));
  }
}
