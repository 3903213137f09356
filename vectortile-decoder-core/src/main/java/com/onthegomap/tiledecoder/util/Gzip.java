package com.onthegomap.tiledecoder.util;

import com.google.common.io.ByteStreams;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/** Utilities for gzip-compressed tile payloads. */
public final class Gzip {

  private Gzip() {}

  public static byte[] gzip(byte[] in) {
    var bos = new ByteArrayOutputStream(in.length);
    try (var gzipOS = new GZIPOutputStream(bos)) {
      gzipOS.write(in);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return bos.toByteArray();
  }

  /**
   * Inflates gzip-compressed bytes, refusing to produce more than {@code maxBytes}.
   *
   * @throws IOException if {@code zipped} is not a complete gzip stream or inflates to more than {@code maxBytes}
   */
  public static byte[] gunzip(byte[] zipped, int maxBytes) throws IOException {
    try (var is = new GZIPInputStream(new ByteArrayInputStream(zipped))) {
      byte[] result = ByteStreams.toByteArray(ByteStreams.limit(is, maxBytes + 1L));
      if (result.length > maxBytes) {
        throw new IOException("gzip stream inflates to more than " + maxBytes + " bytes");
      }
      return result;
    }
  }

  /** Returns {@code true} if {@code in} starts with the gzip magic header. */
  public static boolean isZipped(byte[] in) {
    return in != null && in.length > 2 && in[0] == (byte) GZIPInputStream.GZIP_MAGIC &&
      in[1] == (byte) (GZIPInputStream.GZIP_MAGIC >> 8);
  }
}
