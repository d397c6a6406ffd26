package com.example.awstools.core.s3;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/** In-memory gzip codec for object bodies. */
final class Gzip {

  private Gzip() {}

  static byte[] decompress(final byte[] compressed) {
    try (var in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
      return in.readAllBytes();
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to gunzip object body", e);
    }
  }

  static byte[] compress(final byte[] plain) {
    final var bytes = new ByteArrayOutputStream(Math.max(32, plain.length / 2));
    try (var out = new GZIPOutputStream(bytes)) {
      out.write(plain);
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to gzip object body", e);
    }
    return bytes.toByteArray();
  }
}
