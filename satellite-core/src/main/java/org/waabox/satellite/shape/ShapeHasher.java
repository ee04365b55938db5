package org.waabox.satellite.shape;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Objects;

/**
 * Computes order-independent content hashes for lists of shapes.
 *
 * <p>Two lists hash to the same value when they contain the same shapes,
 * regardless of the order of the list itself or of any include or foreign
 * key column list within them. The hash is a SHA-256 digest over the
 * canonical JSON form produced by {@link ShapeCodec}.
 *
 * <p>Foreign key column lists are sorted too, so two multi-column foreign
 * keys over the same columns in a different order hash equally.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ShapeHasher {

  /** The hex characters used for hash string conversion. */
  private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();

  /** Private constructor to prevent instantiation. */
  private ShapeHasher() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Computes the content hash of the given shapes.
   *
   * @param shapes the shapes to hash, never null
   *
   * @return the hex-encoded SHA-256 hash, never null
   */
  public static String hash(final List<Shape> shapes) {
    Objects.requireNonNull(shapes, "shapes must not be null");

    final byte[] canonical = ShapeCodec.toArray(shapes, true).toString()
        .getBytes(StandardCharsets.UTF_8);
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return toHexString(digest.digest(canonical));
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  /**
   * Converts a byte array to a lowercase hex string.
   *
   * @param bytes the bytes to convert, never null
   *
   * @return the hex string representation, never null
   */
  private static String toHexString(final byte[] bytes) {
    final char[] hexChars = new char[bytes.length * 2];
    for (int i = 0; i < bytes.length; i++) {
      final int v = bytes[i] & 0xFF;
      hexChars[i * 2] = HEX_CHARS[v >>> 4];
      hexChars[i * 2 + 1] = HEX_CHARS[v & 0x0F];
    }
    return new String(hexChars);
  }
}
