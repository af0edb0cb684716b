package com.codeheadsystems.warden.security.common;

import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.digests.SHA256Digest;

/**
 * Byte-level helpers shared by the signer and the attestation providers.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Encodes a 64-bit value as eight big-endian bytes.
   *
   * @param value the value
   * @return the byte [ ]
   */
  public static byte[] bigEndian(long value) {
    byte[] result = new byte[Long.BYTES];
    for (int i = Long.BYTES - 1; i >= 0; i--) {
      result[i] = (byte) (value & 0xFF);
      value >>= 8;
    }
    return result;
  }

  /**
   * SHA-256 of the input.
   *
   * @param data the data, null is treated as empty
   * @return the 32-byte digest
   */
  public static byte[] sha256(byte[] data) {
    byte[] input = data == null ? new byte[0] : data;
    SHA256Digest digest = new SHA256Digest();
    digest.update(input, 0, input.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return out;
  }

  /**
   * UTF-8 bytes of a string.
   *
   * @param value the value, null is treated as empty
   * @return the byte [ ]
   */
  public static byte[] utf8(String value) {
    return value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8);
  }
}
