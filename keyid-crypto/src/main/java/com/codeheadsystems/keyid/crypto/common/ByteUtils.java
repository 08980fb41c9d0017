package com.codeheadsystems.keyid.crypto.common;

import java.security.MessageDigest;
import java.util.Arrays;

/**
 * Utility methods for handling key material and comparing secrets.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Overwrites every given buffer with zero bytes. Null buffers are ignored.
   *
   * @param buffers the buffers to wipe
   */
  public static void wipe(byte[]... buffers) {
    for (byte[] buffer : buffers) {
      if (buffer != null) {
        Arrays.fill(buffer, (byte) 0);
      }
    }
  }

  /**
   * Constant-time comparison of two byte arrays. Null on either side compares unequal.
   *
   * @param a the a
   * @param b the b
   * @return true when both arrays hold the same bytes
   */
  public static boolean constantTimeEquals(byte[] a, byte[] b) {
    if (a == null || b == null) {
      return false;
    }
    return MessageDigest.isEqual(a, b);
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
}
