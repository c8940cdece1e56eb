/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.sketches.tdigest;

import java.nio.ByteBuffer;

/**
 * Base-128 unsigned integers, least significant group first. The high bit of each byte flags a
 * following byte. Values are capped at {@value #MAX_BYTES} bytes.
 */
final class Varint {
  static final int MAX_BYTES = 6;
  static final long MAX_VALUE = (1L << (7 * MAX_BYTES)) - 1;

  private Varint() {}

  static void encode(ByteBuffer buffer, long n) {
    if (n < 0 || n > MAX_VALUE) {
      throw new DigestFormatException("Size of n is too large: " + n);
    }
    while (n > 0x7f) {
      buffer.put((byte) (0x80 | (n & 0x7f)));
      n >>>= 7;
    }
    buffer.put((byte) n);
  }

  static long decode(ByteBuffer buffer) {
    int v = buffer.get() & 0xff;
    long z = v & 0x7f;
    int shift = 7;
    while ((v & 0x80) != 0) {
      if (shift >= 7 * MAX_BYTES) {
        throw new DigestFormatException("Shift too large in decode");
      }
      v = buffer.get() & 0xff;
      z += (long) (v & 0x7f) << shift;
      shift += 7;
    }
    return z;
  }
}
