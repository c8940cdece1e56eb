/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.sketches.tdigest;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class TDigestCodecTest {
  private static final double[] GRID = {0, 0.1, 0.5, 0.75, 0.95, 0.99, 0.999, 1.0};
  private static final int HEADER_BYTES = 32;

  private static TDigest uniformDigest(int samples) {
    Random random = new Random(99);
    TDigest digest = new TDigest(TDigest.DEFAULT_DELTA, TDigest.DEFAULT_K, 1.1, new Random(8));
    for (int i = 0; i < samples; i++) {
      digest.push(random.nextDouble());
    }
    return digest;
  }

  private static byte[] header(int encoding, double compression, int count) {
    return ByteBuffer.allocate(HEADER_BYTES)
        .putInt(encoding)
        .putDouble(0.0)
        .putDouble(1.0)
        .putDouble(compression)
        .putInt(count)
        .array();
  }

  @Test
  void verboseLayout() {
    TDigest digest = new TDigest();
    digest.push(new double[] {2.0, 1.0, 3.0});
    digest.push(3.0, 4);

    byte[] bytes = digest.asBytes();

    assertEquals(HEADER_BYTES + 3 * 12, bytes.length);
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    assertEquals(TDigestCodec.VERBOSE_ENCODING, buffer.getInt());
    assertEquals(1.0, buffer.getDouble());
    assertEquals(3.0, buffer.getDouble());
    assertEquals(100.0, buffer.getDouble(), 1e-9);
    assertEquals(3, buffer.getInt());
    assertEquals(1.0, buffer.getDouble());
    assertEquals(2.0, buffer.getDouble());
    assertEquals(3.0, buffer.getDouble());
    assertEquals(1, buffer.getInt());
    assertEquals(1, buffer.getInt());
    assertEquals(5, buffer.getInt());
    assertFalse(buffer.hasRemaining());
  }

  @Test
  void smallLayout() {
    TDigest digest = new TDigest();
    digest.push(new double[] {1.0, 2.5, 4.0});
    digest.push(4.0, 299);

    byte[] bytes = digest.asSmallBytes();

    assertEquals(HEADER_BYTES + 3 * 4 + 1 + 1 + 2, bytes.length);
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    assertEquals(TDigestCodec.SMALL_ENCODING, buffer.getInt());
    assertEquals(1.0, buffer.getDouble());
    assertEquals(4.0, buffer.getDouble());
    assertEquals(100.0, buffer.getDouble(), 1e-9);
    assertEquals(3, buffer.getInt());
    assertEquals(1.0f, buffer.getFloat());
    assertEquals(1.5f, buffer.getFloat());
    assertEquals(1.5f, buffer.getFloat());
    assertEquals(1, buffer.get());
    assertEquals(1, buffer.get());
    assertEquals((byte) 0xAC, buffer.get());
    assertEquals(0x02, buffer.get());
    assertFalse(buffer.hasRemaining());
  }

  @Test
  void verboseRoundTripReproducesPercentiles() {
    TDigest digest = uniformDigest(50000);
    byte[] bytes = digest.asBytes();

    TDigest loaded = TDigest.fromBytes(bytes);

    assertArrayEquals(digest.percentile(GRID), loaded.percentile(GRID), 1e-5);
    assertEquals(digest.getN(), loaded.getN());
    assertEquals(digest.size(), loaded.size());
    assertEquals(digest.getDelta(), loaded.getDelta(), 1e-12);
  }

  @Test
  void smallRoundTripReproducesPercentiles() {
    TDigest digest = uniformDigest(50000);
    byte[] bytes = digest.asSmallBytes();

    TDigest loaded = TDigest.fromBytes(bytes);

    assertArrayEquals(digest.percentile(GRID), loaded.percentile(GRID), 1e-5);
    assertEquals(digest.getN(), loaded.getN());
    assertTrue(bytes.length < digest.asBytes().length);
  }

  @Test
  void discreteDigestRoundTripsAsDiscrete() {
    TDigest digest = TDigest.discrete();
    for (int i = 0; i < 50; i++) {
      digest.push(i % 5, 2);
    }

    byte[] bytes = digest.asBytes();
    assertEquals(0.0, ByteBuffer.wrap(bytes).getDouble(20));

    TDigest loaded = new TDigest().load(bytes);
    assertTrue(loaded.isDiscrete());
    assertEquals(5, loaded.size());
    assertEquals(100, loaded.getN());
    assertEquals(2.0, loaded.percentile(0.5));
  }

  @Test
  void emptyDigestRoundTrips() {
    TDigest digest = new TDigest();
    byte[] bytes = digest.asSmallBytes();

    assertEquals(HEADER_BYTES, bytes.length);
    TDigestCodec.Decoded decoded = TDigestCodec.decode(bytes);
    assertTrue(Double.isNaN(decoded.min));
    assertTrue(decoded.centroids.isEmpty());
    assertEquals(0, TDigest.fromBytes(bytes).size());
  }

  @Test
  void decodeReportsHeaderFields() {
    TDigest digest = new TDigest(0.05);
    digest.push(new double[] {-2.0, 7.0, 3.0});

    TDigestCodec.Decoded decoded = TDigestCodec.decode(digest.asSmallBytes());

    assertEquals(TDigestCodec.SMALL_ENCODING, decoded.encoding);
    assertEquals(-2.0, decoded.min);
    assertEquals(7.0, decoded.max);
    assertEquals(0.05, decoded.delta, 1e-12);
    assertEquals(3, decoded.centroids.size());
  }

  @Test
  void rejectsUnknownEncoding() {
    DigestFormatException e =
        assertThrows(DigestFormatException.class, () -> TDigest.fromBytes(header(3, 100.0, 0)));
    assertTrue(e.getMessage().contains("Invalid format for serialized histogram"));
  }

  @Test
  void rejectsCentroidCountBeyondBuffer() {
    byte[] bytes = Arrays.copyOf(header(1, 100.0, 1_000_000), HEADER_BYTES + 24);

    DigestFormatException e =
        assertThrows(DigestFormatException.class, () -> TDigest.fromBytes(bytes));
    assertTrue(e.getMessage().contains("centroid count requested is too high"));

    assertThrows(DigestFormatException.class, () -> TDigest.fromBytes(header(2, 100.0, -1)));
  }

  @Test
  void rejectsTruncatedBuffers() {
    assertThrows(DigestFormatException.class, () -> TDigest.fromBytes(new byte[] {0, 0, 0}));

    TDigest digest = new TDigest();
    digest.push(new double[] {1.0, 2.0, 3.0});
    digest.push(2.0, 299);
    byte[] bytes = digest.asSmallBytes();
    byte[] truncated = Arrays.copyOf(bytes, bytes.length - 1);

    DigestFormatException e =
        assertThrows(DigestFormatException.class, () -> TDigest.fromBytes(truncated));
    assertTrue(e.getMessage().contains("truncated"));
  }

  @Test
  void rejectsInvalidCompression() {
    assertThrows(DigestFormatException.class, () -> TDigest.fromBytes(header(1, 0.5, 0)));
    assertThrows(DigestFormatException.class, () -> TDigest.fromBytes(header(1, -100.0, 0)));
    assertThrows(
        DigestFormatException.class, () -> TDigest.fromBytes(header(1, Double.NaN, 0)));
  }

  @Test
  void rejectsZeroWeights() {
    byte[] bytes =
        ByteBuffer.allocate(HEADER_BYTES + 12)
            .put(header(1, 100.0, 1))
            .putDouble(1.0)
            .putInt(0)
            .array();

    assertThrows(DigestFormatException.class, () -> TDigest.fromBytes(bytes));
  }

  @Test
  void failedLoadLeavesDigestUntouched() {
    TDigest digest = new TDigest(0.05);
    digest.push(new double[] {1.0, 2.0, 3.0});
    List<Centroid> before = digest.toArray();

    assertThrows(
        DigestFormatException.class, () -> digest.load(header(1, 100.0, Integer.MAX_VALUE)));

    assertEquals(3, digest.getN());
    assertEquals(0.05, digest.getDelta());
    assertEquals(before.size(), digest.size());
  }

  @Test
  void oversizedWeightsCannotBeEncoded() {
    TDigest big = new TDigest();
    big.push(1.0, 1L << 43);
    assertThrows(DigestFormatException.class, big::asSmallBytes);

    TDigest wide = new TDigest();
    wide.push(1.0, 1L << 33);
    assertThrows(DigestFormatException.class, wide::asBytes);
    assertEquals(1L << 33, TDigest.fromBytes(wide.asSmallBytes()).getN());
  }

  @Test
  void unsignedVerboseWeightsDecode() {
    TDigest digest = new TDigest();
    digest.push(1.0, 0xFFFFFFFFL);

    assertEquals(0xFFFFFFFFL, TDigest.fromBytes(digest.asBytes()).getN());
  }
}
