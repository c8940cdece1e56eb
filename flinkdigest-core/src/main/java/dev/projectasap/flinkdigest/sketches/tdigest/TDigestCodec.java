/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.sketches.tdigest;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binary layouts for a digest, all fields big-endian:
 *
 * <pre>
 *   int     encoding       1 = verbose, 2 = small
 *   double  min
 *   double  max
 *   double  compression    1 / delta, or 0 for a discrete digest
 *   int     m              centroid count
 *   verbose: m doubles (means, ascending), then m uint32 weights
 *   small:   m floats (each mean minus the previous one, starting from 0), then m varint weights
 * </pre>
 *
 * Min and max are informational; decoding rebuilds statistics from the centroids alone.
 */
final class TDigestCodec {
  private static final Logger logger = LoggerFactory.getLogger(TDigestCodec.class);

  static final int VERBOSE_ENCODING = 1;
  static final int SMALL_ENCODING = 2;

  private static final int VERBOSE_CENTROID_BYTES = Double.BYTES + Integer.BYTES;
  private static final int MIN_SMALL_CENTROID_BYTES = Float.BYTES + 1;
  private static final long MAX_VERBOSE_WEIGHT = 0xFFFFFFFFL;

  private TDigestCodec() {}

  /** The contents of a serialized digest. */
  static final class Decoded {
    final int encoding;
    final double delta;
    final double min;
    final double max;
    final List<Centroid> centroids;

    Decoded(int encoding, double delta, double min, double max, List<Centroid> centroids) {
      this.encoding = encoding;
      this.delta = delta;
      this.min = min;
      this.max = max;
      this.centroids = centroids;
    }
  }

  /** Compresses {@code digest} and writes it in the requested layout. */
  static byte[] encode(TDigest digest, int encoding) {
    digest.compress();
    List<Centroid> centroids = digest.toArray(false);
    ByteBuffer buffer =
        ByteBuffer.allocate(40 + centroids.size() * VERBOSE_CENTROID_BYTES)
            .order(ByteOrder.BIG_ENDIAN);

    double adjustedCompression = digest.isDiscrete() ? 0.0 : 1.0 / digest.getDelta();
    buffer.putInt(encoding);
    buffer.putDouble(digest.min());
    buffer.putDouble(digest.max());
    buffer.putDouble(adjustedCompression);
    buffer.putInt(centroids.size());

    if (encoding == VERBOSE_ENCODING) {
      for (Centroid c : centroids) {
        buffer.putDouble(c.mean);
      }
      for (Centroid c : centroids) {
        if (c.n > MAX_VERBOSE_WEIGHT) {
          throw new DigestFormatException(
              "Centroid weight " + c.n + " does not fit the verbose encoding");
        }
        buffer.putInt((int) c.n);
      }
    } else if (encoding == SMALL_ENCODING) {
      double previous = 0.0;
      for (Centroid c : centroids) {
        buffer.putFloat((float) (c.mean - previous));
        previous = c.mean;
      }
      for (Centroid c : centroids) {
        Varint.encode(buffer, c.n);
      }
    } else {
      throw new IllegalArgumentException("Unknown encoding " + encoding);
    }

    logger.debug(
        "Encoded {} centroids into {} bytes (encoding {})",
        centroids.size(),
        buffer.position(),
        encoding);
    return Arrays.copyOf(buffer.array(), buffer.position());
  }

  /**
   * Parses and validates a serialized digest without touching any digest.
   *
   * @throws DigestFormatException on an unknown encoding, an implausible centroid count, a
   *     truncated buffer or an invalid field
   */
  static Decoded decode(byte[] bytes) {
    ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.BIG_ENDIAN);
    try {
      int encoding = buffer.getInt();
      if (encoding != VERBOSE_ENCODING && encoding != SMALL_ENCODING) {
        throw new DigestFormatException(
            "Invalid format for serialized histogram: encoding " + encoding);
      }
      double min = buffer.getDouble();
      double max = buffer.getDouble();
      double adjustedCompression = buffer.getDouble();
      int count = buffer.getInt();

      int minCentroidBytes =
          encoding == VERBOSE_ENCODING ? VERBOSE_CENTROID_BYTES : MIN_SMALL_CENTROID_BYTES;
      if (count < 0 || (long) count * minCentroidBytes > buffer.remaining()) {
        throw new DigestFormatException(
            "The centroid count requested is too high: "
                + count
                + " centroids in "
                + buffer.remaining()
                + " bytes");
      }
      double delta = toDelta(adjustedCompression);

      double[] means = new double[count];
      if (encoding == VERBOSE_ENCODING) {
        for (int i = 0; i < count; i++) {
          means[i] = buffer.getDouble();
        }
      } else {
        double currentMean = 0.0;
        for (int i = 0; i < count; i++) {
          currentMean += buffer.getFloat();
          means[i] = currentMean;
        }
      }

      List<Centroid> centroids = new ArrayList<>(count);
      for (int i = 0; i < count; i++) {
        long weight =
            encoding == VERBOSE_ENCODING
                ? Integer.toUnsignedLong(buffer.getInt())
                : Varint.decode(buffer);
        if (weight <= 0) {
          throw new DigestFormatException("Centroid " + i + " has non-positive weight " + weight);
        }
        if (Double.isNaN(means[i])) {
          throw new DigestFormatException("Centroid " + i + " has a NaN mean");
        }
        centroids.add(Centroid.of(means[i], weight));
      }

      logger.debug("Decoded {} centroids (encoding {})", count, encoding);
      return new Decoded(encoding, delta, min, max, centroids);
    } catch (BufferUnderflowException e) {
      throw new DigestFormatException("Serialized digest is truncated", e);
    }
  }

  private static double toDelta(double adjustedCompression) {
    if (adjustedCompression == 0.0) {
      return TDigest.DISCRETE;
    }
    if (!(adjustedCompression >= 1.0) || Double.isInfinite(adjustedCompression)) {
      throw new DigestFormatException("Invalid compression " + adjustedCompression);
    }
    return 1.0 / adjustedCompression;
  }
}
