/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.sketches.tdigest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class TDigestCompressTest {

  @Test
  void uniformSampleStaysAccurateAfterCompress() {
    Random random = new Random(42);
    TDigest digest = new TDigest(TDigest.DEFAULT_DELTA, TDigest.DEFAULT_K, 1.1, new Random(1));
    for (int i = 0; i < 100000; i++) {
      digest.push(random.nextDouble());
    }
    digest.compress();

    for (int i = 1; i <= 100; i++) {
      double p = i / 100.0;
      double q = digest.percentile(p);
      assertTrue(Math.abs(q - p) < 0.01, "percentile(" + p + ") = " + q);
    }
  }

  @Test
  void monotonicInputIsCompressed() {
    // K = 0: nothing but an explicit compress() may shrink the digest
    TDigest digest = new TDigest(0.01, 0, 1.1, new Random(2));
    for (int i = 0; i < 10000; i++) {
      digest.push(i);
    }
    assertEquals(10000, digest.size());

    digest.compress();

    assertTrue(digest.size() < 2500, "size after compress: " + digest.size());
    assertEquals(10000, digest.getN());
    List<Centroid> centroids = digest.toArray();
    assertEquals(0.0, centroids.get(0).getMean());
    assertEquals(1, centroids.get(0).getN());
    assertEquals(9999.0, centroids.get(centroids.size() - 1).getMean());
    assertEquals(1, centroids.get(centroids.size() - 1).getN());
    double previous = Double.NEGATIVE_INFINITY;
    for (Centroid c : centroids) {
      assertTrue(c.getMean() > previous);
      previous = c.getMean();
    }
  }

  @Test
  void compressNeverGrowsTheDigest() {
    Random random = new Random(4);
    TDigest digest = new TDigest(0.02, 0, 1.1, new Random(3));
    for (int i = 0; i < 20000; i++) {
      digest.push(random.nextGaussian());
    }

    int before = digest.size();
    double min = digest.percentile(0.0);
    double max = digest.percentile(1.0);
    digest.compress();

    assertTrue(digest.size() <= before);
    assertEquals(min, digest.percentile(0.0));
    assertEquals(max, digest.percentile(1.0));
  }

  @Test
  void automaticRecompressionBoundsSize() {
    // K / delta = 10 centroids before every push tries to recompress
    TDigest digest = new TDigest(0.1, 1, 0.0, new Random(5));
    for (int i = 0; i < 1000; i++) {
      digest.push(i);
    }

    assertEquals(1000, digest.getN());
    assertTrue(digest.getResetCount() > 1);
    assertTrue(digest.size() < 1000);
    assertEquals(999.0, digest.percentile(1.0));
  }

  @Test
  void discreteDigestSurvivesCompress() {
    TDigest digest = TDigest.discrete();
    for (int i = 0; i < 100; i++) {
      digest.push(i % 10);
    }

    digest.compress();

    assertEquals(10, digest.size());
    for (Centroid c : digest.toArray()) {
      assertEquals(10, c.getN());
    }
  }
}
