/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.sketches.tdigest;

import java.util.List;

/**
 * Operations shared by {@link TDigest} and the mode-switching {@link Digest}. Queries on an empty
 * digest return {@link Double#NaN}; array overloads return one result per input, in input order.
 *
 * <p>Implementations are single-writer: callers sharing a digest across threads must synchronize
 * around every call, queries included.
 */
public interface QuantileDigest {

  /** Incorporates one observation of weight 1. */
  void push(double x);

  /**
   * Incorporates one value observed {@code n} times.
   *
   * @throws IllegalArgumentException if {@code n <= 0} or {@code x} is NaN
   */
  void push(double x, long n);

  void push(double[] xs);

  void push(double[] xs, long n);

  /** Incorporates a {mean, n} pair through the same path as {@link #push(double, long)}. */
  void pushCentroid(Centroid c);

  void pushCentroids(List<Centroid> cs);

  /**
   * Returns the smallest value q such that at least fraction {@code p} of the observed mass is
   * {@code <= q}.
   *
   * @param p fraction in [0, 1]
   */
  double percentile(double p);

  double[] percentile(double[] ps);

  /** Returns the fractional rank in [0, 1] of data value {@code x}. */
  double pRank(double x);

  double[] pRank(double[] xs);

  /** Alias of {@link #pRank(double)}. */
  default double quantile(double x) {
    return pRank(x);
  }

  /** Alias of {@link #pRank(double[])}. */
  default double[] quantile(double[] xs) {
    return pRank(xs);
  }

  /** Re-digests the current centroids in random order. */
  void compress();

  /** Number of centroids. */
  int size();

  /** Total observed weight. */
  long getN();

  List<Centroid> toArray();

  /**
   * Snapshots centroids ordered by mean.
   *
   * @param everything when true the copies carry exact cumulative counts
   */
  List<Centroid> toArray(boolean everything);

  String summary();

  /** Compresses, then encodes in the fixed-width format. */
  byte[] asBytes();

  /** Compresses, then encodes in the delta/varint format. */
  byte[] asSmallBytes();

  /** Drops all centroids and counters, keeping configuration. */
  void reset();
}
