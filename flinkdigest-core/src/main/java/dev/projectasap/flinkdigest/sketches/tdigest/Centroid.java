/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.sketches.tdigest;

/**
 * A weighted mean standing in for one or more observations. The cumulative fields are derived by
 * the owning digest and may be stale between refreshes.
 */
public class Centroid {
  double mean;
  long n;
  double cumn;
  double meanCumn;

  Centroid(double mean, long n, double cumn, double meanCumn) {
    this.mean = mean;
    this.n = n;
    this.cumn = cumn;
    this.meanCumn = meanCumn;
  }

  /**
   * Creates a detached {mean, n} pair, e.g. for {@link TDigest#pushCentroid(Centroid)}.
   *
   * @param mean the centroid mean
   * @param n the centroid weight
   */
  public static Centroid of(double mean, long n) {
    return new Centroid(mean, n, 0.0, 0.0);
  }

  public double getMean() {
    return mean;
  }

  public long getN() {
    return n;
  }

  /** Cumulative weight up to and including this centroid. */
  public double getCumn() {
    return cumn;
  }

  /** Cumulative weight at this centroid's mean, i.e. half its own weight included. */
  public double getMeanCumn() {
    return meanCumn;
  }

  Centroid copy(boolean everything) {
    return everything ? new Centroid(mean, n, cumn, meanCumn) : of(mean, n);
  }

  @Override
  public String toString() {
    return "Centroid{" + "mean=" + mean + ", n=" + n + ", cumn=" + cumn + ", meanCumn=" + meanCumn
        + '}';
  }
}
