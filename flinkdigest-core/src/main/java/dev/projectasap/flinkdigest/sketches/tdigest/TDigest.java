/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.sketches.tdigest;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streaming approximate-percentile digest. Observations are folded into centroids ordered by mean;
 * a centroid may absorb a new point only while its weight stays under a capacity derived from its
 * estimated quantile and the compression factor {@code delta}.
 *
 * <p>Departures from the published algorithm:
 *
 * <ul>
 *   <li>exact mean matches always merge, so means stay unique;
 *   <li>a point either fits entirely into its nearest centroid or becomes a new centroid, never a
 *       partial merge;
 *   <li>the smallest and largest centroids never absorb non-matching points, so the observed
 *       minimum and maximum are kept exactly;
 *   <li>cumulative counts are refreshed lazily during ingest (see {@code cx}).
 * </ul>
 *
 * <p>A {@code delta} of {@link #DISCRETE} turns merging off: every distinct value keeps its own
 * centroid and queries report exact order statistics.
 *
 * <p>Percentiles and ranks interpolate between centroid means positioned at their
 * {@code meanCumn}, the cumulative weight before the centroid plus half its own weight. No
 * endpoint correction is applied: ranks below the first centroid's {@code meanCumn} map to the
 * minimum, ranks above the last map to the maximum.
 *
 * <p>Not thread-safe.
 */
public class TDigest implements QuantileDigest {
  private static final Logger logger = LoggerFactory.getLogger(TDigest.class);

  /** Compression factor that disables merging. */
  public static final double DISCRETE = 0.0;

  public static final double DEFAULT_DELTA = 0.01;
  public static final int DEFAULT_K = 25;
  public static final double DEFAULT_CX = 1.1;

  private final CentroidIndex centroids = new CentroidIndex();
  private final int k;
  private final double cx;
  private final Random random;

  private double delta;
  private boolean discrete;
  private long n;
  private long lastCumulate;
  private long resetCount;
  private long singletons;
  private boolean compressing;

  public TDigest() {
    this(DEFAULT_DELTA);
  }

  public TDigest(double delta) {
    this(delta, DEFAULT_K, DEFAULT_CX);
  }

  /**
   * Constructs an empty digest.
   *
   * @param delta largest mass fraction one centroid may own, in (0, 1], or {@link #DISCRETE}
   * @param k recompress once the centroid count exceeds {@code k / delta}; 0 disables this
   * @param cx during ingest, refresh cumulative counts only after the total grows by this factor;
   *     0 refreshes on every point
   */
  public TDigest(double delta, int k, double cx) {
    this(delta, k, cx, new Random());
  }

  /** As {@link #TDigest(double, int, double)} with an explicit source of randomness. */
  public TDigest(double delta, int k, double cx, Random random) {
    checkArgument(k >= 0, "K must be non-negative, got %s", k);
    checkArgument(cx >= 0.0, "CX must be non-negative, got %s", cx);
    this.k = k;
    this.cx = cx;
    this.random = random;
    configure(delta);
    reset();
  }

  /** An exact digest with default thresholds. */
  public static TDigest discrete() {
    return new TDigest(DISCRETE);
  }

  /**
   * Decodes either serialized format into a new digest with default thresholds.
   *
   * @throws DigestFormatException if the bytes are not a serialized digest
   */
  public static TDigest fromBytes(byte[] bytes) {
    return new TDigest().load(bytes);
  }

  /** Changes the compression factor without touching existing centroids. */
  void configure(double delta) {
    checkArgument(
        delta == DISCRETE || (delta > 0.0 && delta <= 1.0),
        "delta must be in (0, 1] or DISCRETE, got %s",
        delta);
    this.delta = delta;
    this.discrete = delta == DISCRETE;
  }

  @Override
  public void reset() {
    centroids.clear();
    n = 0;
    lastCumulate = 0;
    singletons = 0;
    resetCount++;
  }

  /**
   * Replaces this digest's contents and compression factor with a serialized digest. The bytes are
   * fully validated before any state changes.
   *
   * @return this digest
   * @throws DigestFormatException if the bytes are not a serialized digest
   */
  public TDigest load(byte[] bytes) {
    TDigestCodec.Decoded decoded = TDigestCodec.decode(bytes);
    configure(decoded.delta);
    reset();
    pushCentroids(decoded.centroids);
    return this;
  }

  @Override
  public byte[] asBytes() {
    return TDigestCodec.encode(this, TDigestCodec.VERBOSE_ENCODING);
  }

  @Override
  public byte[] asSmallBytes() {
    return TDigestCodec.encode(this, TDigestCodec.SMALL_ENCODING);
  }

  @Override
  public int size() {
    return centroids.size();
  }

  @Override
  public long getN() {
    return n;
  }

  public double getDelta() {
    return delta;
  }

  public boolean isDiscrete() {
    return discrete;
  }

  public int getK() {
    return k;
  }

  public double getCx() {
    return cx;
  }

  /** Number of times this digest has been cleared, including by recompression and loading. */
  public long getResetCount() {
    return resetCount;
  }

  /** Centroids currently holding a single observation. */
  long singletonCount() {
    return singletons;
  }

  double min() {
    return centroids.isEmpty() ? Double.NaN : centroids.min().mean;
  }

  double max() {
    return centroids.isEmpty() ? Double.NaN : centroids.max().mean;
  }

  @Override
  public List<Centroid> toArray() {
    return toArray(false);
  }

  @Override
  public List<Centroid> toArray(boolean everything) {
    if (everything) {
      cumulate(true);
    }
    List<Centroid> result = new ArrayList<>(centroids.size());
    for (Centroid c : centroids) {
      result.add(c.copy(everything));
    }
    return result;
  }

  @Override
  public String summary() {
    String approx = discrete ? "exact " : "approximating ";
    return approx + n + " samples using " + size() + " centroids"
        + "\nmin = " + percentile(0.0)
        + "\nQ1  = " + percentile(0.25)
        + "\nQ2  = " + percentile(0.5)
        + "\nQ3  = " + percentile(0.75)
        + "\nmax = " + percentile(1.0);
  }

  @Override
  public void push(double x) {
    push(x, 1L);
  }

  @Override
  public void push(double x, long n) {
    checkArgument(n > 0, "weight must be positive, got %s", n);
    checkArgument(!Double.isNaN(x), "cannot digest NaN");
    digest(x, n);
  }

  @Override
  public void push(double[] xs) {
    push(xs, 1L);
  }

  @Override
  public void push(double[] xs, long n) {
    for (double x : xs) {
      push(x, n);
    }
  }

  @Override
  public void pushCentroid(Centroid c) {
    push(c.mean, c.n);
  }

  @Override
  public void pushCentroids(List<Centroid> cs) {
    for (Centroid c : cs) {
      pushCentroid(c);
    }
  }

  private void digest(double x, long w) {
    Centroid nearest = findNearest(x);
    if (nearest != null && nearest.mean == x) {
      // exact matches merge without limit
      addWeight(nearest, x, w);
    } else if (nearest == null || nearest == centroids.min()) {
      newCentroid(x, w, 0.0);
    } else if (nearest == centroids.max()) {
      newCentroid(x, w, n);
    } else if (discrete) {
      newCentroid(x, w, nearest.cumn);
    } else {
      // all of w fits or none of it does; a remainder would need a new centroid anyway
      double q = nearest.meanCumn / n;
      long maxN = (long) Math.floor(4 * n * delta * q * (1 - q));
      if (maxN - nearest.n >= w) {
        addWeight(nearest, x, w);
      } else {
        newCentroid(x, w, nearest.cumn);
      }
    }
    cumulate(false);
    if (!discrete && k != 0 && centroids.size() > k / delta) {
      compress();
    }
  }

  /**
   * Finds the centroid closest to {@code x}, or null when empty. Equidistant neighbours are chosen
   * between at random. In discrete mode there is no distance: the first centroid with mean {@code
   * >= x} is returned, or the last one.
   */
  Centroid findNearest(double x) {
    if (centroids.isEmpty()) {
      return null;
    }
    int idx = centroids.lowerBoundMean(x);
    if (idx == centroids.size()) {
      idx--;
    }
    Centroid c = centroids.get(idx);
    if (c.mean == x || discrete || idx == 0) {
      return c;
    }
    Centroid prev = centroids.get(idx - 1);
    double toPrev = Math.abs(prev.mean - x);
    double toC = Math.abs(c.mean - x);
    if (toPrev < toC) {
      return prev;
    } else if (toPrev > toC) {
      return c;
    }
    return random.nextBoolean() ? prev : c;
  }

  /** Inserts a centroid whose cumulative counts are estimated from {@code cumnBefore}. */
  private Centroid newCentroid(double x, long w, double cumnBefore) {
    Centroid c = new Centroid(x, w, cumnBefore + w, cumnBefore + w / 2.0);
    centroids.insert(c);
    n += w;
    if (w == 1) {
      singletons++;
    }
    return c;
  }

  /**
   * Adds weight at {@code x} to {@code nearest}. The shifted mean stays between its neighbours, so
   * the centroid keeps its position.
   */
  private void addWeight(Centroid nearest, double x, long w) {
    if (x != nearest.mean) {
      nearest.mean += w * (x - nearest.mean) / (nearest.n + w);
    }
    if (nearest.n == 1) {
      singletons--;
    }
    nearest.cumn += w;
    nearest.meanCumn += w / 2.0;
    nearest.n += w;
    n += w;
  }

  /**
   * Recomputes every centroid's cumulative counts with one left-to-right scan.
   *
   * @param exact when false, skip unless the total has grown by at least a factor of {@code cx}
   *     since the last refresh
   */
  void cumulate(boolean exact) {
    if (n == lastCumulate || !exact && cx != 0.0 && cx > (double) n / lastCumulate) {
      return;
    }
    double cumn = 0.0;
    for (Centroid c : centroids) {
      c.meanCumn = cumn + c.n / 2.0;
      cumn = c.cumn = cumn + c.n;
    }
    lastCumulate = n;
  }

  @Override
  public double pRank(double x) {
    checkArgument(!Double.isNaN(x), "cannot rank NaN");
    if (centroids.isEmpty()) {
      return Double.NaN;
    } else if (x < centroids.min().mean) {
      return 0.0;
    } else if (x > centroids.max().mean) {
      return 1.0;
    }
    cumulate(true);
    // lower.mean <= x < upper.mean, or lower == upper on an exact match
    int idx = centroids.upperBoundMean(x);
    Centroid lower = centroids.get(idx - 1);
    Centroid upper = lower.mean == x ? lower : centroids.get(idx);
    if (discrete) {
      return lower.cumn / n;
    }
    double cumn = lower.meanCumn;
    if (lower != upper) {
      cumn +=
          (x - lower.mean) * (upper.meanCumn - lower.meanCumn) / (upper.mean - lower.mean);
    }
    return cumn / n;
  }

  @Override
  public double[] pRank(double[] xs) {
    double[] ps = new double[xs.length];
    for (int i = 0; i < xs.length; i++) {
      ps[i] = pRank(xs[i]);
    }
    return ps;
  }

  /**
   * {@inheritDoc}
   *
   * <p>Discrete digests use the nearest-rank method (numpy's {@code interpolation='higher'}).
   */
  @Override
  public double percentile(double p) {
    checkArgument(p >= 0.0 && p <= 1.0, "percentile must be in [0, 1], got %s", p);
    if (centroids.isEmpty()) {
      return Double.NaN;
    }
    cumulate(true);
    double h = n * p;
    // lower.meanCumn <= h < upper.meanCumn; either may be missing past the ends
    int idx = centroids.upperBoundMeanCumn(h);
    Centroid lower = idx > 0 ? centroids.get(idx - 1) : null;
    Centroid upper;
    if (lower != null && lower.meanCumn == h) {
      upper = lower;
    } else {
      upper = idx < centroids.size() ? centroids.get(idx) : null;
    }

    if (lower == null) {
      return upper.mean;
    } else if (upper == null || upper == lower) {
      return lower.mean;
    } else if (!discrete) {
      return lower.mean
          + (h - lower.meanCumn) * (upper.mean - lower.mean) / (upper.meanCumn - lower.meanCumn);
    } else if (h <= lower.cumn) {
      return lower.mean;
    } else {
      return upper.mean;
    }
  }

  @Override
  public double[] percentile(double[] ps) {
    double[] qs = new double[ps.length];
    for (int i = 0; i < ps.length; i++) {
      qs[i] = percentile(ps[i]);
    }
    return qs;
  }

  /**
   * {@inheritDoc}
   *
   * <p>Monotonic input leaves every point at an extreme where it can never merge. Re-digesting the
   * centroids in shuffled order breaks that pattern. Calls made while a recompression is running
   * are ignored.
   */
  @Override
  public void compress() {
    if (compressing) {
      return;
    }
    List<Centroid> points = toArray(false);
    int before = points.size();
    reset();
    compressing = true;
    try {
      while (!points.isEmpty()) {
        // swap-remove keeps each pick uniform over the remaining points
        int idx = random.nextInt(points.size());
        Centroid picked = points.get(idx);
        points.set(idx, points.get(points.size() - 1));
        points.remove(points.size() - 1);
        digest(picked.mean, picked.n);
      }
      cumulate(true);
    } finally {
      compressing = false;
    }
    logger.debug("Recompressed {} centroids into {}", before, centroids.size());
  }

  @Override
  public String toString() {
    return "TDigest{" + "delta=" + delta + ", K=" + k + ", CX=" + cx + ", n=" + n
        + ", centroids=" + centroids.size() + '}';
  }
}
