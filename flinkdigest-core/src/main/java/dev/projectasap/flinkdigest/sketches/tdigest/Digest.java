/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.sketches.tdigest;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link TDigest} that can start as an exact histogram and turn into a compressing digest when
 * the input looks continuous. In {@link DigestMode#AUTO}, once at least {@code thresh} centroids
 * exist and more than {@code ratio} of them hold a single observation, the digest switches to
 * {@link DigestMode#CONTINUOUS} for good and recompresses once.
 *
 * <p>Not thread-safe.
 */
public class Digest implements QuantileDigest {
  private static final Logger logger = LoggerFactory.getLogger(Digest.class);

  private final DigestConfig config;
  private final TDigest engine;
  private DigestMode mode;

  public Digest() {
    this(DigestConfig.defaults());
  }

  public Digest(DigestConfig config) {
    this(config, new TDigest(initialDelta(config), config.getK(), config.getCx()));
  }

  Digest(DigestConfig config, TDigest engine) {
    this.config = config;
    this.mode = config.getMode();
    this.engine = engine;
  }

  private static double initialDelta(DigestConfig config) {
    return config.getMode() == DigestMode.CONTINUOUS ? config.getDelta() : TDigest.DISCRETE;
  }

  public DigestMode getMode() {
    return mode;
  }

  public DigestConfig getConfig() {
    return config;
  }

  public boolean isDiscrete() {
    return engine.isDiscrete();
  }

  /**
   * Switches an auto-mode digest to continuous mode when the input looks continuous.
   *
   * @return true on the transition from discrete to continuous
   */
  public boolean checkContinuous() {
    if (mode != DigestMode.AUTO || engine.size() < config.getThresh()) {
      return false;
    }
    long unique = engine.singletonCount();
    int before = engine.size();
    if ((double) unique / before > config.getRatio()) {
      switchToContinuous();
      logger.info(
          "Switched to continuous mode after {} samples: {} of {} centroids unique, {} after"
              + " recompression",
          engine.getN(),
          unique,
          before,
          engine.size());
      return true;
    }
    return false;
  }

  /** Leaves discrete mode for good, recompressing what has been digested so far. */
  void switchToContinuous() {
    mode = DigestMode.CONTINUOUS;
    engine.configure(config.getDelta());
    engine.compress();
  }

  /**
   * Replaces the contents with a serialized digest. A continuous payload puts this digest in
   * continuous mode; a discrete payload leaves auto mode in place.
   *
   * @return this digest
   * @throws DigestFormatException if the bytes are not a serialized digest
   */
  public Digest load(byte[] bytes) {
    engine.load(bytes);
    if (!engine.isDiscrete()) {
      mode = DigestMode.CONTINUOUS;
    } else if (mode != DigestMode.AUTO) {
      mode = DigestMode.DISCRETE;
    }
    return this;
  }

  @Override
  public void push(double x) {
    engine.push(x);
    checkContinuous();
  }

  @Override
  public void push(double x, long n) {
    engine.push(x, n);
    checkContinuous();
  }

  @Override
  public void push(double[] xs) {
    engine.push(xs);
    checkContinuous();
  }

  @Override
  public void push(double[] xs, long n) {
    engine.push(xs, n);
    checkContinuous();
  }

  @Override
  public void pushCentroid(Centroid c) {
    engine.pushCentroid(c);
    checkContinuous();
  }

  @Override
  public void pushCentroids(List<Centroid> cs) {
    engine.pushCentroids(cs);
    checkContinuous();
  }

  @Override
  public double percentile(double p) {
    return engine.percentile(p);
  }

  @Override
  public double[] percentile(double[] ps) {
    return engine.percentile(ps);
  }

  @Override
  public double pRank(double x) {
    return engine.pRank(x);
  }

  @Override
  public double[] pRank(double[] xs) {
    return engine.pRank(xs);
  }

  @Override
  public void compress() {
    engine.compress();
  }

  @Override
  public int size() {
    return engine.size();
  }

  @Override
  public long getN() {
    return engine.getN();
  }

  @Override
  public List<Centroid> toArray() {
    return engine.toArray();
  }

  @Override
  public List<Centroid> toArray(boolean everything) {
    return engine.toArray(everything);
  }

  @Override
  public String summary() {
    return engine.summary();
  }

  @Override
  public byte[] asBytes() {
    return engine.asBytes();
  }

  @Override
  public byte[] asSmallBytes() {
    return engine.asSmallBytes();
  }

  @Override
  public void reset() {
    engine.reset();
  }

  @Override
  public String toString() {
    return "Digest{" + "mode=" + mode + ", engine=" + engine + '}';
  }
}
