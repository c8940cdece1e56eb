/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.sketches.tdigest;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.Serializable;
import java.util.Map;

/** Settings for a {@link Digest}. Instances are immutable; use {@link #builder()}. */
public final class DigestConfig implements Serializable {
  private static final long serialVersionUID = 1L;

  public static final double DEFAULT_RATIO = 0.9;
  public static final int DEFAULT_THRESH = 1000;

  private final DigestMode mode;
  private final double delta;
  private final int k;
  private final double cx;
  private final double ratio;
  private final int thresh;

  private DigestConfig(Builder builder) {
    checkArgument(
        builder.delta > 0.0 && builder.delta <= 1.0,
        "delta must be in (0, 1], got %s",
        builder.delta);
    checkArgument(builder.k >= 0, "K must be non-negative, got %s", builder.k);
    checkArgument(builder.cx >= 0.0, "CX must be non-negative, got %s", builder.cx);
    checkArgument(
        builder.ratio > 0.0 && builder.ratio <= 1.0,
        "ratio must be in (0, 1], got %s",
        builder.ratio);
    checkArgument(builder.thresh >= 0, "thresh must be non-negative, got %s", builder.thresh);
    this.mode = builder.mode;
    this.delta = builder.delta;
    this.k = builder.k;
    this.cx = builder.cx;
    this.ratio = builder.ratio;
    this.thresh = builder.thresh;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static DigestConfig defaults() {
    return builder().build();
  }

  /**
   * Reads settings from string parameters. Recognized keys are "mode", "delta", "K", "CX", "ratio"
   * and "thresh"; missing keys keep their defaults.
   *
   * @throws IllegalArgumentException if a value cannot be parsed or is out of range
   */
  public static DigestConfig fromParameters(Map<String, String> parameters) {
    Builder builder = builder();
    try {
      if (parameters.containsKey("mode")) {
        builder.mode(DigestMode.fromString(parameters.get("mode")));
      }
      if (parameters.containsKey("delta")) {
        builder.delta(Double.parseDouble(parameters.get("delta")));
      }
      if (parameters.containsKey("K")) {
        builder.k(Integer.parseInt(parameters.get("K")));
      }
      if (parameters.containsKey("CX")) {
        builder.cx(Double.parseDouble(parameters.get("CX")));
      }
      if (parameters.containsKey("ratio")) {
        builder.ratio(Double.parseDouble(parameters.get("ratio")));
      }
      if (parameters.containsKey("thresh")) {
        builder.thresh(Integer.parseInt(parameters.get("thresh")));
      }
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid digest parameter: " + e.getMessage(), e);
    }
    return builder.build();
  }

  public DigestMode getMode() {
    return mode;
  }

  /** Compression factor used whenever the digest is continuous. */
  public double getDelta() {
    return delta;
  }

  public int getK() {
    return k;
  }

  public double getCx() {
    return cx;
  }

  /** Fraction of single-observation centroids above which auto mode turns continuous. */
  public double getRatio() {
    return ratio;
  }

  /** Centroid count below which auto mode stays discrete. */
  public int getThresh() {
    return thresh;
  }

  @Override
  public String toString() {
    return "DigestConfig{" + "mode=" + mode + ", delta=" + delta + ", K=" + k + ", CX=" + cx
        + ", ratio=" + ratio + ", thresh=" + thresh + '}';
  }

  /** Builder for {@link DigestConfig}. */
  public static final class Builder {
    private DigestMode mode = DigestMode.AUTO;
    private double delta = TDigest.DEFAULT_DELTA;
    private int k = TDigest.DEFAULT_K;
    private double cx = TDigest.DEFAULT_CX;
    private double ratio = DEFAULT_RATIO;
    private int thresh = DEFAULT_THRESH;

    private Builder() {}

    public Builder mode(DigestMode mode) {
      this.mode = mode;
      return this;
    }

    public Builder delta(double delta) {
      this.delta = delta;
      return this;
    }

    public Builder k(int k) {
      this.k = k;
      return this;
    }

    public Builder cx(double cx) {
      this.cx = cx;
      return this;
    }

    public Builder ratio(double ratio) {
      this.ratio = ratio;
      return this;
    }

    public Builder thresh(int thresh) {
      this.thresh = thresh;
      return this;
    }

    public DigestConfig build() {
      return new DigestConfig(this);
    }
  }
}
