/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.sketches.tdigest;

import java.util.Locale;

/** Ingestion mode of a {@link Digest}. */
public enum DigestMode {
  /** Exact histogram, one centroid per distinct value. */
  DISCRETE,
  /** Compressing t-digest. */
  CONTINUOUS,
  /** Starts discrete, switches to continuous once the input looks continuous. */
  AUTO;

  /**
   * Parses a mode name. Accepts the enum names and the short forms "disc", "cont" and "auto".
   *
   * @throws IllegalArgumentException for anything else
   */
  public static DigestMode fromString(String name) {
    switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "disc":
      case "discrete":
        return DISCRETE;
      case "cont":
      case "continuous":
        return CONTINUOUS;
      case "auto":
        return AUTO;
      default:
        throw new IllegalArgumentException("Unknown digest mode '" + name + "'");
    }
  }
}
