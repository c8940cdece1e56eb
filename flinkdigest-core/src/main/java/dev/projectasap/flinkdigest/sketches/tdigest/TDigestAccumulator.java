/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.sketches.tdigest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.flinkdigest.datamodel.Summary;
import java.util.Base64;

/**
 * Accumulator holding a {@link Digest}. Answers percentile queries ({"rank": p}) and percentile
 * rank queries ({"value": x}).
 */
public class TDigestAccumulator implements Summary<TDigestAccumulator> {
  public Digest digest;
  private final DigestConfig config;
  private long count;

  public TDigestAccumulator(DigestConfig config) {
    this.config = config;
    this.digest = new Digest(config);
  }

  @Override
  public void add(String key, Double value) {
    add(key, value, 1L);
  }

  /**
   * Adds a weighted observation. Keys are ignored; the digest tracks the value distribution only.
   *
   * @param weight how many times the value was observed, 1 when null
   */
  public void add(String key, Double value, Long weight) {
    long n = weight == null ? 1L : weight;
    digest.push(value, n);
    count += n;
  }

  @Override
  public TDigestAccumulator merge(TDigestAccumulator other) {
    TDigestAccumulator merged = new TDigestAccumulator(this.config);
    if (!this.digest.isDiscrete() || !other.digest.isDiscrete()) {
      // weighted centroids would never look unique enough to trigger the switch
      merged.digest.switchToContinuous();
    }
    merged.digest.pushCentroids(this.digest.toArray());
    merged.digest.pushCentroids(other.digest.toArray());
    merged.count = this.count + other.count;
    return merged;
  }

  @Override
  public byte[] serializeToBytes() {
    return digest.asSmallBytes();
  }

  @Override
  public String serializeToString() {
    return digest.summary();
  }

  @Override
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode rootNode = objectMapper.createObjectNode();

    byte[] sketchBytes = digest.asSmallBytes();
    rootNode.put("sketch_bytes", Base64.getEncoder().encodeToString(sketchBytes));
    rootNode.put("count", count);
    rootNode.put("centroids", digest.size());
    rootNode.put("mode", digest.getMode().name());

    return rootNode;
  }

  /**
   * Execute query operations on the digest.
   *
   * @param params JsonNode with "rank" (a fraction in [0, 1]) for a percentile, and/or "value" for
   *     the percentile rank of that value
   */
  @Override
  public JsonNode query(JsonNode params) {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode queryResult = objectMapper.createObjectNode();

    if (params != null && params.has("rank")) {
      double rank = params.get("rank").asDouble();
      if (rank >= 0.0 && rank <= 1.0) {
        queryResult.put("rank_" + rank, digest.percentile(rank));
      }
    }
    if (params != null && params.has("value")) {
      double value = params.get("value").asDouble();
      if (!Double.isNaN(value)) {
        queryResult.put("prank_" + value, digest.pRank(value));
      }
    }

    return queryResult;
  }

  @Override
  public long get_memory() {
    // Manual calculation: one double mean and one long weight per centroid
    return (long) digest.size() * (Double.BYTES + Long.BYTES);
  }

  /**
   * Returns the total weight added to this accumulator.
   *
   * @return the total count of items
   */
  public long get_count() {
    return count;
  }
}
