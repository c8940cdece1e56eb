/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.datamodel;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Accumulated state of a window aggregation. Uses self-referential generic type T to keep merges
 * type-safe.
 */
public interface Summary<T extends Summary<T>> extends SerializableToSink {

  /**
   * Execute a query on the accumulated data.
   *
   * @param params Query parameters, e.g. {"rank": 0.95} for a percentile or {"value": 12.5} for a
   *     percentile rank
   * @return Query result as JsonNode; empty when the parameters name no supported query
   */
  JsonNode query(JsonNode params);

  /**
   * Get the memory footprint of this accumulator in bytes, counting raw data only.
   *
   * @return Memory usage in bytes
   */
  long get_memory();

  /**
   * Add an observation to the accumulator.
   *
   * @param key The grouping key
   * @param value The observed value
   */
  void add(String key, Double value);

  /**
   * Merge another accumulator of the same type into a new accumulator. This operation should be
   * commutative and associative for correct parallel processing.
   *
   * @param other The accumulator to merge with
   * @return A new merged accumulator of type T
   */
  T merge(T other);
}
