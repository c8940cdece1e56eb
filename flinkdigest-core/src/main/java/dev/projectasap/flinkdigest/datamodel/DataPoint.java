/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.datamodel;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A single observation on the stream: a real value seen {@code weight} times at {@code timestamp},
 * tagged with a grouping key.
 */
@JsonPropertyOrder({"timestamp", "key", "value", "weight"})
public class DataPoint {
  public Long timestamp;
  public String key;
  public Double value;
  public Long weight;

  /** Default constructor, required for Flink POJO serialization. */
  public DataPoint() {
    this.timestamp = 0L;
    this.key = "";
    this.value = 0.0;
    this.weight = 1L;
  }

  public DataPoint(Long timestamp, String key, Double value) {
    this(timestamp, key, value, 1L);
  }

  /**
   * Constructs a DataPoint with specified values.
   *
   * @param timestamp the event timestamp
   * @param key the data key
   * @param value the observed value
   * @param weight how many times the value was observed
   */
  public DataPoint(Long timestamp, String key, Double value, Long weight) {
    this.timestamp = timestamp;
    this.key = key;
    this.value = value;
    this.weight = weight;
  }

  @Override
  public String toString() {
    return "DataPoint{"
        + "timestamp="
        + timestamp
        + ", key='"
        + key
        + '\''
        + ", value="
        + value
        + ", weight="
        + weight
        + '}';
  }
}
