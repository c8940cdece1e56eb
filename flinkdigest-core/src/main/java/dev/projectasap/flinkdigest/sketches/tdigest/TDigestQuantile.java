/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.sketches.tdigest;

import dev.projectasap.flinkdigest.datamodel.DataPoint;
import dev.projectasap.flinkdigest.datamodel.Summary;
import java.util.Map;
import org.apache.flink.api.common.functions.AggregateFunction;

/**
 * Aggregate function building a t-digest per window. Parameters follow {@link
 * DigestConfig#fromParameters(Map)}; all are optional.
 */
public class TDigestQuantile
    implements AggregateFunction<DataPoint, TDigestAccumulator, Summary> {
  private final String aggregationSubType;
  private final DigestConfig config;

  /**
   * Constructs a TDigestQuantile aggregate function.
   *
   * @param aggregationSubType the aggregation subtype, kept for configuration compatibility
   * @param parameters digest parameters ("mode", "delta", "K", "CX", "ratio", "thresh")
   * @throws IllegalArgumentException if a parameter is malformed or out of range
   */
  public TDigestQuantile(String aggregationSubType, Map<String, String> parameters) {
    this.aggregationSubType = aggregationSubType;
    this.config = DigestConfig.fromParameters(parameters);
  }

  public DigestConfig getConfig() {
    return config;
  }

  public String getAggregationSubType() {
    return aggregationSubType;
  }

  @Override
  public TDigestAccumulator createAccumulator() {
    return new TDigestAccumulator(config);
  }

  @Override
  public TDigestAccumulator add(DataPoint value, TDigestAccumulator acc) {
    acc.add(value.key, value.value, value.weight);
    return acc;
  }

  @Override
  public TDigestAccumulator merge(TDigestAccumulator a, TDigestAccumulator b) {
    return a.merge(b);
  }

  @Override
  public Summary getResult(TDigestAccumulator acc) {
    return acc;
  }
}
