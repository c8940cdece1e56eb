/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.flinkdigest.datamodel.DataPoint;
import dev.projectasap.flinkdigest.datamodel.Summary;
import java.io.Serializable;
import java.lang.reflect.InvocationTargetException;
import java.util.Map;
import org.apache.flink.api.common.functions.AggregateFunction;

/**
 * Configuration for a single aggregation function: its type, the package it lives in under {@code
 * dev.projectasap.flinkdigest.sketches}, its parameters and window size.
 */
public class AggregationConfig implements Serializable {
  public Integer aggregationId;
  public String aggregationType;
  public String aggregationSubType;
  public String aggregationPackage;
  public Map<String, String> parameters;
  public int tumblingWindowSize;

  /**
   * Serializes the aggregation configuration to JSON.
   *
   * @return JsonNode containing the configuration details
   */
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();

    jsonNode.put("aggregationId", this.aggregationId);
    jsonNode.put("aggregationType", this.aggregationType);
    jsonNode.put("aggregationSubType", this.aggregationSubType);
    jsonNode.put("aggregationPackage", this.aggregationPackage);
    jsonNode.putPOJO("parameters", this.parameters);
    jsonNode.put("tumblingWindowSize", this.tumblingWindowSize);

    return jsonNode;
  }

  /**
   * Instantiates the aggregation function based on configuration.
   *
   * @return the instantiated aggregation function
   * @throws IllegalArgumentException if the parameters are rejected by the function
   * @throws RuntimeException if the function class cannot be found or instantiated
   */
  @SuppressWarnings("unchecked")
  public AggregateFunction<DataPoint, ?, Summary> getAggregationFunction() {
    String className =
        "dev.projectasap.flinkdigest.sketches." + aggregationPackage + "." + aggregationType;
    try {
      Class<?> clazz = Class.forName(className);
      return (AggregateFunction<DataPoint, ?, Summary>)
          clazz.getConstructor(String.class, Map.class).newInstance(aggregationSubType, parameters);
    } catch (InvocationTargetException e) {
      if (e.getCause() instanceof IllegalArgumentException) {
        throw (IllegalArgumentException) e.getCause();
      }
      throw new RuntimeException("Failed to create aggregation function " + className, e);
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException("Failed to create aggregation function " + className, e);
    }
  }
}
