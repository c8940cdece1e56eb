/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for loading streaming configuration from YAML files. Parses aggregation
 * configurations and parameters.
 */
public class ConfigLoader {
  private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

  /**
   * Loads streaming configuration from a YAML file.
   *
   * @param configFilePath path to the YAML configuration file
   * @return parsed streaming configuration
   * @throws IOException if file reading or parsing fails
   */
  public static StreamingConfig loadConfig(String configFilePath) throws IOException {
    try (InputStream in = Files.newInputStream(Paths.get(configFilePath))) {
      logger.info("Loading configuration from {}", configFilePath);
      return loadConfig(in);
    }
  }

  /**
   * Loads streaming configuration from YAML content.
   *
   * @param in stream of YAML content, left open
   * @return parsed streaming configuration
   * @throws IOException if reading or parsing fails, or a required field is missing
   */
  public static StreamingConfig loadConfig(InputStream in) throws IOException {
    ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    ObjectNode rootNode = mapper.readValue(in, ObjectNode.class);

    JsonNode aggregations = rootNode.get("aggregations");
    if (aggregations == null || !aggregations.isArray()) {
      throw new IOException("Configuration must contain an 'aggregations' list");
    }

    List<AggregationConfig> aggregationConfigs = new ArrayList<>();
    for (JsonNode node : aggregations) {
      AggregationConfig config = new AggregationConfig();
      config.aggregationId = required(node, "aggregationId").asInt();
      config.aggregationType = required(node, "aggregationType").asText();
      config.aggregationSubType = node.path("aggregationSubType").asText("");
      config.aggregationPackage = required(node, "aggregationPackage").asText();

      Map<String, String> parameters = new HashMap<>();
      node.path("parameters")
          .fields()
          .forEachRemaining(
              entry -> {
                parameters.put(entry.getKey(), entry.getValue().asText());
              });
      config.parameters = parameters;
      config.tumblingWindowSize = node.path("tumblingWindowSize").asInt(0);

      aggregationConfigs.add(config);
    }

    StreamingConfig streamingConfig = new StreamingConfig();
    streamingConfig.aggregationConfigs = aggregationConfigs;
    logger.debug("Loaded {} aggregation configurations", aggregationConfigs.size());
    return streamingConfig;
  }

  private static JsonNode required(JsonNode node, String field) throws IOException {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IOException("Aggregation is missing required field '" + field + "'");
    }
    return value;
  }
}
