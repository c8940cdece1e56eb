/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.datamodel;

import com.fasterxml.jackson.databind.JsonNode;

/** Objects that can be written to a sink as bytes or JSON. */
public interface SerializableToSink {
  byte[] serializeToBytes();

  JsonNode serializeToJson();

  default String serializeToString() {
    return serializeToJson().toString();
  }
}
