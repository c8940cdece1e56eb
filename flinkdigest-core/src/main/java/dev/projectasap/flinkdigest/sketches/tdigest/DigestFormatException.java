/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.sketches.tdigest;

/** Raised when serialized digest bytes cannot be produced or understood. */
public class DigestFormatException extends RuntimeException {

  public DigestFormatException(String message) {
    super(message);
  }

  public DigestFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
