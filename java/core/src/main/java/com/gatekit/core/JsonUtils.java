/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package com.gatekit.core;

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JsonUtils holds the shared Jackson mapper used for configuration documents,
 * JSON responses and the cache statistics snapshot. Durations and instants are
 * written as ISO-8601 strings; unknown properties are ignored on read.
 */
public final class JsonUtils {

  private static final ObjectMapper objectMapper;

  static {
    objectMapper = new ObjectMapper();
    objectMapper.registerModule(new JavaTimeModule());
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    objectMapper.configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false);
    objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
  }

  private JsonUtils() {
    // Utility class
  }

  /**
   * Returns the shared ObjectMapper instance.
   *
   * @return the ObjectMapper
   */
  public static ObjectMapper getObjectMapper() {
    return objectMapper;
  }

  /**
   * Serializes a value, typically a response body or a stats snapshot.
   *
   * @param value
   *            the object to convert
   * @return the JSON string
   * @throws GatekitException
   *             if serialization fails
   */
  public static String toJson(Object value) throws GatekitException {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new GatekitException("Failed to serialize to JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Parses a JSON string to a JsonNode.
   *
   * @param json
   *            the JSON string
   * @return the JsonNode
   * @throws GatekitException
   *             if parsing fails
   */
  public static JsonNode parseJson(String json) throws GatekitException {
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new GatekitException("Failed to parse JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Reads a JSON document from a stream. The stream is not closed.
   *
   * @param in
   *            the input stream
   * @return the JsonNode
   * @throws GatekitException
   *             if reading or parsing fails
   */
  public static JsonNode parseJson(InputStream in) throws GatekitException {
    try {
      return objectMapper.readTree(in);
    } catch (IOException e) {
      throw new GatekitException("Failed to parse JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Converts a JsonNode to an object of the specified class.
   *
   * @param node
   *            the JsonNode
   * @param clazz
   *            the target class
   * @param <T>
   *            the target type
   * @return the converted object
   * @throws GatekitException
   *             if conversion fails
   */
  public static <T> T fromJsonNode(JsonNode node, Class<T> clazz) throws GatekitException {
    try {
      return objectMapper.treeToValue(node, clazz);
    } catch (JsonProcessingException e) {
      throw new GatekitException("Failed to convert JsonNode: " + e.getMessage(), e);
    }
  }
}
