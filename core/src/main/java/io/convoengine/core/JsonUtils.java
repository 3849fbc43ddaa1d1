/*
 * Copyright 2025 The ConvoEngine Authors
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

package io.convoengine.core;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JsonUtils provides the shared ObjectMapper and the JSON conversions used
 * for engine event payloads and display events.
 */
public final class JsonUtils {

  private static final ObjectMapper objectMapper;
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  static {
    objectMapper = new ObjectMapper();
    objectMapper.registerModule(new JavaTimeModule());
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
  }

  private JsonUtils() {
    // Utility class
  }

  /**
   * Converts an object to JSON string.
   *
   * @param value
   *            the object to convert
   * @return the JSON string
   * @throws ConvoException
   *             if serialization fails
   */
  public static String toJson(Object value) throws ConvoException {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new ConvoException("Failed to serialize to JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Pretty prints a JSON object.
   *
   * @param value
   *            the object to print
   * @return the pretty-printed JSON string
   * @throws ConvoException
   *             if serialization fails
   */
  public static String toPrettyJson(Object value) throws ConvoException {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new ConvoException("Failed to serialize to JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Converts a loosely-typed value (a bean, a JsonNode or a map) into a string
   * keyed map. Event payloads arrive in whatever shape the engine produced, so
   * nested objects are normalized through this before being read.
   *
   * @param value
   *            the value to convert
   * @return the map view, never null
   * @throws ConvoException
   *             if the value cannot be represented as an object
   */
  public static Map<String, Object> toMap(Object value) throws ConvoException {
    if (value == null) {
      return Map.of();
    }
    try {
      return objectMapper.convertValue(value, MAP_TYPE);
    } catch (IllegalArgumentException e) {
      throw new ConvoException("Failed to convert " + value.getClass().getName() + " to a map: " + e.getMessage(),
          e);
    }
  }
}
