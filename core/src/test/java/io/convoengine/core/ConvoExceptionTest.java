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

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for ConvoException and its subclasses.
 */
class ConvoExceptionTest {

  @Test
  void testConstructorWithMessageOnly() {
    ConvoException exception = new ConvoException("Test error message");

    assertEquals("Test error message", exception.getMessage());
    assertNull(exception.getCause());
    assertNull(exception.getErrorCode());
    assertNull(exception.getDetails());
    assertNull(exception.getConversationId());
  }

  @Test
  void testConstructorWithAllParameters() {
    RuntimeException cause = new RuntimeException("Root cause");
    Map<String, Object> details = Map.of("field", "value");

    ConvoException exception = new ConvoException("Boom", cause, "ERR_001", details, "conv-1");

    assertEquals("Boom", exception.getMessage());
    assertEquals(cause, exception.getCause());
    assertEquals("ERR_001", exception.getErrorCode());
    assertEquals(details, exception.getDetails());
    assertEquals("conv-1", exception.getConversationId());
  }

  @Test
  void testBuilder() {
    ConvoException exception = ConvoException.builder().message("Built").errorCode("X").conversationId("t1")
        .build();

    assertEquals("Built", exception.getMessage());
    assertEquals("X", exception.getErrorCode());
    assertEquals("t1", exception.getConversationId());
  }

  @Test
  void testBuilderRequiresMessage() {
    assertThrows(IllegalStateException.class, () -> ConvoException.builder().errorCode("X").build());
  }

  @Test
  void testNotFoundException() {
    NotFoundException exception = new NotFoundException("t1");

    assertTrue(exception instanceof ConvoException);
    assertEquals(NotFoundException.ERROR_CODE, exception.getErrorCode());
    assertEquals("t1", exception.getConversationId());
    assertTrue(exception.getMessage().contains("t1"));
  }

  @Test
  void testConfigurationException() {
    ConfigurationException exception = new ConfigurationException("already live", "t2");

    assertEquals(ConfigurationException.ERROR_CODE, exception.getErrorCode());
    assertEquals("t2", exception.getConversationId());
  }

  @Test
  void testEngineFailureExceptionKeepsCause() {
    IllegalStateException cause = new IllegalStateException("provider down");

    EngineFailureException exception = new EngineFailureException("turn failed", cause, "t3");

    assertEquals(EngineFailureException.ERROR_CODE, exception.getErrorCode());
    assertSame(cause, exception.getCause());
    assertEquals("t3", exception.getConversationId());
  }
}
