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

package io.convoengine.session.display;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.convoengine.session.SessionRegistry;
import io.convoengine.session.engine.EngineSession;
import io.convoengine.session.engine.ExecutionEngine;
import io.convoengine.session.engine.ModelInfo;
import io.convoengine.session.engine.SessionConfig;
import io.convoengine.session.engine.StreamListener;

/**
 * Unit tests for JsonEventDisplay.
 */
@ExtendWith(MockitoExtension.class)
class JsonEventDisplayTest {

  private static final Instant NOW = Instant.parse("2025-03-04T05:06:07Z");
  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Mock
  private ExecutionEngine mockEngine;

  @Mock
  private EngineSession mockSession;

  private List<String> lines;
  private SessionRegistry registry;
  private JsonEventDisplay display;

  @BeforeEach
  void setUp() {
    lines = new ArrayList<>();
    registry = new SessionRegistry(mockEngine);
    display = new JsonEventDisplay(lines::add, registry, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static JsonNode parse(String line) {
    try {
      return MAPPER.readTree(line);
    } catch (JsonProcessingException e) {
      return fail("Not a JSON event: " + line, e);
    }
  }

  private JsonNode last() {
    assertFalse(lines.isEmpty());
    return parse(lines.get(lines.size() - 1));
  }

  @Test
  void testRequiresSink() {
    assertThrows(IllegalArgumentException.class, () -> new JsonEventDisplay(null, registry));
  }

  @Test
  void testTextEvents() {
    display.addSystemMessage("t1", "sys");
    display.addUserMessage("t1", "usr");
    display.addAssistantMessage("t1", "Line 1\nLine 2");
    display.showError("t1", "bad");
    display.updateStatus("t1", "Ready");

    assertEquals(5, lines.size());
    String[] types = {"system_message", "user_message", "assistant_message", "error", "status"};
    for (int i = 0; i < types.length; i++) {
      JsonNode event = parse(lines.get(i));
      assertEquals(types[i], event.get("type").asText());
      assertEquals("t1", event.get("conversation_id").asText());
      assertEquals("2025-03-04T05:06:07Z", event.get("timestamp").asText());
    }
    assertEquals("Line 1\nLine 2", parse(lines.get(2)).get("text").asText());
  }

  @Test
  void testNullConversationUsesActive() {
    display.setActiveConversationId("shown");

    display.addSystemMessage("hello");

    assertEquals("shown", last().get("conversation_id").asText());
    assertEquals("hello", last().get("text").asText());
  }

  @Test
  void testNullConversationWithoutActive() {
    display.updateStatus(null, "idle");

    assertTrue(last().get("conversation_id").isNull());
  }

  @Test
  void testProcessingEvents() {
    display.startProcessing();
    assertEquals("processing_start", last().get("type").asText());
    assertEquals("Thinking", last().get("label").asText());

    display.finishProcessing("t1");
    assertEquals("processing_end", last().get("type").asText());
  }

  @Test
  void testStreamEvents() {
    display.onStreamBlockStart("t1", "thinking");
    assertEquals("stream_start", last().get("type").asText());
    assertEquals("thinking", last().get("block_type").asText());

    display.onStreamBlockDelta("t1", "text", "Hello wor");
    assertEquals("stream_delta", last().get("type").asText());
    assertEquals("Hello wor", last().get("text").asText());

    display.onStreamBlockEnd("t1", "text", "Hello world", true);
    assertEquals("stream_end", last().get("type").asText());
    assertEquals("Hello world", last().get("text").asText());
    assertTrue(last().get("had_block_start").asBoolean());
  }

  @Test
  void testToolEvents() {
    display.onStreamToolStart("t1", "edit_file", Map.of("file_path", "/tmp/test.py"));
    assertEquals("tool_start", last().get("type").asText());
    assertEquals("edit_file", last().get("tool_name").asText());
    assertEquals("/tmp/test.py", last().get("tool_input").get("file_path").asText());

    display.onStreamToolEnd("t1", "bash", null, "Error: command not found");
    assertEquals("tool_end", last().get("type").asText());
    assertEquals(0, last().get("tool_input").size());
    assertEquals("Error: command not found", last().get("result").asText());
  }

  @Test
  void testUsageUpdateReadsHandleTotals() throws Exception {
    when(mockEngine.createSession(any(SessionConfig.class), any(StreamListener.class))).thenReturn(mockSession);
    when(mockSession.getSessionId()).thenReturn("s-1");
    when(mockSession.getModelInfo()).thenReturn(new ModelInfo("claude-test", 1000));
    registry.createSession("t1", SessionConfig.builder().modelOverride(null).build());
    registry.getHandle("t1").orElseThrow().dispatch("llm:response",
        Map.of("usage", Map.of("input", 1500, "output", 500)));

    display.onStreamUsageUpdate("t1");

    JsonNode event = last();
    assertEquals("usage_update", event.get("type").asText());
    assertEquals(1500, event.get("input_tokens").asLong());
    assertEquals(500, event.get("output_tokens").asLong());
    assertEquals("claude-test", event.get("model").asText());
  }

  @Test
  void testUsageUpdateWithoutSessionIsZero() {
    display.onStreamUsageUpdate("t1");

    assertEquals(0, last().get("input_tokens").asLong());
    assertEquals("", last().get("model").asText());
  }

  @Test
  void testUsageUpdateWithoutRegistryEmitsNothing() {
    JsonEventDisplay bare = new JsonEventDisplay(lines::add, null);

    bare.onStreamUsageUpdate("t1");

    assertTrue(lines.isEmpty());
  }

  @Test
  void testFailingSinkIsContained() {
    JsonEventDisplay failing = new JsonEventDisplay(line -> {
      throw new IllegalStateException("socket closed");
    }, null);

    assertDoesNotThrow(() -> failing.addSystemMessage("t1", "lost"));
  }
}
