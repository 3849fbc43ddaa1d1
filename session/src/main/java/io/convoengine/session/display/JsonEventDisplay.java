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

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.convoengine.core.JsonUtils;
import io.convoengine.session.ConversationDisplay;
import io.convoengine.session.SessionHandle;
import io.convoengine.session.SessionRegistry;

/**
 * JsonEventDisplay turns display calls into JSON event lines, one per call,
 * and hands them to a sink such as a websocket or a log.
 *
 * <p>
 * Every event carries {@code type}, {@code conversation_id} and
 * {@code timestamp}. A null conversation id resolves to the conversation set
 * with {@link #setActiveConversationId(String)}.
 */
public class JsonEventDisplay implements ConversationDisplay {

  private static final Logger logger = LoggerFactory.getLogger(JsonEventDisplay.class);

  private final Consumer<String> sink;
  private final SessionRegistry registry;
  private final Clock clock;

  private volatile String activeConversationId;

  /**
   * Creates a display writing to the given sink.
   *
   * @param sink
   *            receives each serialized event
   * @param registry
   *            used to read token totals for usage events, may be null
   */
  public JsonEventDisplay(Consumer<String> sink, SessionRegistry registry) {
    this(sink, registry, Clock.systemUTC());
  }

  /**
   * Creates a display with an explicit clock for the event timestamps.
   *
   * @param sink
   *            receives each serialized event
   * @param registry
   *            used to read token totals for usage events, may be null
   * @param clock
   *            the timestamp source
   */
  public JsonEventDisplay(Consumer<String> sink, SessionRegistry registry, Clock clock) {
    if (sink == null) {
      throw new IllegalArgumentException("sink is required");
    }
    this.sink = sink;
    this.registry = registry;
    this.clock = clock != null ? clock : Clock.systemUTC();
  }

  public String getActiveConversationId() {
    return activeConversationId;
  }

  public void setActiveConversationId(String activeConversationId) {
    this.activeConversationId = activeConversationId;
  }

  @Override
  public void addSystemMessage(String conversationId, String text) {
    emit(textEvent("system_message", conversationId, text));
  }

  @Override
  public void addUserMessage(String conversationId, String text) {
    emit(textEvent("user_message", conversationId, text));
  }

  @Override
  public void addAssistantMessage(String conversationId, String text) {
    emit(textEvent("assistant_message", conversationId, text));
  }

  @Override
  public void showError(String conversationId, String text) {
    emit(textEvent("error", conversationId, text));
  }

  @Override
  public void updateStatus(String conversationId, String text) {
    emit(textEvent("status", conversationId, text));
  }

  @Override
  public void startProcessing(String conversationId, String label) {
    Map<String, Object> event = event("processing_start", conversationId);
    event.put("label", label != null ? label : "Thinking");
    emit(event);
  }

  @Override
  public void finishProcessing(String conversationId) {
    emit(event("processing_end", conversationId));
  }

  @Override
  public void onStreamBlockStart(String conversationId, String blockType) {
    Map<String, Object> event = event("stream_start", conversationId);
    event.put("block_type", blockType);
    emit(event);
  }

  @Override
  public void onStreamBlockDelta(String conversationId, String blockType, String accumulatedText) {
    Map<String, Object> event = event("stream_delta", conversationId);
    event.put("block_type", blockType);
    event.put("text", accumulatedText);
    emit(event);
  }

  @Override
  public void onStreamBlockEnd(String conversationId, String blockType, String finalText, boolean hadBlockStart) {
    Map<String, Object> event = event("stream_end", conversationId);
    event.put("block_type", blockType);
    event.put("text", finalText);
    event.put("had_block_start", hadBlockStart);
    emit(event);
  }

  @Override
  public void onStreamToolStart(String conversationId, String toolName, Map<String, Object> toolInput) {
    Map<String, Object> event = event("tool_start", conversationId);
    event.put("tool_name", toolName);
    event.put("tool_input", toolInput != null ? toolInput : Map.of());
    emit(event);
  }

  @Override
  public void onStreamToolEnd(String conversationId, String toolName, Map<String, Object> toolInput,
      String result) {
    Map<String, Object> event = event("tool_end", conversationId);
    event.put("tool_name", toolName);
    event.put("tool_input", toolInput != null ? toolInput : Map.of());
    event.put("result", result);
    emit(event);
  }

  /**
   * Emits the conversation's running token totals. Nothing is emitted without
   * a registry.
   */
  @Override
  public void onStreamUsageUpdate(String conversationId) {
    if (registry == null) {
      return;
    }
    String resolved = resolve(conversationId);
    long inputTokens = 0;
    long outputTokens = 0;
    String model = "";
    SessionHandle handle = resolved != null ? registry.getHandle(resolved).orElse(null) : null;
    if (handle != null) {
      inputTokens = handle.getTotalInputTokens();
      outputTokens = handle.getTotalOutputTokens();
      model = handle.getModelName();
    }
    Map<String, Object> event = event("usage_update", conversationId);
    event.put("input_tokens", inputTokens);
    event.put("output_tokens", outputTokens);
    event.put("model", model);
    emit(event);
  }

  private Map<String, Object> textEvent(String type, String conversationId, String text) {
    Map<String, Object> event = event(type, conversationId);
    event.put("text", text != null ? text : "");
    return event;
  }

  private Map<String, Object> event(String type, String conversationId) {
    Map<String, Object> event = new LinkedHashMap<>();
    event.put("type", type);
    event.put("conversation_id", resolve(conversationId));
    return event;
  }

  private String resolve(String conversationId) {
    return conversationId != null ? conversationId : activeConversationId;
  }

  private void emit(Map<String, Object> event) {
    event.put("timestamp", clock.instant());
    String json = JsonUtils.toJson(event);
    try {
      sink.accept(json);
    } catch (RuntimeException e) {
      logger.warn("Event sink rejected {} event: {}", event.get("type"), e.getMessage(), e);
    }
  }
}
