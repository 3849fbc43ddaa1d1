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

package io.convoengine.session;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import io.convoengine.core.EngineFailureException;
import io.convoengine.core.JsonUtils;
import io.convoengine.session.engine.EngineSession;
import io.convoengine.session.engine.ExecutionEngine;
import io.convoengine.session.engine.ModelInfo;
import io.convoengine.session.engine.ProviderModel;
import io.convoengine.session.engine.SessionConfig;
import io.convoengine.session.engine.StreamEventKind;

/**
 * SessionHandle isolates one conversation's engine session, its callback slots
 * and its token counters.
 *
 * <p>
 * The engine's event hook is bound to this handle's {@link #dispatch} when the
 * session is created and is never rewired, so routing an event to the right
 * conversation is structural rather than a lookup. Fields are written only by
 * {@code dispatch} (on the engine's thread) and by the turn that owns this
 * conversation; nothing servicing another conversation touches them.
 */
public class SessionHandle {

  private static final Logger logger = LoggerFactory.getLogger(SessionHandle.class);

  static final String DEFAULT_BLOCK_TYPE = "text";
  static final String UNKNOWN_TOOL = "unknown";

  private final String conversationId;
  private final int toolResultMaxChars;

  private volatile EngineSession session;
  private volatile String sessionId;
  private volatile StreamCallbacks callbacks = StreamCallbacks.NONE;

  // Single writer at a time: dispatch during a turn, resetUsage between turns.
  private volatile long totalInputTokens;
  private volatile long totalOutputTokens;
  private volatile String modelName = "";
  private volatile int contextWindow;

  SessionHandle(String conversationId, int toolResultMaxChars) {
    this.conversationId = conversationId;
    this.toolResultMaxChars = toolResultMaxChars;
  }

  /**
   * Creates a handle and asks the engine for a new session bound to it.
   *
   * @param conversationId
   *            the conversation the handle belongs to
   * @param engine
   *            the execution engine
   * @param config
   *            the session configuration
   * @return the new handle with a live session
   * @throws EngineFailureException
   *             if the engine cannot create the session
   */
  public static SessionHandle create(String conversationId, ExecutionEngine engine, SessionConfig config) {
    SessionHandle handle = new SessionHandle(conversationId, config.getToolResultMaxChars());
    EngineSession created;
    try {
      created = engine.createSession(config, handle::dispatch);
    } catch (Exception e) {
      throw new EngineFailureException("Could not start session: " + e.getMessage(), e, conversationId);
    }
    handle.attach(created, config);
    return handle;
  }

  /**
   * Creates a handle bound to a resumed engine session.
   *
   * @param engineSessionId
   *            the engine-side id of the session to resume
   * @param conversationId
   *            the conversation the handle belongs to
   * @param engine
   *            the execution engine
   * @param config
   *            the session configuration
   * @return the new handle with a live session
   * @throws EngineFailureException
   *             if the engine cannot resume the session
   */
  public static SessionHandle resume(String engineSessionId, String conversationId, ExecutionEngine engine,
      SessionConfig config) {
    SessionHandle handle = new SessionHandle(conversationId, config.getToolResultMaxChars());
    EngineSession resumed;
    try {
      resumed = engine.resumeSession(engineSessionId, config, handle::dispatch);
    } catch (Exception e) {
      throw new EngineFailureException("Failed to resume: " + e.getMessage(), e, conversationId);
    }
    handle.attach(resumed, config);
    return handle;
  }

  private void attach(EngineSession engineSession, SessionConfig config) {
    this.session = engineSession;
    this.sessionId = engineSession.getSessionId();
    if (config.getModelOverride() != null) {
      switchModel(config.getModelOverride());
    }
    resetUsage();
    extractModelInfo();
    logger.debug("Attached engine session {} to conversation {}", sessionId, conversationId);
  }

  /**
   * Routes one engine event to the matching callback slot.
   *
   * <p>
   * Never throws: unknown event names and malformed payloads are dropped, and
   * a failing callback is logged, so one conversation's bad event cannot take
   * down a turn in any other conversation.
   *
   * @param eventName
   *            the event's wire name
   * @param payload
   *            the event payload, may be null
   */
  public void dispatch(String eventName, Map<String, Object> payload) {
    Optional<StreamEventKind> kind = StreamEventKind.fromWireName(eventName);
    if (kind.isEmpty()) {
      logger.debug("Ignoring unknown event '{}' for conversation {}", eventName, conversationId);
      return;
    }
    Map<String, Object> data = payload != null ? payload : Map.of();
    StreamCallbacks slots = callbacks;
    try {
      switch (kind.get()) {
        case CONTENT_BLOCK_START :
          if (slots.getBlockStart() != null) {
            slots.getBlockStart().onBlockStart(stringValue(data, "block_type", DEFAULT_BLOCK_TYPE),
                intValue(data, "block_index", 0));
          }
          break;
        case CONTENT_BLOCK_DELTA :
          dispatchDelta(slots, data);
          break;
        case CONTENT_BLOCK_END :
          dispatchBlockEnd(slots, data);
          break;
        case TOOL_PRE :
          if (slots.getToolPre() != null) {
            slots.getToolPre().onToolPre(stringValue(data, "tool_name", UNKNOWN_TOOL), mapValue(data, "tool_input"));
          }
          break;
        case TOOL_POST :
          if (slots.getToolPost() != null) {
            slots.getToolPost().onToolPost(stringValue(data, "tool_name", UNKNOWN_TOOL),
                mapValue(data, "tool_input"), renderToolResult(data.get("result")));
          }
          break;
        case EXECUTION_START :
          run(slots.getExecutionStart());
          break;
        case EXECUTION_END :
          run(slots.getExecutionEnd());
          break;
        case LLM_RESPONSE :
          accumulateUsage(data);
          run(slots.getUsageUpdate());
          break;
        default :
          break;
      }
    } catch (RuntimeException e) {
      logger.warn("Dropped {} event for conversation {}: {}", eventName, conversationId, e.toString());
      logger.debug("Dispatch failure detail", e);
    }
  }

  private void dispatchDelta(StreamCallbacks slots, Map<String, Object> data) {
    String delta = firstNonEmpty(stringValue(data, "delta", ""), stringValue(data, "text", ""),
        stringValue(data, "content", ""));
    if (!delta.isEmpty() && slots.getBlockDelta() != null) {
      slots.getBlockDelta().onBlockDelta(stringValue(data, "block_type", DEFAULT_BLOCK_TYPE), delta);
    }
  }

  private void dispatchBlockEnd(StreamCallbacks slots, Map<String, Object> data) {
    if (slots.getBlockEnd() == null) {
      return;
    }
    Map<String, Object> block = mapValue(data, "block");
    String blockType = stringValue(block, "type", "");
    switch (blockType) {
      case "text" :
        slots.getBlockEnd().onBlockEnd("text", stringValue(block, "text", ""));
        break;
      case "thinking" :
      case "reasoning" :
        slots.getBlockEnd().onBlockEnd("thinking",
            firstNonEmpty(stringValue(block, "thinking", ""), stringValue(block, "text", "")));
        break;
      default :
        logger.debug("Ignoring end of '{}' block for conversation {}", blockType, conversationId);
        break;
    }
  }

  private void accumulateUsage(Map<String, Object> data) {
    Map<String, Object> usage = mapValue(data, "usage");
    if (!usage.isEmpty()) {
      totalInputTokens += longValue(usage, "input");
      totalOutputTokens += longValue(usage, "output");
    }
    String model = stringValue(data, "model", "");
    if (!model.isEmpty() && modelName.isEmpty()) {
      modelName = model;
    }
  }

  private String renderToolResult(Object result) {
    String text;
    if (result == null) {
      text = "";
    } else if (result instanceof Map || result instanceof Collection || result instanceof JsonNode) {
      text = JsonUtils.toPrettyJson(result);
    } else {
      text = result.toString();
    }
    return text.length() > toolResultMaxChars ? text.substring(0, toolResultMaxChars) : text;
  }

  private static void run(Runnable slot) {
    if (slot != null) {
      slot.run();
    }
  }

  private static String firstNonEmpty(String... values) {
    for (String value : values) {
      if (value != null && !value.isEmpty()) {
        return value;
      }
    }
    return "";
  }

  private static String stringValue(Map<String, Object> data, String key, String defaultValue) {
    Object value = data.get(key);
    return value != null ? value.toString() : defaultValue;
  }

  private static int intValue(Map<String, Object> data, String key, int defaultValue) {
    Object value = data.get(key);
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    if (value instanceof String) {
      try {
        return Integer.parseInt((String) value);
      } catch (NumberFormatException e) {
        return defaultValue;
      }
    }
    return defaultValue;
  }

  private static long longValue(Map<String, Object> data, String key) {
    Object value = data.get(key);
    return value instanceof Number ? ((Number) value).longValue() : 0L;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> mapValue(Map<String, Object> data, String key) {
    Object value = data.get(key);
    if (value == null) {
      return Map.of();
    }
    if (value instanceof Map) {
      return (Map<String, Object>) value;
    }
    return JsonUtils.toMap(value);
  }

  /**
   * Replaces all eight callback slots at once.
   *
   * @param newCallbacks
   *            the callback set for the coming turn, null to clear
   */
  public void install(StreamCallbacks newCallbacks) {
    this.callbacks = newCallbacks != null ? newCallbacks : StreamCallbacks.NONE;
  }

  /**
   * Returns the currently installed callback set.
   *
   * @return the callbacks, never null
   */
  public StreamCallbacks getCallbacks() {
    return callbacks;
  }

  /**
   * Zeroes the token counters and forgets the model name. Called between
   * turns, never while one is streaming.
   */
  public void resetUsage() {
    totalInputTokens = 0;
    totalOutputTokens = 0;
    modelName = "";
    contextWindow = 0;
  }

  /**
   * Reads model name and context window from the engine session.
   */
  public void extractModelInfo() {
    EngineSession current = session;
    if (current == null) {
      return;
    }
    try {
      ModelInfo info = current.getModelInfo();
      if (info != null) {
        if (!info.getModelName().isEmpty()) {
          modelName = info.getModelName();
        }
        contextWindow = info.getContextWindow();
      }
    } catch (RuntimeException e) {
      logger.debug("Failed to extract model info for conversation {}", conversationId, e);
    }
  }

  /**
   * Switches the active model on this handle's session.
   *
   * @param newModelName
   *            the model to switch to
   * @return true if the session accepted the switch
   */
  public boolean switchModel(String newModelName) {
    EngineSession current = session;
    if (current == null) {
      return false;
    }
    try {
      if (current.switchModel(newModelName)) {
        modelName = newModelName;
        return true;
      }
      return false;
    } catch (RuntimeException e) {
      logger.debug("Failed to switch model to {} for conversation {}", newModelName, conversationId, e);
      return false;
    }
  }

  /**
   * Lists the models offered by this session's providers.
   *
   * @return the provider models, empty without a session or on failure
   */
  public List<ProviderModel> providerModels() {
    EngineSession current = session;
    if (current == null) {
      return List.of();
    }
    try {
      List<ProviderModel> models = current.listProviderModels();
      return models != null ? List.copyOf(models) : List.of();
    } catch (RuntimeException e) {
      logger.debug("Failed to get provider models for conversation {}", conversationId, e);
      return List.of();
    }
  }

  /**
   * Clears the session reference and callbacks, returning the session so the
   * caller can tear it down.
   */
  EngineSession detach() {
    EngineSession detached = session;
    session = null;
    callbacks = StreamCallbacks.NONE;
    return detached;
  }

  public String getConversationId() {
    return conversationId;
  }

  /**
   * Returns the engine session.
   *
   * @return the session, or null once the handle has been ended
   */
  public EngineSession getSession() {
    return session;
  }

  public String getSessionId() {
    return sessionId;
  }

  public boolean isActive() {
    return session != null;
  }

  public long getTotalInputTokens() {
    return totalInputTokens;
  }

  public long getTotalOutputTokens() {
    return totalOutputTokens;
  }

  public String getModelName() {
    return modelName;
  }

  public int getContextWindow() {
    return contextWindow;
  }

  @Override
  public String toString() {
    return "SessionHandle{conversationId='" + conversationId + "', sessionId='" + sessionId + "'}";
  }
}
