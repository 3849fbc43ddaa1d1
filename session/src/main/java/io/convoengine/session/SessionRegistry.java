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

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.convoengine.core.ConfigurationException;
import io.convoengine.core.ConvoException;
import io.convoengine.core.EngineFailureException;
import io.convoengine.core.NotFoundException;
import io.convoengine.session.engine.EngineSession;
import io.convoengine.session.engine.ExecutionEngine;
import io.convoengine.session.engine.ProviderModel;
import io.convoengine.session.engine.SessionConfig;

/**
 * SessionRegistry owns the {@link SessionHandle}s of all open conversations,
 * keyed by conversation id.
 *
 * <p>
 * The handle map is the only mutable structure shared between conversations.
 * Changes to the map are serialized on one lock, but the engine is never
 * called while that lock is held: a conversation id is reserved first, its
 * session is created unlocked, and the handle is published afterwards. Slow
 * session creation in one conversation therefore never delays another.
 * Lookups and {@link #sendMessage} read the concurrent map directly.
 *
 * <p>
 * A session created without an explicit conversation id becomes the default
 * conversation. The accessors documented as "default conversation" exist for
 * single-conversation callers and should not be used when several
 * conversations are open.
 */
public class SessionRegistry {

  private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

  private final ExecutionEngine engine;
  private final Map<String, SessionHandle> handles = new ConcurrentHashMap<>();
  private final Set<String> pending = ConcurrentHashMap.newKeySet();
  private final Object lifecycleLock = new Object();
  private volatile String defaultConversationId;

  /**
   * Creates a registry backed by the given engine.
   *
   * @param engine
   *            the execution engine, shared by every handle
   */
  public SessionRegistry(ExecutionEngine engine) {
    if (engine == null) {
      throw new IllegalArgumentException("engine is required");
    }
    this.engine = engine;
  }

  /**
   * Starts a session under a generated conversation id and makes it the
   * default conversation.
   *
   * @param config
   *            the session configuration
   * @return the new handle
   */
  public SessionHandle createSession(SessionConfig config) {
    return createSession(null, config);
  }

  /**
   * Starts a session for a conversation.
   *
   * @param conversationId
   *            the conversation id, or null to generate one and make it the
   *            default conversation
   * @param config
   *            the session configuration
   * @return the new handle
   * @throws ConfigurationException
   *             if the conversation already has a live session
   * @throws EngineFailureException
   *             if the engine cannot create the session
   */
  public SessionHandle createSession(String conversationId, SessionConfig config) {
    SessionConfig effective = config != null ? config : SessionConfig.defaults();
    return register(conversationId, cid -> SessionHandle.create(cid, engine, effective));
  }

  /**
   * Resumes an engine session under a conversation.
   *
   * @param engineSessionId
   *            the engine-side id of the session to resume
   * @param conversationId
   *            the conversation id, or null to generate one and make it the
   *            default conversation
   * @param config
   *            the session configuration
   * @return the new handle
   * @throws ConfigurationException
   *             if the conversation already has a live session
   * @throws EngineFailureException
   *             if the engine cannot resume the session
   */
  public SessionHandle resumeSession(String engineSessionId, String conversationId, SessionConfig config) {
    SessionConfig effective = config != null ? config : SessionConfig.defaults();
    return register(conversationId, cid -> SessionHandle.resume(engineSessionId, cid, engine, effective));
  }

  private SessionHandle register(String conversationId, Function<String, SessionHandle> factory) {
    boolean autoGenerated = conversationId == null;
    String cid = autoGenerated ? UUID.randomUUID().toString() : conversationId;
    synchronized (lifecycleLock) {
      if (handles.containsKey(cid) || !pending.add(cid)) {
        throw new ConfigurationException(
            "Conversation '" + cid + "' already has a live session; end it before creating another", cid);
      }
    }

    // The engine call runs unlocked; the reservation keeps the id exclusive.
    SessionHandle handle = null;
    try {
      handle = factory.apply(cid);
    } finally {
      synchronized (lifecycleLock) {
        pending.remove(cid);
        if (handle != null) {
          handles.put(cid, handle);
          if (autoGenerated) {
            defaultConversationId = cid;
          }
        }
      }
    }
    logger.info("Started session {} for conversation {}", handle.getSessionId(), cid);
    return handle;
  }

  /**
   * Looks up a conversation's handle.
   *
   * @param conversationId
   *            the conversation id
   * @return the handle, or empty if the conversation has none
   */
  public Optional<SessionHandle> getHandle(String conversationId) {
    if (conversationId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(handles.get(conversationId));
  }

  /**
   * Returns a read-only snapshot of all registered handles.
   *
   * @return the handles keyed by conversation id
   */
  public Map<String, SessionHandle> activeHandles() {
    return Map.copyOf(handles);
  }

  /**
   * Drops a handle from the registry without ending its engine session.
   *
   * @param conversationId
   *            the conversation id
   */
  public void removeHandle(String conversationId) {
    if (conversationId == null) {
      return;
    }
    synchronized (lifecycleLock) {
      handles.remove(conversationId);
      if (conversationId.equals(defaultConversationId)) {
        defaultConversationId = null;
      }
    }
  }

  /**
   * Runs one turn on a conversation's session. Blocks the calling thread,
   * which should be the conversation's own worker, until the turn completes.
   *
   * @param conversationId
   *            the conversation id, or null for the default conversation
   * @param text
   *            the message to send
   * @return the engine's final response
   * @throws NotFoundException
   *             if the conversation has no live session
   * @throws EngineFailureException
   *             if the engine fails during the turn
   */
  public String sendMessage(String conversationId, String text) {
    String cid = conversationId != null ? conversationId : defaultConversationId;
    if (cid == null) {
      throw new NotFoundException("No conversation id and no default session", null);
    }
    SessionHandle handle = handles.get(cid);
    EngineSession session = handle != null ? handle.getSession() : null;
    if (session == null) {
      throw new NotFoundException(cid);
    }
    try {
      return session.execute(text);
    } catch (ConvoException e) {
      throw e;
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      throw new EngineFailureException(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e,
          cid);
    }
  }

  /**
   * Ends a conversation's session and removes its handle. Ending a
   * conversation that has no handle is a no-op, so calling this twice is safe.
   *
   * <p>
   * Engine teardown failures are logged and not propagated; the handle is
   * removed regardless.
   *
   * @param conversationId
   *            the conversation id, or null for the default conversation
   */
  public void endSession(String conversationId) {
    String cid = conversationId != null ? conversationId : defaultConversationId;
    if (cid == null) {
      return;
    }
    SessionHandle handle;
    synchronized (lifecycleLock) {
      handle = handles.remove(cid);
      if (cid.equals(defaultConversationId)) {
        defaultConversationId = null;
      }
    }
    if (handle == null) {
      return;
    }
    EngineSession session = handle.detach();
    if (session == null) {
      return;
    }
    try {
      engine.endSession(session);
      logger.info("Ended session {} for conversation {}", handle.getSessionId(), cid);
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      logger.warn("Failed to end session {} for conversation {}: {}", handle.getSessionId(), cid, e.getMessage());
      logger.debug("Session teardown failure detail", e);
    }
  }

  /**
   * Returns the default conversation's id.
   *
   * @return the id, or null when there is no default conversation
   */
  public String getDefaultConversationId() {
    return defaultConversationId;
  }

  private Optional<SessionHandle> defaultHandle() {
    return getHandle(defaultConversationId);
  }

  /** Default conversation: its engine session, or null. */
  public EngineSession getSession() {
    return defaultHandle().map(SessionHandle::getSession).orElse(null);
  }

  /** Default conversation: its engine session id, or null. */
  public String getSessionId() {
    return defaultHandle().map(SessionHandle::getSessionId).orElse(null);
  }

  /** Default conversation: its model name, or an empty string. */
  public String getModelName() {
    return defaultHandle().map(SessionHandle::getModelName).orElse("");
  }

  /** Default conversation: its context window, or 0. */
  public int getContextWindow() {
    return defaultHandle().map(SessionHandle::getContextWindow).orElse(0);
  }

  /** Default conversation: its input token total, or 0. */
  public long getTotalInputTokens() {
    return defaultHandle().map(SessionHandle::getTotalInputTokens).orElse(0L);
  }

  /** Default conversation: its output token total, or 0. */
  public long getTotalOutputTokens() {
    return defaultHandle().map(SessionHandle::getTotalOutputTokens).orElse(0L);
  }

  /** Default conversation: zeroes its counters, if there is one. */
  public void resetUsage() {
    defaultHandle().ifPresent(SessionHandle::resetUsage);
  }

  /** Default conversation: switches its model; false without a default. */
  public boolean switchModel(String modelName) {
    return defaultHandle().map(h -> h.switchModel(modelName)).orElse(false);
  }

  /** Default conversation: its provider models, or an empty list. */
  public List<ProviderModel> getProviderModels() {
    return defaultHandle().map(SessionHandle::providerModels).orElse(List.of());
  }
}
