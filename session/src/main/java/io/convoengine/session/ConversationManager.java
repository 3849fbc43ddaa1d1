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

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.convoengine.core.ConfigurationException;
import io.convoengine.core.ConvoException;
import io.convoengine.core.NotFoundException;
import io.convoengine.core.tracing.TurnTracer;

/**
 * ConversationManager drives turns for many conversations at once.
 *
 * <p>
 * Each open conversation gets its own single-threaded worker, so a long turn
 * only ever blocks its own conversation. Per conversation the manager runs a
 * small state machine:
 * <ul>
 * <li>IDLE: {@link #submit} starts a turn and moves to PROCESSING.</li>
 * <li>PROCESSING: {@link #submit} stores the text as the one queued follow-up,
 * replacing any earlier one. When the turn ends the follow-up is sent
 * automatically.</li>
 * <li>{@link #cancel} sets the conversation's cancellation flag. Stream
 * callbacks stop updating the display right away; the conversation returns to
 * IDLE once the engine call returns.</li>
 * </ul>
 *
 * <p>
 * Engine failures are caught at the worker boundary and reported through
 * {@link ConversationDisplay#showError(String, String)} for the failing
 * conversation only.
 */
public class ConversationManager implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(ConversationManager.class);

  static final String STATUS_READY = "Ready";
  static final String PROCESSING_LABEL = "Thinking";
  static final String CANCELLED_MESSAGE = "Generation cancelled.";
  static final String QUEUED_PREFIX = "Queued (will send after current response): ";
  static final int QUEUED_PREVIEW_CHARS = 80;
  static final int TITLE_MAX_CHARS = 50;
  static final String UNTITLED = "Untitled";

  private static final Pattern CODE_BLOCK = Pattern.compile("```.*?```", Pattern.DOTALL);
  private static final Pattern INLINE_CODE = Pattern.compile("`[^`]+`");
  private static final Pattern MARKDOWN_CHARS = Pattern.compile("[#*_~>\\[\\]()]");
  private static final Pattern URL = Pattern.compile("https?://\\S+");

  /** Outcome of {@link #submit}. */
  public enum SubmitResult {
    /** The message started a new turn. */
    STARTED,
    /** A turn is running; the message will be sent when it ends. */
    QUEUED,
    /** The message was blank and nothing happened. */
    IGNORED
  }

  private final SessionRegistry registry;
  private final ConversationDisplay display;
  private final StreamWiring wiring;
  private final ConversationManagerOptions options;
  private final TurnTracer tracer;
  private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();

  public ConversationManager(SessionRegistry registry, ConversationDisplay display) {
    this(registry, display, ConversationManagerOptions.builder().build());
  }

  public ConversationManager(SessionRegistry registry, ConversationDisplay display,
      ConversationManagerOptions options) {
    this(registry, display, options, new TurnTracer());
  }

  public ConversationManager(SessionRegistry registry, ConversationDisplay display,
      ConversationManagerOptions options, TurnTracer tracer) {
    this.registry = registry;
    this.display = display;
    this.options = options;
    this.tracer = tracer;
    this.wiring = new StreamWiring(registry, display);
  }

  /**
   * Opens a conversation under a generated id.
   *
   * @return the new conversation's state
   */
  public ConversationState openConversation() {
    return openConversation(null);
  }

  /**
   * Opens a conversation. The engine session is created lazily by the first
   * turn unless the caller creates it through the registry beforehand.
   *
   * @param conversationId
   *            the conversation id, or null to generate one
   * @return the new conversation's state
   * @throws ConfigurationException
   *             if the conversation is already open
   */
  public ConversationState openConversation(String conversationId) {
    String cid = conversationId != null ? conversationId : UUID.randomUUID().toString();
    Conversation created = new Conversation(new ConversationState(cid));
    if (conversations.putIfAbsent(cid, created) != null) {
      created.worker.shutdownNow();
      throw new ConfigurationException("Conversation '" + cid + "' is already open", cid);
    }
    logger.debug("Opened conversation {}", cid);
    return created.state;
  }

  /**
   * Closes a conversation: ends its engine session, stops its worker and
   * discards its state. Closing an unknown conversation is a no-op.
   *
   * <p>
   * This does not refuse to close a conversation that is mid-turn; callers
   * that need that rule check {@link #isProcessing(String)} first.
   *
   * @param conversationId
   *            the conversation to close
   */
  public void closeConversation(String conversationId) {
    Conversation conversation = conversationId != null ? conversations.remove(conversationId) : null;
    if (conversation == null) {
      return;
    }
    registry.endSession(conversationId);
    conversation.worker.shutdown();
    logger.debug("Closed conversation {}", conversationId);
  }

  /**
   * Returns a conversation's state.
   *
   * @param conversationId
   *            the conversation id
   * @return the state, or empty if the conversation is not open
   */
  public Optional<ConversationState> getState(String conversationId) {
    Conversation conversation = conversationId != null ? conversations.get(conversationId) : null;
    return Optional.ofNullable(conversation).map(c -> c.state);
  }

  /**
   * Tells whether a conversation has a turn in flight.
   *
   * @param conversationId
   *            the conversation id
   * @return true while the conversation is PROCESSING or CANCELLED
   */
  public boolean isProcessing(String conversationId) {
    return getState(conversationId).map(ConversationState::isProcessing).orElse(false);
  }

  /**
   * Returns the ids of all open conversations.
   *
   * @return a snapshot of the open conversation ids
   */
  public Set<String> conversationIds() {
    return Set.copyOf(conversations.keySet());
  }

  /**
   * Sends a message from a conversation, or queues it if a turn is running.
   *
   * @param conversationId
   *            the conversation id
   * @param text
   *            the message text
   * @return whether the message started a turn, was queued or was ignored
   * @throws NotFoundException
   *             if the conversation is not open
   */
  public SubmitResult submit(String conversationId, String text) {
    Conversation conversation = require(conversationId);
    String message = text != null ? text.strip() : "";
    if (message.isEmpty()) {
      return SubmitResult.IGNORED;
    }

    ConversationState state = conversation.state;
    boolean queued;
    synchronized (state) {
      queued = state.isProcessing();
      if (queued) {
        state.setQueuedMessage(message);
      } else {
        state.beginTurn(Instant.now());
      }
    }

    if (queued) {
      display.addSystemMessage(conversationId, QUEUED_PREFIX + preview(message));
      return SubmitResult.QUEUED;
    }
    display.addUserMessage(conversationId, message);
    display.startProcessing(conversationId, PROCESSING_LABEL);
    schedule(conversation, message, false, 0L);
    return SubmitResult.STARTED;
  }

  /**
   * Requests cancellation of a conversation's running turn.
   *
   * <p>
   * Cooperative: the stream callbacks stop forwarding events, an in-flight
   * tool call is allowed to finish, and the engine call completes in the
   * background. A follow-up queued before the cancel is discarded. Cancelling
   * an idle, unknown or already-cancelled conversation does nothing.
   *
   * @param conversationId
   *            the conversation to cancel
   * @return true if this call cancelled a running turn
   */
  public boolean cancel(String conversationId) {
    Conversation conversation = conversationId != null ? conversations.get(conversationId) : null;
    if (conversation == null) {
      return false;
    }
    ConversationState state = conversation.state;
    String discarded;
    synchronized (state) {
      if (!state.isProcessing() || state.isStreamingCancelled()) {
        return false;
      }
      state.setStreamingCancelled(true);
      discarded = state.getQueuedMessage();
      state.setQueuedMessage(null);
    }
    if (discarded != null) {
      logger.debug("Discarded queued message for cancelled conversation {}", conversationId);
    }
    display.addSystemMessage(conversationId, CANCELLED_MESSAGE);
    logger.info("Cancellation requested for conversation {}", conversationId);
    return true;
  }

  private void schedule(Conversation conversation, String message, boolean fromQueue, long delayMillis) {
    try {
      conversation.worker.schedule(() -> runTurn(conversation, message, fromQueue), delayMillis,
          TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.debug("Conversation {} closed before its turn could start", conversation.state.getConversationId());
      synchronized (conversation.state) {
        conversation.state.finishTurn(Instant.now());
      }
    }
  }

  private void runTurn(Conversation conversation, String message, boolean fromQueue) {
    ConversationState state = conversation.state;
    String cid = state.getConversationId();
    if (!isOpen(conversation)) {
      logger.debug("Skipping turn for closed conversation {}", cid);
      synchronized (state) {
        state.finishTurn(Instant.now());
      }
      return;
    }
    Map<String, Object> attributes = new HashMap<>();
    attributes.put(TurnTracer.ATTR_CONVERSATION_ID, cid);
    attributes.put(TurnTracer.ATTR_QUEUED, fromQueue);
    registry.getHandle(cid).ifPresent(h -> attributes.put(TurnTracer.ATTR_SESSION_ID, h.getSessionId()));

    try {
      tracer.inSpan("convo.turn", attributes, () -> {
        executeTurn(conversation, message);
        return null;
      });
    } catch (ConvoException e) {
      logger.debug("Turn failed for conversation {}", cid, e);
      if (!state.isStreamingCancelled() && isOpen(conversation)) {
        display.showError(cid, e.getMessage());
      }
    } catch (RuntimeException e) {
      logger.error("Unexpected failure in turn for conversation {}", cid, e);
      if (!state.isStreamingCancelled() && isOpen(conversation)) {
        display.showError(cid, e.toString());
      }
    } finally {
      completeTurn(conversation);
    }
  }

  private void executeTurn(Conversation conversation, String message) {
    ConversationState state = conversation.state;
    String cid = state.getConversationId();
    SessionHandle handle = registry.getHandle(cid).orElse(null);
    if (handle == null) {
      handle = registry.createSession(cid, options.getSessionConfig());
      // closeConversation removes the conversation before ending its session,
      // so a close that raced this creation is seen here or ends the session
      // itself.
      if (!isOpen(conversation)) {
        logger.debug("Conversation {} closed while its session was being created", cid);
        registry.endSession(cid);
        return;
      }
    }
    if (state.getTitle().isEmpty()) {
      state.setTitle(extractTitle(message));
    }

    handle.resetUsage();
    handle.extractModelInfo();
    wiring.wire(cid, state);

    String outgoing = message;
    if (!state.getSystemPrompt().isEmpty()) {
      outgoing = "[System instructions: " + state.getSystemPrompt() + "]\n\n" + message;
    }
    String response = registry.sendMessage(cid, outgoing);

    if (state.isStreamingCancelled()) {
      return;
    }
    if (!state.isGotStreamContent() && response != null && !response.isEmpty()) {
      display.addAssistantMessage(cid, response);
    }
  }

  private void completeTurn(Conversation conversation) {
    ConversationState state = conversation.state;
    String cid = state.getConversationId();
    String next;
    synchronized (state) {
      state.finishTurn(Instant.now());
      next = state.getQueuedMessage();
      if (next != null) {
        state.setQueuedMessage(null);
        state.beginTurn(Instant.now());
      }
    }

    display.finishProcessing(cid);
    display.updateStatus(cid, STATUS_READY);

    if (next != null) {
      logger.debug("Sending queued message for conversation {}", cid);
      display.addUserMessage(cid, next);
      display.startProcessing(cid, PROCESSING_LABEL);
      schedule(conversation, next, true, options.getQueuedDispatchDelay().toMillis());
    }
  }

  private boolean isOpen(Conversation conversation) {
    return conversations.get(conversation.state.getConversationId()) == conversation;
  }

  private Conversation require(String conversationId) {
    Conversation conversation = conversationId != null ? conversations.get(conversationId) : null;
    if (conversation == null) {
      throw new NotFoundException("Conversation '" + conversationId + "' is not open", conversationId);
    }
    return conversation;
  }

  private static String preview(String message) {
    return message.length() > QUEUED_PREVIEW_CHARS ? message.substring(0, QUEUED_PREVIEW_CHARS) : message;
  }

  /**
   * Derives a short conversation title from a user message: markdown, code
   * and links are stripped and the first line is cut at a word boundary.
   */
  static String extractTitle(String message) {
    String text = CODE_BLOCK.matcher(message).replaceAll("");
    text = INLINE_CODE.matcher(text).replaceAll("");
    text = MARKDOWN_CHARS.matcher(text).replaceAll("");
    text = URL.matcher(text).replaceAll("");
    text = text.strip();
    if (text.isEmpty()) {
      return UNTITLED;
    }
    String firstLine = text.split("\n", 2)[0].strip();
    if (firstLine.length() > TITLE_MAX_CHARS) {
      String cut = firstLine.substring(0, TITLE_MAX_CHARS);
      int space = cut.lastIndexOf(' ');
      firstLine = (space > 0 ? cut.substring(0, space) : cut) + "...";
    }
    return firstLine;
  }

  /**
   * Closes every open conversation and waits for their workers to stop.
   */
  @Override
  public void close() {
    List<Conversation> closing = new ArrayList<>();
    for (String cid : conversationIds()) {
      Conversation conversation = conversations.get(cid);
      if (conversation != null) {
        closing.add(conversation);
      }
      closeConversation(cid);
    }
    long timeoutMillis = options.getShutdownTimeout().toMillis();
    for (Conversation conversation : closing) {
      try {
        if (!conversation.worker.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
          logger.warn("Worker for conversation {} did not stop within {} ms",
              conversation.state.getConversationId(), timeoutMillis);
          conversation.worker.shutdownNow();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        conversation.worker.shutdownNow();
        return;
      }
    }
  }

  /** A conversation's state together with the worker that runs its turns. */
  private static final class Conversation {
    final ConversationState state;
    final ScheduledExecutorService worker;

    Conversation(ConversationState state) {
      this.state = state;
      this.worker = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "convo-worker-" + state.getConversationId());
        thread.setDaemon(true);
        return thread;
      });
    }
  }
}
