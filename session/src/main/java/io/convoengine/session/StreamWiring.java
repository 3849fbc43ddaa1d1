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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.convoengine.core.NotFoundException;

/**
 * StreamWiring installs per-turn callbacks on a conversation's handle, turning
 * low-level engine events into conversation-addressed display events.
 *
 * <p>
 * Every closure captures one conversation id and that conversation's
 * {@link ConversationState}. Wiring must happen before every turn, queued
 * follow-ups included, so that a finished turn's closures are replaced
 * before the next turn can emit anything.
 *
 * <p>
 * Once a conversation's {@code streamingCancelled} flag is set, its closures
 * stop producing display events. The engine keeps running until it finishes
 * the turn on its own.
 */
public class StreamWiring {

  private static final Logger logger = LoggerFactory.getLogger(StreamWiring.class);

  static final String STATUS_THINKING = "Thinking...";

  private final SessionRegistry registry;
  private final ConversationDisplay display;

  public StreamWiring(SessionRegistry registry, ConversationDisplay display) {
    this.registry = registry;
    this.display = display;
  }

  /**
   * Installs a fresh callback set on the conversation's handle.
   *
   * @param conversationId
   *            the conversation to wire
   * @param state
   *            the conversation's state, captured by every closure
   * @return the installed callbacks
   * @throws NotFoundException
   *             if the conversation has no handle
   */
  public StreamCallbacks wire(String conversationId, ConversationState state) {
    SessionHandle handle = registry.getHandle(conversationId)
        .orElseThrow(() -> new NotFoundException(conversationId));
    StreamCallbacks callbacks = buildCallbacks(conversationId, state);
    handle.install(callbacks);
    logger.debug("Wired stream callbacks for conversation {}", conversationId);
    return callbacks;
  }

  StreamCallbacks buildCallbacks(String conversationId, ConversationState state) {
    BlockTracker tracker = new BlockTracker();

    return StreamCallbacks.builder().onBlockStart((blockType, blockIndex) -> {
      if (state.isStreamingCancelled()) {
        return;
      }
      tracker.started = true;
      state.setStreamAccumulatedText("");
      display.onStreamBlockStart(conversationId, blockType);
    }).onBlockDelta((blockType, delta) -> {
      if (state.isStreamingCancelled()) {
        return;
      }
      String snapshot = state.appendStreamText(delta);
      state.setGotStreamContent(true);
      display.onStreamBlockDelta(conversationId, blockType, snapshot);
    }).onBlockEnd((blockType, finalText) -> {
      if (state.isStreamingCancelled()) {
        return;
      }
      boolean hadStart = tracker.started;
      tracker.started = false;
      String text = finalText != null && !finalText.isEmpty() ? finalText : state.getStreamAccumulatedText();
      if (!text.isEmpty()) {
        state.setGotStreamContent(true);
      }
      display.onStreamBlockEnd(conversationId, blockType, text, hadStart);
    }).onToolPre((toolName, toolInput) -> {
      if (state.isStreamingCancelled()) {
        return;
      }
      state.incrementToolCount();
      display.onStreamToolStart(conversationId, toolName, toolInput);
    }).onToolPost((toolName, toolInput, result) -> {
      if (state.isStreamingCancelled()) {
        return;
      }
      display.onStreamToolEnd(conversationId, toolName, toolInput, result);
    }).onExecutionStart(() -> {
      if (state.isStreamingCancelled()) {
        return;
      }
      display.updateStatus(conversationId, STATUS_THINKING);
    }).onExecutionEnd(() -> logger.debug("Execution ended for conversation {}", conversationId))
        .onUsageUpdate(() -> {
          if (state.isStreamingCancelled()) {
            return;
          }
          display.onStreamUsageUpdate(conversationId);
        }).build();
  }

  /** Whether the block currently streaming saw its start event. */
  private static final class BlockTracker {
    volatile boolean started;
  }
}
