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

import java.util.Map;

/**
 * ConversationDisplay is the contract a UI frontend implements to receive
 * conversation-addressed events.
 *
 * <p>
 * Streaming methods ({@code onStream*}) are called from the conversation's
 * worker or the engine's emitting thread and always carry the conversation
 * id. Frontends that render on a single thread must marshal these calls onto
 * it themselves.
 *
 * <p>
 * Simple display methods accept a nullable conversation id; null means the
 * conversation the frontend currently shows. The single-argument overloads
 * exist for callers that only ever drive one conversation.
 */
public interface ConversationDisplay {

  void addSystemMessage(String conversationId, String text);

  void addUserMessage(String conversationId, String text);

  void addAssistantMessage(String conversationId, String text);

  void showError(String conversationId, String text);

  void updateStatus(String conversationId, String text);

  void startProcessing(String conversationId, String label);

  void finishProcessing(String conversationId);

  default void addSystemMessage(String text) {
    addSystemMessage(null, text);
  }

  default void addUserMessage(String text) {
    addUserMessage(null, text);
  }

  default void addAssistantMessage(String text) {
    addAssistantMessage(null, text);
  }

  default void showError(String text) {
    showError(null, text);
  }

  default void updateStatus(String text) {
    updateStatus(null, text);
  }

  default void startProcessing() {
    startProcessing(null, "Thinking");
  }

  default void finishProcessing() {
    finishProcessing(null);
  }

  void onStreamBlockStart(String conversationId, String blockType);

  /**
   * Called for every delta with the block's full text so far, not just the
   * new chunk.
   */
  void onStreamBlockDelta(String conversationId, String blockType, String accumulatedText);

  void onStreamBlockEnd(String conversationId, String blockType, String finalText, boolean hadBlockStart);

  void onStreamToolStart(String conversationId, String toolName, Map<String, Object> toolInput);

  void onStreamToolEnd(String conversationId, String toolName, Map<String, Object> toolInput, String result);

  void onStreamUsageUpdate(String conversationId);
}
