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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * ConversationState holds the mutable per-conversation fields that the turn
 * driver and the wired stream callbacks share.
 *
 * <p>
 * A state belongs to exactly one conversation and is never shared. Fields are
 * volatile because three threads may touch them: the UI thread (submitting
 * and cancelling), the conversation's worker and the engine's emitting
 * thread. State transitions (IDLE, PROCESSING, CANCELLED) are made by
 * {@link ConversationManager} while holding this object's monitor.
 */
public class ConversationState {

  private final String conversationId;

  private volatile boolean processing;
  private volatile boolean streamingCancelled;
  private volatile String streamAccumulatedText = "";
  private volatile int toolCountThisTurn;
  private volatile boolean gotStreamContent;
  private volatile String queuedMessage;
  private volatile Instant processingStartTime;
  private volatile String title = "";
  private volatile String systemPrompt = "";

  private final List<Duration> responseTimes = new ArrayList<>();

  /**
   * Creates state for a conversation with a generated id.
   */
  public ConversationState() {
    this(UUID.randomUUID().toString());
  }

  /**
   * Creates state for the given conversation.
   *
   * @param conversationId
   *            the conversation id
   */
  public ConversationState(String conversationId) {
    this.conversationId = conversationId;
  }

  /**
   * Clears the per-turn fields ahead of a new turn.
   */
  void beginTurn(Instant now) {
    processing = true;
    streamingCancelled = false;
    streamAccumulatedText = "";
    toolCountThisTurn = 0;
    gotStreamContent = false;
    processingStartTime = now;
  }

  /**
   * Returns every turn field to its IDLE default and records how long the
   * turn took. The queued message is left alone.
   */
  void finishTurn(Instant now) {
    processing = false;
    streamingCancelled = false;
    streamAccumulatedText = "";
    toolCountThisTurn = 0;
    Instant started = processingStartTime;
    processingStartTime = null;
    if (started != null) {
      synchronized (responseTimes) {
        responseTimes.add(Duration.between(started, now));
      }
    }
  }

  public String getConversationId() {
    return conversationId;
  }

  public boolean isProcessing() {
    return processing;
  }

  public boolean isStreamingCancelled() {
    return streamingCancelled;
  }

  void setStreamingCancelled(boolean streamingCancelled) {
    this.streamingCancelled = streamingCancelled;
  }

  public String getStreamAccumulatedText() {
    return streamAccumulatedText;
  }

  void setStreamAccumulatedText(String streamAccumulatedText) {
    this.streamAccumulatedText = streamAccumulatedText != null ? streamAccumulatedText : "";
  }

  /**
   * Appends a streamed delta. Only the engine thread running this
   * conversation's turn calls this.
   *
   * @param delta
   *            the text to append
   * @return the accumulated text after the append
   */
  String appendStreamText(String delta) {
    String updated = streamAccumulatedText + delta;
    streamAccumulatedText = updated;
    return updated;
  }

  int incrementToolCount() {
    int updated = toolCountThisTurn + 1;
    toolCountThisTurn = updated;
    return updated;
  }

  public int getToolCountThisTurn() {
    return toolCountThisTurn;
  }

  public boolean isGotStreamContent() {
    return gotStreamContent;
  }

  void setGotStreamContent(boolean gotStreamContent) {
    this.gotStreamContent = gotStreamContent;
  }

  /**
   * Returns the follow-up message waiting for the current turn to finish.
   *
   * @return the queued message, or null if none
   */
  public String getQueuedMessage() {
    return queuedMessage;
  }

  void setQueuedMessage(String queuedMessage) {
    this.queuedMessage = queuedMessage;
  }

  /**
   * Returns when the current turn started.
   *
   * @return the start time, or null when idle
   */
  public Instant getProcessingStartTime() {
    return processingStartTime;
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title != null ? title : "";
  }

  /**
   * Returns the instructions prepended to every message sent from this
   * conversation.
   *
   * @return the system prompt, empty if none
   */
  public String getSystemPrompt() {
    return systemPrompt;
  }

  public void setSystemPrompt(String systemPrompt) {
    this.systemPrompt = systemPrompt != null ? systemPrompt : "";
  }

  /**
   * Returns the durations of completed turns, oldest first.
   *
   * @return a copy of the recorded response times
   */
  public List<Duration> getResponseTimes() {
    synchronized (responseTimes) {
      return new ArrayList<>(responseTimes);
    }
  }

  @Override
  public String toString() {
    return "ConversationState{conversationId='" + conversationId + "', processing=" + processing
        + ", streamingCancelled=" + streamingCancelled + ", queued=" + (queuedMessage != null) + "}";
  }
}
