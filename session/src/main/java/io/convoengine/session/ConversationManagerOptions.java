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

import io.convoengine.session.engine.SessionConfig;

/**
 * ConversationManagerOptions contains configuration options for
 * {@link ConversationManager}.
 */
public class ConversationManagerOptions {

  private final SessionConfig sessionConfig;
  private final Duration queuedDispatchDelay;
  private final Duration shutdownTimeout;

  private ConversationManagerOptions(Builder builder) {
    this.sessionConfig = builder.sessionConfig;
    this.queuedDispatchDelay = builder.queuedDispatchDelay;
    this.shutdownTimeout = builder.shutdownTimeout;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the config used when a turn has to create its conversation's
   * session.
   *
   * @return the session config
   */
  public SessionConfig getSessionConfig() {
    return sessionConfig;
  }

  /**
   * Returns the pause between the end of a turn and the dispatch of the
   * message queued behind it.
   *
   * @return the delay
   */
  public Duration getQueuedDispatchDelay() {
    return queuedDispatchDelay;
  }

  /**
   * Returns how long {@link ConversationManager#close()} waits for each
   * conversation's worker to stop.
   *
   * @return the timeout
   */
  public Duration getShutdownTimeout() {
    return shutdownTimeout;
  }

  /**
   * Builder for ConversationManagerOptions.
   */
  public static class Builder {
    private SessionConfig sessionConfig;
    private Duration queuedDispatchDelay = Duration.ofMillis(100);
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    public Builder sessionConfig(SessionConfig sessionConfig) {
      this.sessionConfig = sessionConfig;
      return this;
    }

    public Builder queuedDispatchDelay(Duration queuedDispatchDelay) {
      this.queuedDispatchDelay = queuedDispatchDelay;
      return this;
    }

    public Builder shutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    public ConversationManagerOptions build() {
      if (sessionConfig == null) {
        sessionConfig = SessionConfig.defaults();
      }
      if (queuedDispatchDelay == null || queuedDispatchDelay.isNegative()) {
        throw new IllegalStateException("queuedDispatchDelay must be zero or positive");
      }
      if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
        throw new IllegalStateException("shutdownTimeout must be zero or positive");
      }
      return new ConversationManagerOptions(this);
    }
  }
}
