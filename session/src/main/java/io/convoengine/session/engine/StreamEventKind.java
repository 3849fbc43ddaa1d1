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

package io.convoengine.session.engine;

import java.util.Optional;

/**
 * The low-level event kinds an execution engine emits while running a turn.
 */
public enum StreamEventKind {
  CONTENT_BLOCK_START("content_block:start"),
  CONTENT_BLOCK_DELTA("content_block:delta"),
  CONTENT_BLOCK_END("content_block:end"),
  TOOL_PRE("tool:pre"),
  TOOL_POST("tool:post"),
  EXECUTION_START("execution:start"),
  EXECUTION_END("execution:end"),
  LLM_RESPONSE("llm:response");

  private final String wireName;

  StreamEventKind(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the event name as the engine emits it.
   *
   * @return the wire name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a wire name.
   *
   * @param wireName
   *            the event name as emitted
   * @return the matching kind, or empty for unknown or null names
   */
  public static Optional<StreamEventKind> fromWireName(String wireName) {
    if (wireName == null) {
      return Optional.empty();
    }
    for (StreamEventKind kind : values()) {
      if (kind.wireName.equals(wireName)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return wireName;
  }
}
