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

import java.util.Map;

/**
 * StreamListener receives the raw event stream of an engine session. The
 * engine calls it from whatever thread runs the session's turn.
 *
 * <p>
 * Event names are the wire names listed in {@link StreamEventKind}; payload
 * keys are snake_case as produced by the engine.
 */
@FunctionalInterface
public interface StreamListener {

  /**
   * Handles one event.
   *
   * @param eventName
   *            the event name, e.g. {@code content_block:delta}
   * @param payload
   *            the event payload, possibly empty, never required to be well
   *            formed
   */
  void onEvent(String eventName, Map<String, Object> payload);
}
