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

/**
 * Provides the session layer for running many independent conversations
 * against one execution engine at the same time.
 *
 * <p>
 * Each conversation owns a live engine session and its own turn state.
 * Events the engine emits while a turn runs are routed back to the
 * conversation that started it and never to another one.
 *
 * <h2>Key Components</h2>
 * <ul>
 * <li>{@link io.convoengine.session.SessionRegistry} - Creates, looks up and
 * ends the live session of each conversation</li>
 * <li>{@link io.convoengine.session.SessionHandle} - Owns one engine session,
 * its usage counters and the callbacks installed for the current turn</li>
 * <li>{@link io.convoengine.session.StreamWiring} - Builds the per-turn
 * callbacks that forward engine events to the display</li>
 * <li>{@link io.convoengine.session.ConversationManager} - Runs turns on a
 * per-conversation worker, queues follow-ups and handles cancellation</li>
 * </ul>
 *
 * <h2>Example Usage</h2>
 *
 * <pre>{@code
 * SessionRegistry registry = new SessionRegistry(engine);
 * ConversationManager manager = new ConversationManager(registry,
 * 		new JsonEventDisplay(websocket::send, registry));
 *
 * ConversationState state = manager.openConversation("t1");
 * manager.submit("t1", "List the files in this directory");
 * manager.submit("t1", "Now count them"); // queued until the first turn ends
 * manager.cancel("t1");
 * }</pre>
 */
package io.convoengine.session;
